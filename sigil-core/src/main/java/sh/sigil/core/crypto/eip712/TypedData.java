// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.core.crypto.eip712;

import java.util.Map;
import java.util.Objects;

import sh.sigil.core.crypto.Keccak256;
import sh.sigil.core.crypto.Signature;
import sh.sigil.core.crypto.Signer;
import sh.sigil.core.error.Eip712Exception;
import sh.sigil.core.types.Hash;

/**
 * Type-safe EIP-712 typed data container.
 *
 * <p>Encapsulates a domain, type definition, and message for signing or hashing.
 *
 * <pre>{@code
 * var domain = Eip712Domain.builder()
 *     .name("Treasury")
 *     .version("1")
 *     .chainId(1L)
 *     .verifyingContract(walletAddress)
 *     .build();
 *
 * var typedData = TypedData.create(domain, UpdateQuorum.DEFINITION, message);
 *
 * Signature sig = typedData.sign(signer);
 * Hash hash = typedData.hash();
 * }</pre>
 *
 * @param <T> the message type (typically a record)
 * @see <a href="https://eips.ethereum.org/EIPS/eip-712">EIP-712</a>
 */
public final class TypedData<T> {

    /** EIP-712 prefix: 0x19 0x01 */
    private static final byte[] EIP712_PREFIX = new byte[] { 0x19, 0x01 };

    private final Eip712Domain domain;
    private final TypeDefinition<T> definition;
    private final T message;

    private TypedData(Eip712Domain domain, TypeDefinition<T> definition, T message) {
        this.domain = Objects.requireNonNull(domain, "domain");
        this.definition = Objects.requireNonNull(definition, "definition");
        this.message = Objects.requireNonNull(message, "message");
    }

    /**
     * Creates typed data from a domain, type definition, and message.
     *
     * @param <T> the message type
     * @param domain     the EIP-712 domain
     * @param definition the type definition with field mappings
     * @param message    the message instance
     * @return typed data ready for signing or hashing
     */
    public static <T> TypedData<T> create(
            Eip712Domain domain,
            TypeDefinition<T> definition,
            T message) {
        return new TypedData<>(domain, definition, message);
    }

    /**
     * Creates signable typed data from a raw payload, typically one parsed by
     * {@link TypedDataJson}.
     *
     * @param payload the raw payload
     * @return typed data over the payload's message map
     */
    public static TypedData<Map<String, Object>> fromPayload(TypedDataPayload payload) {
        Objects.requireNonNull(payload, "payload");
        final TypeDefinition<Map<String, Object>> definition;
        try {
            definition = TypeDefinition.forMap(payload.primaryType(), payload.fields());
        } catch (IllegalArgumentException e) {
            throw new Eip712Exception("Invalid struct definition: " + e.getMessage(), e);
        }
        return new TypedData<>(payload.domain(), definition, payload.message());
    }

    /**
     * Computes {@code hashStruct(message)} for a message under a definition.
     *
     * @param <T> the message type
     * @param definition the type definition
     * @param message the message
     * @return the 32-byte struct hash
     */
    public static <T> Hash hashStruct(TypeDefinition<T> definition, T message) {
        Objects.requireNonNull(definition, "definition");
        Objects.requireNonNull(message, "message");
        Map<String, Object> messageData = definition.extractor().apply(message);
        return Hash.fromBytes(StructHasher.hashStruct(definition.primaryType(), definition.fields(), messageData));
    }

    /**
     * Combines a precomputed domain separator and struct hash into the
     * signable digest: {@code keccak256(0x19 0x01 || domainSeparator || structHash)}.
     *
     * @param domainSeparator the domain separator
     * @param structHash the struct hash of the message
     * @return the 32-byte digest
     */
    public static Hash digest(Hash domainSeparator, Hash structHash) {
        Objects.requireNonNull(domainSeparator, "domainSeparator");
        Objects.requireNonNull(structHash, "structHash");
        byte[] toHash = new byte[2 + 32 + 32];
        System.arraycopy(EIP712_PREFIX, 0, toHash, 0, 2);
        System.arraycopy(domainSeparator.toBytes(), 0, toHash, 2, 32);
        System.arraycopy(structHash.toBytes(), 0, toHash, 34, 32);
        return Hash.fromBytes(Keccak256.hash(toHash));
    }

    /**
     * Computes the EIP-712 hash without signing:
     * {@code keccak256("\x19\x01" || domainSeparator || hashStruct(message))}
     *
     * @return the 32-byte EIP-712 hash
     */
    public Hash hash() {
        return digest(domain.separator(), hashStruct(definition, message));
    }

    /**
     * Signs this typed data. The returned signature has v=27 or v=28.
     *
     * @param signer the signer to use
     * @return signature with v=27 or v=28
     */
    public Signature sign(Signer signer) {
        Objects.requireNonNull(signer, "signer");
        return signer.signHash(hash());
    }

    public Eip712Domain domain() {
        return domain;
    }

    /**
     * Returns the primary type name (e.g., "Execute").
     */
    public String primaryType() {
        return definition.primaryType();
    }

    public T message() {
        return message;
    }

    public TypeDefinition<T> definition() {
        return definition;
    }

    /**
     * Returns the message as a field-name to value map, as the encoder sees it.
     */
    public Map<String, Object> messageData() {
        return definition.extractor().apply(message);
    }
}
