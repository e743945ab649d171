// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.multisig;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

import sh.sigil.core.crypto.eip712.Eip712Domain;
import sh.sigil.core.crypto.eip712.TypeDefinition;
import sh.sigil.core.crypto.eip712.TypedData;
import sh.sigil.core.crypto.eip712.TypedDataField;
import sh.sigil.core.types.Address;
import sh.sigil.core.types.Hash;
import sh.sigil.core.types.HexData;
import sh.sigil.core.types.Wei;

/**
 * Call {@code target} with {@code value} attached and {@code payload} as call data.
 *
 * <p>The payload is opaque; it is never inspected or validated.
 *
 * @param target  the address to call
 * @param value   native value forwarded with the call
 * @param payload call data, possibly empty
 */
public record Execute(Address target, Wei value, HexData payload) implements MultisigAction {

    public static final String PRIMARY_TYPE = "Execute";

    /**
     * {@code keccak256("Execute(address target,uint256 value,bytes payload,uint256 nonce)")}
     */
    public static final Hash TYPEHASH = new Hash(
        "0x2d38a1f0ad75969000ea6dcd51396cdc874f11e8680ec292ed492eefca949dec");

    public static final TypeDefinition<Message> DEFINITION = TypeDefinition.forRecord(
        Message.class,
        PRIMARY_TYPE,
        List.of(
            TypedDataField.of("target", "address"),
            TypedDataField.of("value", "uint256"),
            TypedDataField.of("payload", "bytes"),
            TypedDataField.of("nonce", "uint256")
        )
    );

    /**
     * The signed struct: this action plus the nonce.
     */
    public record Message(Address target, BigInteger value, HexData payload, BigInteger nonce) {}

    public Execute {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(payload, "payload");
    }

    public Message message(long nonce) {
        return new Message(target, value.value(), payload, NonceSequencer.toUint(nonce));
    }

    @Override
    public String primaryType() {
        return PRIMARY_TYPE;
    }

    @Override
    public Hash typeHash() {
        return TYPEHASH;
    }

    @Override
    public Hash structHash(long nonce) {
        return TypedData.hashStruct(DEFINITION, message(nonce));
    }

    @Override
    public TypedData<Message> typedData(Eip712Domain domain, long nonce) {
        return TypedData.create(domain, DEFINITION, message(nonce));
    }
}
