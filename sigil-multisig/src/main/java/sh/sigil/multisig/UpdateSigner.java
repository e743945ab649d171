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

/**
 * Add ({@code shouldTrust = true}) or remove an identity from the signer set.
 * Setting a membership to its current value is allowed and still consumes a nonce.
 *
 * @param signer      the identity
 * @param shouldTrust the new membership
 */
public record UpdateSigner(Address signer, boolean shouldTrust) implements MultisigAction {

    public static final String PRIMARY_TYPE = "UpdateSigner";

    /**
     * {@code keccak256("UpdateSigner(address signer,bool shouldTrust,uint256 nonce)")}
     */
    public static final Hash TYPEHASH = new Hash(
        "0xe8215553482e87e79e569510febbad79fcd0cb116418b7ad11fb14951df68218");

    public static final TypeDefinition<Message> DEFINITION = TypeDefinition.forRecord(
        Message.class,
        PRIMARY_TYPE,
        List.of(
            TypedDataField.of("signer", "address"),
            TypedDataField.of("shouldTrust", "bool"),
            TypedDataField.of("nonce", "uint256")
        )
    );

    public record Message(Address signer, Boolean shouldTrust, BigInteger nonce) {}

    public UpdateSigner {
        Objects.requireNonNull(signer, "signer");
    }

    public Message message(long nonce) {
        return new Message(signer, shouldTrust, NonceSequencer.toUint(nonce));
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
