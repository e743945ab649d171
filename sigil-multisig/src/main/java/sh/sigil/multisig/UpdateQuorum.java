// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.multisig;

import java.math.BigInteger;
import java.util.List;

import sh.sigil.core.crypto.eip712.Eip712Domain;
import sh.sigil.core.crypto.eip712.TypeDefinition;
import sh.sigil.core.crypto.eip712.TypedData;
import sh.sigil.core.crypto.eip712.TypedDataField;
import sh.sigil.core.types.Hash;

/**
 * Replace the number of signatures required per action.
 *
 * <p>Zero is accepted and makes every later action pass with no signatures.
 * No check against the size of the signer set is made.
 *
 * @param newQuorum the new threshold, non-negative
 */
public record UpdateQuorum(long newQuorum) implements MultisigAction {

    public static final String PRIMARY_TYPE = "UpdateQuorum";

    /**
     * {@code keccak256("UpdateQuorum(uint256 newQuorum,uint256 nonce)")}
     */
    public static final Hash TYPEHASH = new Hash(
        "0x85bf243ffaa9e85f5c47a8959fc5b10066a057617ae8358d7b990cd2a86e7814");

    public static final TypeDefinition<Message> DEFINITION = TypeDefinition.forRecord(
        Message.class,
        PRIMARY_TYPE,
        List.of(
            TypedDataField.of("newQuorum", "uint256"),
            TypedDataField.of("nonce", "uint256")
        )
    );

    public record Message(BigInteger newQuorum, BigInteger nonce) {}

    public UpdateQuorum {
        if (newQuorum < 0) {
            throw new IllegalArgumentException("newQuorum must be non-negative, got " + newQuorum);
        }
    }

    public Message message(long nonce) {
        return new Message(BigInteger.valueOf(newQuorum), NonceSequencer.toUint(nonce));
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
