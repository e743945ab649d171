// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.multisig;

import sh.sigil.core.crypto.eip712.Eip712Domain;
import sh.sigil.core.crypto.eip712.TypedData;
import sh.sigil.core.types.Hash;

/**
 * An action the signer set can authorize.
 *
 * <p>Each action signs as an EIP-712 struct whose last field is the wallet
 * nonce the approval is bound to:
 * <pre>
 * Execute(address target,uint256 value,bytes payload,uint256 nonce)
 * UpdateQuorum(uint256 newQuorum,uint256 nonce)
 * UpdateSigner(address signer,bool shouldTrust,uint256 nonce)
 * </pre>
 */
public sealed interface MultisigAction permits Execute, UpdateQuorum, UpdateSigner {

    /**
     * EIP-712 primary type name of the signed struct.
     */
    String primaryType();

    /**
     * {@code keccak256} of the canonical struct type string.
     */
    Hash typeHash();

    /**
     * {@code hashStruct} of this action bound to {@code nonce}.
     *
     * @param nonce the wallet nonce, non-negative
     * @return the struct hash
     */
    Hash structHash(long nonce);

    /**
     * This action bound to {@code nonce} as signable typed data.
     *
     * @param domain the wallet's signing domain
     * @param nonce the wallet nonce, non-negative
     * @return typed data whose {@link TypedData#hash()} is the digest to sign
     */
    TypedData<?> typedData(Eip712Domain domain, long nonce);
}
