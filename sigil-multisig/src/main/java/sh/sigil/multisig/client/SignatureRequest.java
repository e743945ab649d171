// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.multisig.client;

import java.util.Objects;

import sh.sigil.core.crypto.eip712.Eip712Domain;
import sh.sigil.core.types.Hash;
import sh.sigil.multisig.DigestBuilder;
import sh.sigil.multisig.MultisigAction;

/**
 * A decoded signing request: an action bound to a nonce under a wallet's domain.
 *
 * @param domain the wallet's signing domain
 * @param action the action to approve
 * @param nonce  the wallet nonce the approval is bound to
 */
public record SignatureRequest(Eip712Domain domain, MultisigAction action, long nonce) {

    public SignatureRequest {
        Objects.requireNonNull(domain, "domain");
        Objects.requireNonNull(action, "action");
        if (nonce < 0) {
            throw new IllegalArgumentException("nonce must be non-negative, got " + nonce);
        }
    }

    /**
     * The digest a signer approves by signing this request.
     */
    public Hash digest() {
        return DigestBuilder.buildDigest(domain.separator(), action, nonce);
    }
}
