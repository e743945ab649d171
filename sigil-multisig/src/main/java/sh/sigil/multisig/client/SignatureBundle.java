// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.multisig.client;

import java.util.List;
import java.util.Objects;

import sh.sigil.core.crypto.Signature;

/**
 * Collected approvals for one action, in submission order.
 *
 * @param primaryType the approved action's primary type
 * @param nonce       the wallet nonce the approvals are bound to
 * @param signatures  signatures ascending by signer address
 */
public record SignatureBundle(String primaryType, long nonce, List<Signature> signatures) {

    public SignatureBundle {
        Objects.requireNonNull(primaryType, "primaryType");
        Objects.requireNonNull(signatures, "signatures");
        if (nonce < 0) {
            throw new IllegalArgumentException("nonce must be non-negative, got " + nonce);
        }
        signatures = List.copyOf(signatures);
    }
}
