// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.multisig;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.sigil.core.crypto.PrivateKey;
import sh.sigil.core.crypto.Signature;
import sh.sigil.core.types.Address;
import sh.sigil.core.types.Hash;

/**
 * secp256k1 public-key recovery.
 *
 * <p>A malformed signature (bad {@code v}, {@code r} or {@code s} out of range,
 * no point on the curve) recovers to {@link Address#ZERO} instead of throwing,
 * the way {@code ecrecover} does. The zero address can never pass
 * verification.
 */
public final class EcdsaSignerRecovery implements SignerRecovery {

    private static final Logger log = LoggerFactory.getLogger(EcdsaSignerRecovery.class);

    public static final EcdsaSignerRecovery INSTANCE = new EcdsaSignerRecovery();

    private EcdsaSignerRecovery() {
    }

    @Override
    public Address recover(final Hash digest, final Signature signature) {
        Objects.requireNonNull(digest, "digest");
        Objects.requireNonNull(signature, "signature");
        try {
            return PrivateKey.recoverAddress(digest.toBytes(), signature);
        } catch (IllegalArgumentException e) {
            log.debug("Unrecoverable signature {} over {}: {}", signature, digest.value(), e.getMessage());
            return Address.ZERO;
        }
    }
}
