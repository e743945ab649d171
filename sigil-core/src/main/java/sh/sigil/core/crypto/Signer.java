// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.core.crypto;

import sh.sigil.core.types.Address;
import sh.sigil.core.types.Hash;

/**
 * A signing identity that can approve digests off-platform.
 * <p>
 * Implementations may be backed by local private keys, a KMS or a hardware
 * wallet.
 */
public interface Signer {

    /**
     * Returns the address associated with this signer.
     *
     * @return the signer's address
     */
    Address address();

    /**
     * Signs a 32-byte digest as-is, with no message prefix applied.
     * <p>
     * Typed-data digests already carry their {@code 0x19 0x01} prefix, so the
     * hash is signed directly. The returned signature uses {@code v} = 27 or 28.
     *
     * @param digest the digest to sign
     * @return the signature
     */
    Signature signHash(Hash digest);
}
