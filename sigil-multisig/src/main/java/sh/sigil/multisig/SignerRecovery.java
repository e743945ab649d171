// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.multisig;

import sh.sigil.core.crypto.Signature;
import sh.sigil.core.types.Address;
import sh.sigil.core.types.Hash;

/**
 * Recovers the identity that produced a signature over a digest.
 */
@FunctionalInterface
public interface SignerRecovery {

    /**
     * @param digest    the signed digest
     * @param signature the signature
     * @return the signer, or {@link Address#ZERO} if the signature is unrecoverable
     */
    Address recover(Hash digest, Signature signature);
}
