// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.core.crypto;

import java.util.Objects;

import org.bouncycastle.jcajce.provider.digest.Keccak;

/**
 * Original Keccak-256, as used for digests, type hashes, domain separators,
 * event topics and address derivation. This is not NIST SHA3-256; the padding
 * differs.
 *
 * <p>Each thread reuses one BouncyCastle digest. Call {@link #cleanup()} from
 * pooled threads owned by a container that outlives the wallet.
 *
 * @since 0.1.0
 */
public final class Keccak256 {

    private static final ThreadLocal<Keccak.Digest256> DIGEST = ThreadLocal.withInitial(Keccak.Digest256::new);

    private Keccak256() {}

    /**
     * Hashes the concatenation of {@code parts} without building it.
     *
     * @return the 32-byte hash
     * @throws NullPointerException if {@code parts} or any part is null
     */
    public static byte[] hash(final byte[]... parts) {
        Objects.requireNonNull(parts, "parts");
        final Keccak.Digest256 digest = DIGEST.get();
        digest.reset();
        for (byte[] part : parts) {
            digest.update(Objects.requireNonNull(part, "part"));
        }
        return digest.digest();
    }

    public static void cleanup() {
        DIGEST.remove();
    }
}
