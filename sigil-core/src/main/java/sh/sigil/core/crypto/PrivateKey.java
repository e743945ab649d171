// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.core.crypto;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

import javax.security.auth.Destroyable;

import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.signers.HMacDSAKCalculator;
import org.bouncycastle.math.ec.ECAlgorithms;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.math.ec.FixedPointCombMultiplier;
import org.bouncycastle.util.BigIntegers;

import sh.sigil.core.types.Address;
import sh.sigil.primitives.Hex;

/**
 * A secp256k1 signing key, and the inverse operation: recovering the address
 * that produced a signature over a digest.
 *
 * <pre>{@code
 * PrivateKey key = PrivateKey.fromHex("0x59c6...");
 * Signature signature = key.sign(digest);
 * assert PrivateKey.recoverAddress(digest, signature).equals(key.toAddress());
 * }</pre>
 *
 * <p>{@link #destroy()} drops the scalar. {@link BigInteger} is immutable so
 * the old value cannot be wiped, but every later use fails.
 *
 * @since 0.1.0
 */
public final class PrivateKey implements Destroyable {

    private static final int KEY_BYTES = 32;
    private static final X9ECParameters SECP256K1 = CustomNamedCurves.getByName("secp256k1");
    private static final BigInteger N = SECP256K1.getN();
    private static final BigInteger HALF_N = N.shiftRight(1);
    private static final ECPoint G = SECP256K1.getG();
    private static final FixedPointCombMultiplier MULTIPLIER = new FixedPointCombMultiplier();

    private volatile BigInteger scalar;
    private volatile ECPoint point;

    private PrivateKey(final byte[] keyBytes) {
        try {
            if (keyBytes.length != KEY_BYTES) {
                throw new IllegalArgumentException("Private key must be 32 bytes, got " + keyBytes.length);
            }
            final BigInteger d = new BigInteger(1, keyBytes);
            if (d.signum() == 0 || d.compareTo(N) >= 0) {
                throw new IllegalArgumentException("Private key is outside [1, n)");
            }
            this.scalar = d;
            this.point = MULTIPLIER.multiply(G, d).normalize();
        } finally {
            Arrays.fill(keyBytes, (byte) 0);
        }
    }

    /**
     * @param hexString 32 bytes of hex, prefix optional
     * @throws IllegalArgumentException if the text is not hex or the key is out of range
     */
    public static PrivateKey fromHex(final String hexString) {
        Objects.requireNonNull(hexString, "hexString");
        return new PrivateKey(Hex.decode(hexString));
    }

    /**
     * Takes ownership of {@code keyBytes}; the array is zeroed before this returns.
     */
    public static PrivateKey fromBytes(final byte[] keyBytes) {
        Objects.requireNonNull(keyBytes, "keyBytes");
        return new PrivateKey(keyBytes);
    }

    /**
     * @throws IllegalStateException after {@link #destroy()}
     */
    public Address toAddress() {
        return addressOf(live(point));
    }

    /**
     * Signs a 32-byte digest as is, with an RFC 6979 nonce. The result is
     * low-s with v of 0 or 1, taken from the parity of R.y.
     *
     * @throws IllegalStateException after {@link #destroy()}
     */
    public Signature sign(final byte[] digest) {
        requireDigest(digest);
        final BigInteger d = live(scalar);
        final BigInteger z = new BigInteger(1, digest);
        final HMacDSAKCalculator nonces = new HMacDSAKCalculator(new SHA256Digest());
        nonces.init(N, d, digest);

        while (true) {
            final BigInteger k = nonces.nextK();
            final ECPoint rPoint = MULTIPLIER.multiply(G, k).normalize();
            final BigInteger r = rPoint.getAffineXCoord().toBigInteger().mod(N);
            if (r.signum() == 0) {
                continue;
            }
            BigInteger s = k.modInverse(N).multiply(z.add(r.multiply(d))).mod(N);
            if (s.signum() == 0) {
                continue;
            }
            int v = rPoint.getAffineYCoord().toBigInteger().testBit(0) ? 1 : 0;
            if (s.compareTo(HALF_N) > 0) {
                // (r, n - s) signs for -R, which flips the y parity
                s = N.subtract(s);
                v ^= 1;
            }
            return new Signature(word(r), word(s), v);
        }
    }

    /**
     * Recovers the address whose key produced {@code signature} over {@code digest}.
     *
     * @throws IllegalArgumentException if no point can be recovered, which includes
     *         r or s of zero or at least n and an r that is not an x-coordinate
     */
    public static Address recoverAddress(final byte[] digest, final Signature signature) {
        requireDigest(digest);
        Objects.requireNonNull(signature, "signature");
        final BigInteger r = new BigInteger(1, signature.r());
        final BigInteger s = new BigInteger(1, signature.s());
        if (!inRange(r) || !inRange(s)) {
            throw new IllegalArgumentException("Signature component out of range");
        }

        final ECPoint rPoint;
        try {
            final byte[] compressed = new byte[1 + KEY_BYTES];
            compressed[0] = (byte) ((signature.recoveryId() & 1) == 1 ? 0x03 : 0x02);
            System.arraycopy(word(r), 0, compressed, 1, KEY_BYTES);
            rPoint = SECP256K1.getCurve().decodePoint(compressed);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("r is not the x-coordinate of a curve point", e);
        }

        // Q = r^-1 (sR - eG)
        final BigInteger rInv = r.modInverse(N);
        final BigInteger e = new BigInteger(1, digest);
        final ECPoint q = ECAlgorithms.sumOfTwoMultiplies(
            rPoint, s.multiply(rInv).mod(N),
            G, N.subtract(e).multiply(rInv).mod(N)).normalize();
        if (q.isInfinity()) {
            throw new IllegalArgumentException("Signature recovers to the point at infinity");
        }
        return addressOf(q);
    }

    @Override
    public void destroy() {
        synchronized (this) {
            scalar = null;
            point = null;
        }
    }

    @Override
    public boolean isDestroyed() {
        return scalar == null;
    }

    /**
     * Shows the derived address, never key material.
     */
    @Override
    public String toString() {
        final ECPoint p = point;
        return p == null ? "PrivateKey[destroyed]" : "PrivateKey[address=" + addressOf(p) + "]";
    }

    private <T> T live(final T value) {
        if (value == null) {
            throw new IllegalStateException("PrivateKey has been destroyed");
        }
        return value;
    }

    private static Address addressOf(final ECPoint p) {
        // uncompressed encoding is 0x04 || x || y; the address hashes x || y
        final byte[] xy = p.getEncoded(false);
        final byte[] hash = Keccak256.hash(Arrays.copyOfRange(xy, 1, xy.length));
        return Address.fromBytes(Arrays.copyOfRange(hash, 12, 32));
    }

    private static byte[] word(final BigInteger v) {
        return BigIntegers.asUnsignedByteArray(KEY_BYTES, v);
    }

    private static boolean inRange(final BigInteger v) {
        return v.signum() > 0 && v.compareTo(N) < 0;
    }

    private static void requireDigest(final byte[] digest) {
        Objects.requireNonNull(digest, "digest");
        if (digest.length != 32) {
            throw new IllegalArgumentException("Digest must be 32 bytes, got " + digest.length);
        }
    }
}
