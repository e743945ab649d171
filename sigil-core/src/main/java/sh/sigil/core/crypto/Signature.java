// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.core.crypto;

import java.util.Arrays;
import java.util.Objects;

import sh.sigil.primitives.Hex;

/**
 * ECDSA signature over a 32-byte digest.
 *
 * <p>
 * A signature consists of three components:
 * <ul>
 * <li><b>r</b>: first 32 bytes of the signature</li>
 * <li><b>s</b>: second 32 bytes of the signature</li>
 * <li><b>v</b>: recovery ID, either raw ({@code 0}/{@code 1}) or offset by 27
 * ({@code 27}/{@code 28}) as typed-data wallets return it</li>
 * </ul>
 *
 * <p>
 * The constructor accepts any {@code v} so that malformed signatures received
 * from outside can still be represented and rejected during recovery.
 *
 * @param r first 32 bytes of signature
 * @param s second 32 bytes of signature
 * @param v recovery ID
 * @since 0.1.0
 */
public record Signature(byte[] r, byte[] s, int v) {

    private static final int COMPONENT_LENGTH = 32;

    public Signature {
        Objects.requireNonNull(r, "r cannot be null");
        Objects.requireNonNull(s, "s cannot be null");

        if (r.length != COMPONENT_LENGTH) {
            throw new IllegalArgumentException("r must be 32 bytes, got " + r.length);
        }
        if (s.length != COMPONENT_LENGTH) {
            throw new IllegalArgumentException("s must be 32 bytes, got " + s.length);
        }

        r = Arrays.copyOf(r, COMPONENT_LENGTH);
        s = Arrays.copyOf(s, COMPONENT_LENGTH);
    }

    /**
     * Returns a copy of the r bytes (32 bytes).
     */
    @Override
    public byte[] r() {
        return Arrays.copyOf(r, r.length);
    }

    /**
     * Returns a copy of the s bytes (32 bytes).
     */
    @Override
    public byte[] s() {
        return Arrays.copyOf(s, s.length);
    }

    /**
     * Extracts the recovery ID (y-parity) from {@code v}.
     *
     * @return 0 or 1
     * @throws IllegalArgumentException if {@code v} is not one of 0, 1, 27, 28
     */
    public int recoveryId() {
        if (v == 0 || v == 1) {
            return v;
        }
        if (v == 27 || v == 28) {
            return v - 27;
        }
        throw new IllegalArgumentException("Invalid recovery ID: v=" + v);
    }

    /**
     * Returns a copy of this signature with {@code v} offset to 27/28.
     *
     * @return the typed-data style signature
     */
    public Signature withOffsetV() {
        return new Signature(r, s, recoveryId() + 27);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof Signature other))
            return false;
        return Arrays.equals(r, other.r) && Arrays.equals(s, other.s) && v == other.v;
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(r), Arrays.hashCode(s), v);
    }

    @Override
    public String toString() {
        return "Signature[r=" + Hex.abbreviate(Hex.encode(r)) + ", s=" + Hex.abbreviate(Hex.encode(s)) + ", v=" + v + "]";
    }
}
