// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.core.types;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Represents a native value quantity in Wei (10^-18 Ether).
 * <p>
 * <strong>Common Conversions:</strong>
 * <ul>
 * <li>1 Ether = 10^18 Wei</li>
 * <li>1 Gwei = 10^9 Wei</li>
 * </ul>
 * <p>
 * Values are non-negative and fit in {@code uint256}.
 */
public record Wei(BigInteger value) implements Comparable<Wei> {
    private static final BigDecimal WEI_PER_ETHER = BigDecimal.TEN.pow(18);
    private static final BigInteger GWEI_MULTIPLIER = BigInteger.valueOf(1_000_000_000L);
    private static final int MAX_BITS = 256;

    public static final Wei ZERO = new Wei(BigInteger.ZERO);

    public Wei {
        Objects.requireNonNull(value, "value");
        if (value.signum() < 0) {
            throw new IllegalArgumentException("Wei must be non-negative");
        }
        if (value.bitLength() > MAX_BITS) {
            throw new IllegalArgumentException("Wei exceeds uint256: " + value);
        }
    }

    public static Wei of(final long wei) {
        return new Wei(BigInteger.valueOf(wei));
    }

    public static Wei of(final BigInteger wei) {
        return new Wei(wei);
    }

    public static Wei fromEther(final BigDecimal ether) {
        Objects.requireNonNull(ether, "ether");
        return new Wei(ether.multiply(WEI_PER_ETHER).toBigIntegerExact());
    }

    public static Wei gwei(final long gwei) {
        return new Wei(BigInteger.valueOf(gwei).multiply(GWEI_MULTIPLIER));
    }

    public BigDecimal toEther() {
        return new BigDecimal(value).divide(WEI_PER_ETHER, 18, RoundingMode.DOWN);
    }

    public Wei plus(final Wei other) {
        return new Wei(value.add(other.value));
    }

    /**
     * Subtracts {@code other} from this amount.
     *
     * @throws IllegalArgumentException if the result would be negative
     */
    public Wei minus(final Wei other) {
        return new Wei(value.subtract(other.value));
    }

    public boolean isZero() {
        return value.signum() == 0;
    }

    @Override
    public int compareTo(final Wei other) {
        return value.compareTo(other.value);
    }

    @com.fasterxml.jackson.annotation.JsonValue
    public String toHexString() {
        return "0x" + value.toString(16);
    }
}
