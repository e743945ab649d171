// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.core.types;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

import sh.sigil.primitives.Hex;

/**
 * Hex-encoded 20-byte account address.
 * <p>
 * <strong>Validation:</strong>
 * <ul>
 * <li>Must start with "0x"</li>
 * <li>Must be exactly 40 hex characters long (20 bytes)</li>
 * </ul>
 * <p>
 * The value is stored in lowercase.
 *
 * <h2>Ordering</h2>
 * <p>
 * Addresses order by their unsigned 160-bit numeric value, which is the order
 * signature sets must be submitted in. Because the stored form is fixed-width
 * lowercase hex, this equals the lexicographic order of {@link #value()}.
 *
 * @since 0.1.0
 */
public record Address(@com.fasterxml.jackson.annotation.JsonValue String value) implements Comparable<Address> {
    private static final int BYTE_LENGTH = 20;
    private static final Pattern HEX = HexValidator.fixedLength(BYTE_LENGTH);

    /**
     * The zero address ({@code 0x0000000000000000000000000000000000000000}).
     * <p>
     * Lowest possible address; also what signature recovery yields for an
     * unrecoverable signature.
     */
    public static final Address ZERO = new Address("0x0000000000000000000000000000000000000000");

    public Address {
        Objects.requireNonNull(value, "address");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid address: " + value);
        }
        value = value.toLowerCase(Locale.ROOT);
    }

    /**
     * Decodes this address to a 20-byte array.
     *
     * @return 20-byte array representation
     */
    public byte[] toBytes() {
        return Hex.decode(value);
    }

    public static Address fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != BYTE_LENGTH) {
            throw new IllegalArgumentException("Address must be exactly " + BYTE_LENGTH + " bytes");
        }
        return new Address(Hex.encode(bytes));
    }

    @Override
    public int compareTo(final Address other) {
        return value.compareTo(other.value);
    }
}
