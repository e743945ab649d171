// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.core.types;

import java.util.Arrays;
import java.util.Objects;
import java.util.regex.Pattern;

import sh.sigil.primitives.Hex;

/**
 * Arbitrary-length hexadecimal-encoded byte data with "0x" prefix.
 *
 * <p>
 * Used for call payloads and call return data.
 *
 * <p>
 * <strong>Validation:</strong> The value must start with "0x", contain only
 * hex characters, and have an even number of hex digits.
 *
 * <pre>{@code
 * HexData empty = HexData.EMPTY;
 * HexData data = new HexData("0x1234abcd");
 * HexData fromBytes = HexData.fromBytes(new byte[] { 0x12, 0x34 });
 * byte[] decoded = data.toBytes();
 * }</pre>
 */
public final class HexData {
    private static final Pattern HEX = Pattern.compile("^0x([0-9a-fA-F]{2})*$");
    public static final HexData EMPTY = new HexData("0x");

    private final byte[] raw;
    private final String value;

    /**
     * Creates a HexData from a hex string.
     *
     * @param value the hex-encoded string with "0x" prefix
     * @throws IllegalArgumentException if the value is not valid hex data
     */
    public HexData(final String value) {
        Objects.requireNonNull(value, "hex");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid hex data: " + value);
        }
        this.raw = Hex.decode(value);
        this.value = Hex.encode(raw);
    }

    private HexData(final byte[] raw) {
        this.raw = raw;
        this.value = Hex.encode(raw);
    }

    /**
     * Creates a HexData from raw bytes. The array is copied.
     *
     * @param bytes the raw bytes
     * @return the hex data
     */
    public static HexData fromBytes(final byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        return bytes.length == 0 ? EMPTY : new HexData(Arrays.copyOf(bytes, bytes.length));
    }

    /**
     * Returns the lowercase {@code 0x}-prefixed hex string.
     */
    @com.fasterxml.jackson.annotation.JsonValue
    public String value() {
        return value;
    }

    /**
     * Returns a copy of the underlying bytes.
     */
    public byte[] toBytes() {
        return Arrays.copyOf(raw, raw.length);
    }

    public int byteLength() {
        return raw.length;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof HexData other)) {
            return false;
        }
        return Arrays.equals(raw, other.raw);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(raw);
    }

    @Override
    public String toString() {
        return value;
    }
}
