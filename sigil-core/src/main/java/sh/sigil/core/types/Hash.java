// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.core.types;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

import sh.sigil.primitives.Hex;

/**
 * A 32-byte Keccak-256 output: a digest, domain separator, type hash or event
 * topic. Held as lowercase {@code 0x} hex so equal hashes compare equal.
 *
 * @since 0.1.0
 */
public record Hash(@com.fasterxml.jackson.annotation.JsonValue String value) {
    private static final int BYTE_LENGTH = 32;
    private static final Pattern HEX = HexValidator.fixedLength(BYTE_LENGTH);

    /**
     * @throws IllegalArgumentException unless {@code value} is {@code 0x} plus 64 hex digits
     */
    public Hash {
        Objects.requireNonNull(value, "hash");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid hash: " + value);
        }
        value = value.toLowerCase(Locale.ROOT);
    }

    public byte[] toBytes() {
        return Hex.decode(value);
    }

    public static Hash fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != BYTE_LENGTH) {
            throw new IllegalArgumentException("Expected a 32-byte hash");
        }
        return new Hash(Hex.encode(bytes));
    }
}
