// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.primitives;

/**
 * {@code 0x}-prefixed hex text, the form addresses, digests, call data and
 * signatures take on the wire and in logs.
 *
 * <p>Output is lowercase. Input may use either case and either {@code 0x} or
 * {@code 0X}; the prefix is optional.
 *
 * @since 0.1.0
 */
public final class Hex {
    private static final String PREFIX = "0x";
    private static final char[] DIGITS = "0123456789abcdef".toCharArray();

    private Hex() {}

    /**
     * Decodes hex text, with or without prefix. {@code "0x"} and {@code ""}
     * both decode to an empty array.
     *
     * @throws IllegalArgumentException on null, odd length or a non-hex character
     */
    public static byte[] decode(final String hexString) {
        if (hexString == null) {
            throw new IllegalArgumentException("hex string cannot be null");
        }
        final String digits = cleanPrefix(hexString);
        if (digits.length() % 2 != 0) {
            throw new IllegalArgumentException("hex string must have even length: " + hexString);
        }
        final byte[] out = new byte[digits.length() / 2];
        for (int i = 0; i < out.length; i++) {
            out[i] = (byte) (nibble(digits.charAt(2 * i), hexString) << 4 | nibble(digits.charAt(2 * i + 1), hexString));
        }
        return out;
    }

    /**
     * Encodes bytes as lowercase hex with a {@code 0x} prefix.
     *
     * @throws IllegalArgumentException if {@code bytes} is null
     */
    public static String encode(final byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("bytes cannot be null");
        }
        final StringBuilder sb = new StringBuilder(PREFIX.length() + bytes.length * 2).append(PREFIX);
        for (byte b : bytes) {
            sb.append(DIGITS[(b >> 4) & 0xF]).append(DIGITS[b & 0xF]);
        }
        return sb.toString();
    }

    /**
     * Strips a leading {@code 0x} or {@code 0X}.
     *
     * @throws IllegalArgumentException if {@code hexString} is null
     */
    public static String cleanPrefix(final String hexString) {
        if (hexString == null) {
            throw new IllegalArgumentException("hex string cannot be null");
        }
        return hasPrefix(hexString) ? hexString.substring(2) : hexString;
    }

    public static boolean hasPrefix(final String hexString) {
        return hexString != null && hexString.regionMatches(true, 0, PREFIX, 0, 2);
    }

    /**
     * Shortens hex for log lines: {@code 0xf39f...2266}. Twelve characters or
     * fewer pass through unchanged.
     */
    public static String abbreviate(final String hexString) {
        if (hexString == null || hexString.length() <= 12) {
            return hexString;
        }
        return hexString.substring(0, 6) + "..." + hexString.substring(hexString.length() - 4);
    }

    private static int nibble(final char c, final String input) {
        // Character.digit also accepts non-ASCII digits
        final int value = c < 128 ? Character.digit(c, 16) : -1;
        if (value < 0) {
            throw new IllegalArgumentException("invalid hex character in: " + input);
        }
        return value;
    }
}
