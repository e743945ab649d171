// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.core;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import sh.sigil.primitives.Hex;

/**
 * Keeps debug lines readable: hex blobs longer than one 65-byte signature
 * (call payloads, concatenated signature lists) are abbreviated, and the
 * result is capped at 2000 characters.
 */
public final class LogSanitizer {

    private static final int MAX_LOG_LENGTH = 2000;

    private static final String TRUNCATION_SUFFIX = "...(truncated)";

    /** Hex runs of 131+ digits, i.e. longer than one r||s||v signature. */
    private static final Pattern LONG_HEX_PATTERN =
            Pattern.compile("0x[0-9a-fA-F]{131,}");

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = input;

        final Matcher hex = LONG_HEX_PATTERN.matcher(sanitized);
        if (hex.find()) {
            sanitized = hex.replaceAll(m -> Matcher.quoteReplacement(Hex.abbreviate(m.group())));
        }

        if (sanitized.length() > MAX_LOG_LENGTH) {
            int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
            sanitized = sanitized.substring(0, truncateAt) + TRUNCATION_SUFFIX;
        }

        return sanitized;
    }
}
