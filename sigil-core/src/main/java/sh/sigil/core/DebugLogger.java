// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centralized debug logger writing through the {@code sh.sigil.debug} logger.
 * Every message passes through {@link LogSanitizer} first.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("sh.sigil.debug");

    private DebugLogger() {
    }

    public static void logVerification(final String message, final Object... args) {
        if (!SigilDebug.isVerificationLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    public static void logExecution(final String message, final Object... args) {
        if (!SigilDebug.isExecutionLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    /**
     * Generic log method (respects global enabled check).
     */
    public static void log(final String message, final Object... args) {
        if (!SigilDebug.isEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    private static void logDirect(final String message, final Object... args) {
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);
        LOG.info(LogSanitizer.sanitize(formatted));
    }
}
