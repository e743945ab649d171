// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.core;

/**
 * Global toggle for verbose debug logging across Sigil modules.
 *
 * <p>Two channels exist: verification (digests, recovered signers, rejected
 * submissions) and execution (committed actions and forwarded calls).
 *
 * <p>The flags are volatile. {@link #isEnabled()} reads both non-atomically,
 * which is fine for best-effort logging.
 */
public final class SigilDebug {

    private static volatile boolean verificationLogging = false;
    private static volatile boolean executionLogging = false;

    private SigilDebug() {
    }

    /**
     * @return true if either channel is enabled
     */
    public static boolean isEnabled() {
        return verificationLogging || executionLogging;
    }

    public static void setEnabled(final boolean enabled) {
        verificationLogging = enabled;
        executionLogging = enabled;
    }

    public static void setVerificationLogging(final boolean enabled) {
        verificationLogging = enabled;
    }

    public static boolean isVerificationLoggingEnabled() {
        return verificationLogging;
    }

    public static void setExecutionLogging(final boolean enabled) {
        executionLogging = enabled;
    }

    public static boolean isExecutionLoggingEnabled() {
        return executionLogging;
    }
}
