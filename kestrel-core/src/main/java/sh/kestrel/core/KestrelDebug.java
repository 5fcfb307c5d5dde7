// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.core;

/**
 * Global toggle for verbose debug logging of the send flow.
 *
 * <p>Thread safety: the individual flags are volatile. The compound check in
 * {@link #isEnabled()} is not atomic, which is acceptable for best-effort logging.
 */
public final class KestrelDebug {

    private static volatile boolean estimationLogging = false;
    private static volatile boolean psbtLogging = false;

    private KestrelDebug() {
    }

    /**
     * Checks if any debug logging is enabled.
     *
     * @return true if either estimation or PSBT logging is enabled
     */
    public static boolean isEnabled() {
        return estimationLogging || psbtLogging;
    }

    public static void setEnabled(final boolean enabled) {
        estimationLogging = enabled;
        psbtLogging = enabled;
    }

    public static void setEstimationLogging(final boolean enabled) {
        estimationLogging = enabled;
    }

    public static boolean isEstimationLoggingEnabled() {
        return estimationLogging;
    }

    public static void setPsbtLogging(final boolean enabled) {
        psbtLogging = enabled;
    }

    public static boolean isPsbtLoggingEnabled() {
        return psbtLogging;
    }
}
