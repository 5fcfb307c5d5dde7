// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centralized debug logger for estimation and signing traces.
 *
 * <p>Messages use {@link String#formatted} placeholders and are always passed through
 * {@link LogSanitizer} before reaching SLF4J.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("sh.kestrel.debug");

    private DebugLogger() {
    }

    public static void logEstimation(final String message, final Object... args) {
        if (!KestrelDebug.isEstimationLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    public static void logPsbt(final String message, final Object... args) {
        if (!KestrelDebug.isPsbtLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    private static void logDirect(final String message, final Object... args) {
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);
        LOG.info(LogSanitizer.sanitize(formatted));
    }
}
