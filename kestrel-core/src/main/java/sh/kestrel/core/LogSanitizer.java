// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.core;

import java.util.regex.Pattern;

/**
 * Utility that removes transaction payloads from debug log messages.
 *
 * <p>
 * Performs three sanitization operations:
 * <ul>
 * <li>Redacts base64 PSBTs (they carry the full spending intent and derivation paths)</li>
 * <li>Redacts long hex runs such as raw signed transactions; 64-character txids are kept</li>
 * <li>Truncates excessively long messages</li>
 * </ul>
 */
public final class LogSanitizer {

    /** Maximum length for sanitized log output. */
    private static final int MAX_LOG_LENGTH = 2000;

    /** Suffix appended to truncated logs. */
    private static final String TRUNCATION_SUFFIX = "...(truncated)";

    /** Base64 PSBTs always start with the encoded magic {@code psbt\xff}. */
    private static final Pattern PSBT_PATTERN = Pattern.compile("cHNidP8[A-Za-z0-9+/=]*");

    private static final String PSBT_REPLACEMENT = "cHNidP8***[REDACTED]***";

    /** Hex runs longer than a txid. */
    private static final Pattern RAW_TX_PATTERN = Pattern.compile("\\b[0-9a-fA-F]{65,}\\b");

    private static final String RAW_TX_REPLACEMENT = "***[REDACTED TX]***";

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = input;

        if (sanitized.contains("cHNidP8")) {
            sanitized = PSBT_PATTERN.matcher(sanitized).replaceAll(PSBT_REPLACEMENT);
        }

        sanitized = RAW_TX_PATTERN.matcher(sanitized).replaceAll(RAW_TX_REPLACEMENT);

        if (sanitized.length() > MAX_LOG_LENGTH) {
            int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
            sanitized = sanitized.substring(0, truncateAt) + TRUNCATION_SUFFIX;
        }

        return sanitized;
    }
}
