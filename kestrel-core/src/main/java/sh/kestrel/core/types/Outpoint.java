// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.core.types;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Reference to a transaction output: {@code txid:vout}.
 * <p>
 * <strong>Validation:</strong>
 * <ul>
 * <li>txid must be exactly 64 hex characters; it is stored in lowercase</li>
 * <li>vout must be non-negative</li>
 * </ul>
 *
 * @since 0.1.0
 */
public record Outpoint(String txid, int vout) {
    private static final Pattern TXID = Pattern.compile("^[0-9a-fA-F]{64}$");

    public Outpoint {
        Objects.requireNonNull(txid, "txid");
        if (!TXID.matcher(txid).matches()) {
            throw new IllegalArgumentException("Invalid txid: " + txid);
        }
        if (vout < 0) {
            throw new IllegalArgumentException("vout must be non-negative, got: " + vout);
        }
        txid = txid.toLowerCase(Locale.ROOT);
    }

    /**
     * Parses the {@code txid:vout} form.
     *
     * @param value the text form
     * @return the outpoint
     * @throws IllegalArgumentException if the text is malformed
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Outpoint parse(final String value) {
        Objects.requireNonNull(value, "value");
        final int sep = value.lastIndexOf(':');
        if (sep <= 0 || sep == value.length() - 1) {
            throw new IllegalArgumentException("Outpoint must be txid:vout, got: " + value);
        }
        try {
            return new Outpoint(value.substring(0, sep), Integer.parseInt(value.substring(sep + 1)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid vout in outpoint: " + value, e);
        }
    }

    @JsonValue
    @Override
    public String toString() {
        return txid + ":" + vout;
    }
}
