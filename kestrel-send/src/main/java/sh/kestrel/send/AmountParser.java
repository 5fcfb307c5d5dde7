// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.send;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;
import sh.kestrel.core.types.Sats;

/**
 * Converts user-typed amount text to satoshis and back.
 *
 * <p>Parsing never throws on user input: anything that is not a non-negative amount
 * representable in whole sats, or that exceeds {@link Sats#MAX_MONEY}, yields an empty result.
 */
public final class AmountParser {

    private static final Pattern SATS_PATTERN = Pattern.compile("[0-9][0-9,]*");
    private static final Pattern BTC_PATTERN = Pattern.compile("[0-9]*\\.?[0-9]*");
    private static final int BTC_DECIMALS = 8;

    private AmountParser() {
        // Utility class
    }

    /**
     * Parses an amount.
     *
     * @param input        raw text, surrounding whitespace ignored
     * @param denomination unit of the text
     * @return the amount (possibly zero), or empty if blank or malformed
     */
    public static Optional<Sats> parse(final @Nullable String input, final Denomination denomination) {
        Objects.requireNonNull(denomination, "denomination");
        if (input == null || input.isBlank()) {
            return Optional.empty();
        }
        final String text = input.trim();
        try {
            if (denomination == Denomination.SATS) {
                if (!SATS_PATTERN.matcher(text).matches()) {
                    return Optional.empty();
                }
                return withinSupply(Sats.of(Long.parseLong(text.replace(",", ""))));
            }
            if (!BTC_PATTERN.matcher(text).matches() || ".".equals(text)) {
                return Optional.empty();
            }
            final BigDecimal btc = new BigDecimal(text);
            if (btc.stripTrailingZeros().scale() > BTC_DECIMALS) {
                return Optional.empty();
            }
            return withinSupply(Sats.fromBtc(btc));
        } catch (NumberFormatException | ArithmeticException e) {
            return Optional.empty();
        }
    }

    private static Optional<Sats> withinSupply(final Sats amount) {
        return amount.value() > Sats.MAX_MONEY ? Optional.empty() : Optional.of(amount);
    }

    /**
     * Parses an amount and keeps it only if positive.
     *
     * @param input        raw text
     * @param denomination unit of the text
     * @return the amount, or empty if blank, malformed or zero
     */
    public static Optional<Sats> parsePositive(final @Nullable String input, final Denomination denomination) {
        return parse(input, denomination).filter(Sats::isPositive);
    }

    /**
     * Formats an amount for editing in the given unit.
     *
     * @param amount       the amount
     * @param denomination target unit
     * @return plain digits for sats, or a BTC decimal without trailing zeros
     */
    public static String format(final Sats amount, final Denomination denomination) {
        Objects.requireNonNull(amount, "amount");
        if (denomination == Denomination.SATS) {
            return Long.toString(amount.value());
        }
        final BigDecimal btc = amount.toBtc().stripTrailingZeros();
        return btc.signum() == 0 ? "0" : btc.toPlainString();
    }

    /**
     * Re-expresses amount text in another unit; text that does not parse is kept as typed.
     *
     * @param input raw text in {@code from}
     * @param from  current unit
     * @param to    target unit
     * @return the converted text
     */
    public static String convert(final String input, final Denomination from, final Denomination to) {
        if (from == to) {
            return input;
        }
        return parse(input, from).map(sats -> format(sats, to)).orElse(input);
    }
}
