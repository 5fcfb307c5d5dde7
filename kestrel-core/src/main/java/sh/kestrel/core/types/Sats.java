// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.core.types;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Non-negative integer amount in satoshis (10^-8 BTC).
 * <p>
 * <strong>Common Conversions:</strong>
 * <ul>
 * <li>1 BTC = 100,000,000 sats</li>
 * </ul>
 *
 * @since 0.1.0
 */
public record Sats(long value) implements Comparable<Sats> {

    public static final Sats ZERO = new Sats(0L);

    /** Satoshis per bitcoin. */
    public static final long SATS_PER_BTC = 100_000_000L;

    /** Total bitcoin supply, 21,000,000 BTC. */
    public static final long MAX_MONEY = 21_000_000L * SATS_PER_BTC;

    private static final BigDecimal SATS_PER_BTC_DECIMAL = BigDecimal.valueOf(SATS_PER_BTC);

    public Sats {
        if (value < 0) {
            throw new IllegalArgumentException("Sats must be non-negative, got: " + value);
        }
    }

    public static Sats of(final long sats) {
        return new Sats(sats);
    }

    /**
     * Converts a BTC amount to sats.
     *
     * @param btc amount in BTC with at most 8 fractional digits
     * @return the amount in sats
     * @throws ArithmeticException if the amount has sub-satoshi precision or overflows
     */
    public static Sats fromBtc(final BigDecimal btc) {
        Objects.requireNonNull(btc, "btc");
        return new Sats(btc.multiply(SATS_PER_BTC_DECIMAL).longValueExact());
    }

    public BigDecimal toBtc() {
        return BigDecimal.valueOf(value).divide(SATS_PER_BTC_DECIMAL, 8, RoundingMode.UNNECESSARY);
    }

    public Sats plus(final Sats other) {
        return new Sats(Math.addExact(value, other.value));
    }

    /**
     * Adds, clamping at {@link Long#MAX_VALUE} instead of overflowing.
     *
     * @param other the amount to add
     * @return {@code min(Long.MAX_VALUE, this + other)}
     */
    public Sats plusSaturating(final Sats other) {
        final long sum = value + other.value;
        return new Sats(sum < 0 ? Long.MAX_VALUE : sum);
    }

    /**
     * Subtracts, clamping at zero.
     *
     * @param other the amount to subtract
     * @return {@code max(0, this - other)}
     */
    public Sats minusOrZero(final Sats other) {
        return value > other.value ? new Sats(value - other.value) : ZERO;
    }

    public boolean isPositive() {
        return value > 0;
    }

    @Override
    public int compareTo(final Sats other) {
        return Long.compare(value, other.value);
    }
}
