// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.core.types;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Fee rate in satoshis per virtual byte.
 * <p>
 * Rates are decimal because some backends accept sub-sat rates (e.g. 0.5 sat/vB).
 * The value is normalized with {@link BigDecimal#stripTrailingZeros()} so that
 * {@code 2} and {@code 2.0} are equal.
 *
 * @since 0.1.0
 */
public record FeeRate(BigDecimal satPerVb) implements Comparable<FeeRate> {

    public FeeRate {
        Objects.requireNonNull(satPerVb, "satPerVb");
        if (satPerVb.signum() <= 0) {
            throw new IllegalArgumentException("Fee rate must be positive, got: " + satPerVb.toPlainString());
        }
        satPerVb = satPerVb.stripTrailingZeros();
    }

    public static FeeRate of(final long satPerVb) {
        return new FeeRate(BigDecimal.valueOf(satPerVb));
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static FeeRate of(final String satPerVb) {
        Objects.requireNonNull(satPerVb, "satPerVb");
        try {
            return new FeeRate(new BigDecimal(satPerVb.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid fee rate: " + satPerVb, e);
        }
    }

    public static FeeRate of(final BigDecimal satPerVb) {
        return new FeeRate(satPerVb);
    }

    /**
     * Returns the rate rounded up to a whole sat/vB.
     *
     * @return {@code ceil(satPerVb)}
     */
    public long ceilSatPerVb() {
        return satPerVb.setScale(0, RoundingMode.CEILING).longValueExact();
    }

    /**
     * Returns the rate with its fractional part dropped.
     *
     * @return {@code floor(satPerVb)}
     */
    public long truncatedSatPerVb() {
        return satPerVb.setScale(0, RoundingMode.DOWN).longValueExact();
    }

    /**
     * Computes the fee for a transaction of the given virtual size, rounded up.
     *
     * @param vbytes virtual size
     * @return {@code ceil(satPerVb * vbytes)}
     */
    public Sats feeFor(final BigDecimal vbytes) {
        Objects.requireNonNull(vbytes, "vbytes");
        return Sats.of(satPerVb.multiply(vbytes).setScale(0, RoundingMode.CEILING).longValueExact());
    }

    public boolean isBelow(final FeeRate other) {
        return compareTo(other) < 0;
    }

    @JsonValue
    public String toPlainString() {
        return satPerVb.toPlainString();
    }

    @Override
    public int compareTo(final FeeRate other) {
        return satPerVb.compareTo(other.satPerVb);
    }
}
