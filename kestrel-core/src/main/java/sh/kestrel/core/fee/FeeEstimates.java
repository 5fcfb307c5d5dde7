// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.core.fee;

import java.util.Objects;
import sh.kestrel.core.types.FeeRate;

/**
 * Fee-rate estimates per confirmation target, as reported by the network backend.
 *
 * @param fastest  next-block target
 * @param halfHour ~3 block target
 * @param hour     ~6 block target
 * @param minimum  economy / mempool minimum
 * @since 0.1.0
 */
public record FeeEstimates(FeeRate fastest, FeeRate halfHour, FeeRate hour, FeeRate minimum) {

    public FeeEstimates {
        Objects.requireNonNull(fastest, "fastest");
        Objects.requireNonNull(halfHour, "halfHour");
        Objects.requireNonNull(hour, "hour");
        Objects.requireNonNull(minimum, "minimum");
    }

    public FeeRate rateFor(final FeePriority priority) {
        switch (Objects.requireNonNull(priority, "priority")) {
            case FASTEST:
                return fastest;
            case HALF_HOUR:
                return halfHour;
            case HOUR:
                return hour;
            case MINIMUM:
                return minimum;
            default:
                throw new IllegalArgumentException("Unknown priority: " + priority);
        }
    }

    /**
     * Returns whether every confirmation target reports the same rate, which happens in
     * quiet mempools and with backends that only know one rate.
     */
    public boolean isUniform() {
        return fastest.equals(halfHour) && halfHour.equals(hour);
    }
}
