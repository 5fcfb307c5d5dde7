// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.send;

import java.time.Duration;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import sh.kestrel.core.types.FeeRate;

/**
 * Configuration for {@link SendDraftOrchestrator}.
 *
 * <ul>
 *   <li>{@code debounce} - quiet period after an edit before a dry-run is issued (default: 150ms)</li>
 *   <li>{@code maxSendHeuristicVBytes} - size assumed for the instant max-send estimate (default: 150)</li>
 *   <li>{@code minFeeRate} - lowest fee rate a draft may use (default: 1 sat/vB)</li>
 *   <li>{@code defaultFeeRate} - fee rate of a fresh draft (default: 1 sat/vB)</li>
 *   <li>{@code spendUnconfirmed} - whether unconfirmed balance counts as available (default: false)</li>
 *   <li>{@code denomination} - amount unit of a fresh draft (default: SATS)</li>
 *   <li>{@code dryRunTimeout} - dry-runs slower than this fail as network unavailable;
 *       null disables the timeout (default: 30s)</li>
 * </ul>
 *
 * <p><strong>Example:</strong>
 * <pre>{@code
 * SendConfig config = SendConfig.builder()
 *     .debounce(Duration.ofMillis(300))
 *     .spendUnconfirmed(true)
 *     .build();
 * }</pre>
 *
 * @since 0.1.0
 */
public record SendConfig(
        Duration debounce,
        int maxSendHeuristicVBytes,
        FeeRate minFeeRate,
        FeeRate defaultFeeRate,
        boolean spendUnconfirmed,
        Denomination denomination,
        @Nullable Duration dryRunTimeout) {

    /** Default quiet period: 150ms. */
    public static final Duration DEFAULT_DEBOUNCE = Duration.ofMillis(150);

    /** Default max-send heuristic size: 150 vB, a one-input one-output segwit spend. */
    public static final int DEFAULT_MAX_SEND_HEURISTIC_VBYTES = 150;

    /** Default minimum and initial fee rate: 1 sat/vB. */
    public static final FeeRate DEFAULT_FEE_RATE = FeeRate.of(1);

    /** Default dry-run timeout: 30s. */
    public static final Duration DEFAULT_DRY_RUN_TIMEOUT = Duration.ofSeconds(30);

    public SendConfig {
        Objects.requireNonNull(debounce, "debounce");
        Objects.requireNonNull(minFeeRate, "minFeeRate");
        Objects.requireNonNull(defaultFeeRate, "defaultFeeRate");
        Objects.requireNonNull(denomination, "denomination");
        if (debounce.isNegative()) {
            throw new IllegalArgumentException("debounce must be >= 0, got: " + debounce);
        }
        if (maxSendHeuristicVBytes < 0) {
            throw new IllegalArgumentException(
                    "maxSendHeuristicVBytes must be >= 0, got: " + maxSendHeuristicVBytes);
        }
        if (defaultFeeRate.isBelow(minFeeRate)) {
            throw new IllegalArgumentException(
                    "defaultFeeRate must be >= minFeeRate, got: " + defaultFeeRate.toPlainString()
                            + " < " + minFeeRate.toPlainString());
        }
        if (dryRunTimeout != null && (dryRunTimeout.isNegative() || dryRunTimeout.isZero())) {
            throw new IllegalArgumentException("dryRunTimeout must be > 0, got: " + dryRunTimeout);
        }
    }

    public static SendConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link SendConfig}, initialized with the defaults.
     */
    public static final class Builder {
        private Duration debounce = DEFAULT_DEBOUNCE;
        private int maxSendHeuristicVBytes = DEFAULT_MAX_SEND_HEURISTIC_VBYTES;
        private FeeRate minFeeRate = DEFAULT_FEE_RATE;
        private FeeRate defaultFeeRate = DEFAULT_FEE_RATE;
        private boolean spendUnconfirmed;
        private Denomination denomination = Denomination.SATS;
        private @Nullable Duration dryRunTimeout = DEFAULT_DRY_RUN_TIMEOUT;

        private Builder() {}

        public Builder debounce(Duration debounce) {
            this.debounce = debounce;
            return this;
        }

        public Builder maxSendHeuristicVBytes(int maxSendHeuristicVBytes) {
            this.maxSendHeuristicVBytes = maxSendHeuristicVBytes;
            return this;
        }

        public Builder minFeeRate(FeeRate minFeeRate) {
            this.minFeeRate = minFeeRate;
            return this;
        }

        public Builder defaultFeeRate(FeeRate defaultFeeRate) {
            this.defaultFeeRate = defaultFeeRate;
            return this;
        }

        public Builder spendUnconfirmed(boolean spendUnconfirmed) {
            this.spendUnconfirmed = spendUnconfirmed;
            return this;
        }

        public Builder denomination(Denomination denomination) {
            this.denomination = denomination;
            return this;
        }

        /**
         * Sets the dry-run timeout.
         *
         * @param dryRunTimeout the timeout, or null to wait indefinitely
         * @return this builder
         */
        public Builder dryRunTimeout(@Nullable Duration dryRunTimeout) {
            this.dryRunTimeout = dryRunTimeout;
            return this;
        }

        public SendConfig build() {
            return new SendConfig(
                    debounce,
                    maxSendHeuristicVBytes,
                    minFeeRate,
                    defaultFeeRate,
                    spendUnconfirmed,
                    denomination,
                    dryRunTimeout);
        }
    }
}
