// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.core.fee;

import java.math.BigDecimal;
import java.util.Objects;
import sh.kestrel.core.types.FeeRate;

/**
 * Input to {@link FeeBumpCalculator#quote(BumpRequest)}.
 *
 * <p>Only the fields relevant to the chosen {@link BumpMethod} are consulted: RBF reads the
 * current fee and virtual size, CPFP reads the current rate and the parent outputs.
 *
 * <p><strong>Example:</strong>
 * <pre>{@code
 * BumpRequest request = BumpRequest.builder(BumpMethod.RBF)
 *     .currentFeeSats(1000)
 *     .vsizeVb(BigDecimal.valueOf(200))
 *     .availableWalletBalanceSats(50_000)
 *     .targetFeeRate(FeeRate.of(10))
 *     .build();
 * }</pre>
 *
 * @param method                     bump strategy
 * @param currentFeeSats             absolute fee paid by the transaction
 * @param currentFeeRateSatPerVb     fee rate reported for the transaction (may be zero if unknown)
 * @param vsizeVb                    virtual size of the transaction
 * @param availableWalletBalanceSats spendable wallet balance
 * @param cpfpParentOutputSats       value of the wallet-owned parent outputs
 * @param cpfpParentOutputCount      number of wallet-owned parent outputs spent by the child
 * @param targetFeeRate              desired fee rate
 * @since 0.1.0
 */
public record BumpRequest(
        BumpMethod method,
        long currentFeeSats,
        BigDecimal currentFeeRateSatPerVb,
        BigDecimal vsizeVb,
        long availableWalletBalanceSats,
        long cpfpParentOutputSats,
        int cpfpParentOutputCount,
        FeeRate targetFeeRate) {

    public BumpRequest {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(currentFeeRateSatPerVb, "currentFeeRateSatPerVb");
        Objects.requireNonNull(vsizeVb, "vsizeVb");
        Objects.requireNonNull(targetFeeRate, "targetFeeRate");
        if (currentFeeSats < 0) {
            throw new IllegalArgumentException("currentFeeSats must be >= 0, got: " + currentFeeSats);
        }
        if (currentFeeRateSatPerVb.signum() < 0) {
            throw new IllegalArgumentException(
                    "currentFeeRateSatPerVb must be >= 0, got: " + currentFeeRateSatPerVb.toPlainString());
        }
        if (vsizeVb.signum() < 0) {
            throw new IllegalArgumentException("vsizeVb must be >= 0, got: " + vsizeVb.toPlainString());
        }
        if (availableWalletBalanceSats < 0) {
            throw new IllegalArgumentException(
                    "availableWalletBalanceSats must be >= 0, got: " + availableWalletBalanceSats);
        }
        if (cpfpParentOutputSats < 0) {
            throw new IllegalArgumentException("cpfpParentOutputSats must be >= 0, got: " + cpfpParentOutputSats);
        }
        if (cpfpParentOutputCount < 1) {
            throw new IllegalArgumentException("cpfpParentOutputCount must be >= 1, got: " + cpfpParentOutputCount);
        }
    }

    public static Builder builder(final BumpMethod method) {
        return new Builder(method);
    }

    /**
     * Builder for {@link BumpRequest}; numeric fields default to zero and the parent
     * output count to one.
     */
    public static final class Builder {
        private final BumpMethod method;
        private long currentFeeSats;
        private BigDecimal currentFeeRateSatPerVb = BigDecimal.ZERO;
        private BigDecimal vsizeVb = BigDecimal.ZERO;
        private long availableWalletBalanceSats;
        private long cpfpParentOutputSats;
        private int cpfpParentOutputCount = 1;
        private FeeRate targetFeeRate;

        private Builder(final BumpMethod method) {
            this.method = method;
        }

        public Builder currentFeeSats(final long currentFeeSats) {
            this.currentFeeSats = currentFeeSats;
            return this;
        }

        public Builder currentFeeRateSatPerVb(final BigDecimal currentFeeRateSatPerVb) {
            this.currentFeeRateSatPerVb = currentFeeRateSatPerVb;
            return this;
        }

        public Builder vsizeVb(final BigDecimal vsizeVb) {
            this.vsizeVb = vsizeVb;
            return this;
        }

        public Builder availableWalletBalanceSats(final long availableWalletBalanceSats) {
            this.availableWalletBalanceSats = availableWalletBalanceSats;
            return this;
        }

        public Builder cpfpParentOutputSats(final long cpfpParentOutputSats) {
            this.cpfpParentOutputSats = cpfpParentOutputSats;
            return this;
        }

        public Builder cpfpParentOutputCount(final int cpfpParentOutputCount) {
            this.cpfpParentOutputCount = cpfpParentOutputCount;
            return this;
        }

        public Builder targetFeeRate(final FeeRate targetFeeRate) {
            this.targetFeeRate = targetFeeRate;
            return this;
        }

        /**
         * Builds the request.
         *
         * @return the request
         * @throws NullPointerException     if the target fee rate was not set
         * @throws IllegalArgumentException if any value is out of range
         */
        public BumpRequest build() {
            return new BumpRequest(
                    method,
                    currentFeeSats,
                    currentFeeRateSatPerVb,
                    vsizeVb,
                    availableWalletBalanceSats,
                    cpfpParentOutputSats,
                    cpfpParentOutputCount,
                    targetFeeRate);
        }
    }
}
