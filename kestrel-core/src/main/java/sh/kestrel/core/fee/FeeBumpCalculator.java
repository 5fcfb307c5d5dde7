// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.core.fee;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.kestrel.core.DebugLogger;
import sh.kestrel.core.error.ErrorKind;
import sh.kestrel.core.error.FeeBumpException;

/**
 * Computes the cost and feasibility of RBF and CPFP fee bumps.
 *
 * <p><strong>RBF:</strong> the replacement pays {@code ceil(target * vsize)}; the extra cost is
 * the difference to the fee already paid, and the bump is affordable if the wallet balance
 * covers it.
 *
 * <p><strong>CPFP:</strong> the child is sized conservatively at {@value #CPFP_BASE_VBYTES} vB
 * for one parent output plus {@value #CPFP_VBYTES_PER_EXTRA_INPUT} vB per additional one, and
 * pays {@code ceil(target) * childSize}. A change output above the dust limit must remain; if
 * the parent outputs alone cannot guarantee that, the child also spends wallet coins
 * ({@link BumpQuote#willConsolidate()}).
 *
 * <p>Pure and thread-safe.
 *
 * @since 0.1.0
 */
public final class FeeBumpCalculator {

    private static final Logger LOG = LoggerFactory.getLogger(FeeBumpCalculator.class);

    /** Child size for a one-input, one-output child. */
    public static final long CPFP_BASE_VBYTES = 150L;

    /** Extra child size per additional parent output spent. */
    public static final long CPFP_VBYTES_PER_EXTRA_INPUT = 68L;

    /** Default relay dust limit; safe for every output type. */
    public static final long DEFAULT_DUST_LIMIT_SATS = 546L;

    private final long dustLimitSats;

    public FeeBumpCalculator() {
        this(DEFAULT_DUST_LIMIT_SATS);
    }

    /**
     * @param dustLimitSats change value that must survive a CPFP child
     */
    public FeeBumpCalculator(final long dustLimitSats) {
        if (dustLimitSats < 0) {
            throw new IllegalArgumentException("dustLimitSats must be >= 0, got: " + dustLimitSats);
        }
        this.dustLimitSats = dustLimitSats;
    }

    /**
     * Quotes a fee bump.
     *
     * @param request the bump parameters
     * @return the quote; check {@link BumpQuote#affordable()}
     * @throws FeeBumpException with {@link ErrorKind#FEE_BUMP_NOT_HIGHER_THAN_CURRENT} if the
     *                          target rate does not exceed the current effective rate
     */
    public BumpQuote quote(final BumpRequest request) {
        Objects.requireNonNull(request, "request");
        final BigDecimal current = currentEffectiveRate(request);
        final BigDecimal target = request.targetFeeRate().satPerVb();
        if (target.compareTo(current) <= 0) {
            throw new FeeBumpException(
                    ErrorKind.FEE_BUMP_NOT_HIGHER_THAN_CURRENT,
                    "Target rate " + target.toPlainString() + " sat/vB is not above current "
                            + current.stripTrailingZeros().toPlainString() + " sat/vB");
        }
        final BumpQuote quote = request.method() == BumpMethod.RBF ? quoteRbf(request) : quoteCpfp(request);
        LOG.debug("Quoted {} bump at {} sat/vB: {}", request.method(), target.toPlainString(), quote);
        DebugLogger.logEstimation("bump %s -> %s", request, quote);
        return quote;
    }

    /**
     * Returns the rate a bump must strictly exceed.
     *
     * @param request the bump parameters
     * @return RBF: fee / vsize (the reported rate when vsize is zero); CPFP: the reported rate
     */
    public BigDecimal currentEffectiveRate(final BumpRequest request) {
        if (request.method() == BumpMethod.RBF && request.vsizeVb().signum() > 0) {
            return BigDecimal.valueOf(request.currentFeeSats()).divide(request.vsizeVb(), MathContext.DECIMAL64);
        }
        return request.currentFeeRateSatPerVb();
    }

    /**
     * Returns the conservative child size for a CPFP spending {@code parentOutputs} outputs.
     *
     * @param parentOutputs number of parent outputs spent, at least one
     * @return estimated child size in vbytes
     */
    public static long cpfpChildVBytes(final int parentOutputs) {
        if (parentOutputs < 1) {
            throw new IllegalArgumentException("parentOutputs must be >= 1, got: " + parentOutputs);
        }
        return CPFP_BASE_VBYTES + (parentOutputs - 1) * CPFP_VBYTES_PER_EXTRA_INPUT;
    }

    private BumpQuote quoteRbf(final BumpRequest request) {
        final long newTotalFee = request.targetFeeRate()
                .satPerVb()
                .multiply(request.vsizeVb())
                .setScale(0, RoundingMode.CEILING)
                .longValueExact();
        final long additional = Math.max(0L, newTotalFee - request.currentFeeSats());
        final boolean affordable = additional <= request.availableWalletBalanceSats();
        return new BumpQuote(BumpMethod.RBF, additional, newTotalFee, 0L, affordable, false);
    }

    private BumpQuote quoteCpfp(final BumpRequest request) {
        final long childVBytes = cpfpChildVBytes(request.cpfpParentOutputCount());
        final long childFee = Math.multiplyExact(request.targetFeeRate().ceilSatPerVb(), childVBytes);
        final long required = Math.addExact(childFee, dustLimitSats);
        final long availableFunds =
                Math.addExact(request.cpfpParentOutputSats(), request.availableWalletBalanceSats());
        final boolean affordable = availableFunds >= required;
        final boolean parentSufficient = request.cpfpParentOutputSats() > required;
        return new BumpQuote(BumpMethod.CPFP, childFee, childFee, childVBytes, affordable, !parentSufficient);
    }
}
