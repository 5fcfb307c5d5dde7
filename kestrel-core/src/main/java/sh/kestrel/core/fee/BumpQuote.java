// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.core.fee;

import java.util.Objects;
import org.jspecify.annotations.Nullable;
import sh.kestrel.core.error.ErrorKind;
import sh.kestrel.core.error.FeeBumpException;

/**
 * Cost quote for a fee bump.
 *
 * @param method             bump strategy that was quoted
 * @param additionalCostSats extra sats the bump costs on top of what was already paid
 * @param newTotalFeeSats    RBF: fee of the replacement; CPFP: fee of the child transaction
 * @param childVBytes        estimated child size for CPFP, 0 for RBF
 * @param affordable         whether the wallet can fund the bump
 * @param willConsolidate    CPFP only: wallet coins beyond the parent outputs must be spent
 * @since 0.1.0
 */
public record BumpQuote(
        BumpMethod method,
        long additionalCostSats,
        long newTotalFeeSats,
        long childVBytes,
        boolean affordable,
        boolean willConsolidate) {

    public BumpQuote {
        Objects.requireNonNull(method, "method");
        if (additionalCostSats < 0 || newTotalFeeSats < 0 || childVBytes < 0) {
            throw new IllegalArgumentException("Quote values must be non-negative");
        }
    }

    /**
     * Returns the funding error, if any.
     *
     * @return {@link ErrorKind#FEE_BUMP_INSUFFICIENT_FUNDS} when not affordable, else null
     */
    public @Nullable ErrorKind error() {
        return affordable ? null : ErrorKind.FEE_BUMP_INSUFFICIENT_FUNDS;
    }

    /**
     * Returns this quote if it is affordable.
     *
     * @return this quote
     * @throws FeeBumpException with {@link ErrorKind#FEE_BUMP_INSUFFICIENT_FUNDS} otherwise
     */
    public BumpQuote requireAffordable() {
        if (!affordable) {
            throw new FeeBumpException(
                    ErrorKind.FEE_BUMP_INSUFFICIENT_FUNDS,
                    method + " bump needs " + additionalCostSats + " sats more than the wallet can fund");
        }
        return this;
    }
}
