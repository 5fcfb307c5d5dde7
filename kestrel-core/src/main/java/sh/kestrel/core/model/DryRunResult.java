// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.core.model;

import java.util.Objects;
import org.jspecify.annotations.Nullable;
import sh.kestrel.core.error.ErrorKind;

/**
 * Result of a dry-run transaction build: constructed by the engine, never signed or
 * broadcast.
 *
 * <p>A result is either successful ({@link #error()} is null) or an error-only result
 * created through {@link #error(ErrorKind, String)}. Results are immutable; a new one is
 * produced for every estimate.
 *
 * @param feeSats             absolute fee
 * @param txVBytes            measured virtual size (fractional)
 * @param changeSats          value of the change output, 0 when there is none
 * @param hasChange           whether a change output exists
 * @param numInputs           number of inputs chosen
 * @param effectiveFeeRate    fee divided by virtual size
 * @param recipientAmountSats amount paid to the (first) recipient; exact under max send
 * @param error               error kind, or null on success
 * @param errorMessage        engine-provided detail for the error, or null
 */
public record DryRunResult(
        long feeSats,
        double txVBytes,
        long changeSats,
        boolean hasChange,
        int numInputs,
        double effectiveFeeRate,
        long recipientAmountSats,
        @Nullable ErrorKind error,
        @Nullable String errorMessage) {

    public DryRunResult {
        if (feeSats < 0 || changeSats < 0 || recipientAmountSats < 0) {
            throw new IllegalArgumentException("Dry-run amounts must be non-negative");
        }
        if (txVBytes < 0 || numInputs < 0) {
            throw new IllegalArgumentException("Dry-run size fields must be non-negative");
        }
    }

    /**
     * Creates a successful result and derives the effective fee rate.
     */
    public static DryRunResult success(
            final long feeSats,
            final double txVBytes,
            final long changeSats,
            final int numInputs,
            final long recipientAmountSats) {
        final double effective = txVBytes > 0 ? feeSats / txVBytes : 0.0;
        return new DryRunResult(
                feeSats, txVBytes, changeSats, changeSats > 0, numInputs, effective, recipientAmountSats, null, null);
    }

    /**
     * Creates an error-only result.
     *
     * @param kind    the failure kind, surfaced verbatim
     * @param message optional detail
     * @return result with all numeric fields zero
     */
    public static DryRunResult error(final ErrorKind kind, final @Nullable String message) {
        Objects.requireNonNull(kind, "kind");
        return new DryRunResult(0L, 0.0, 0L, false, 0, 0.0, 0L, kind, message);
    }

    public boolean isError() {
        return error != null;
    }

    public boolean isOk() {
        return error == null;
    }
}
