// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.send.psbt;

import java.util.Objects;
import org.jspecify.annotations.Nullable;
import sh.kestrel.core.error.ErrorKind;

/**
 * Immutable snapshot of a {@link PsbtHandshake}.
 *
 * @param unsigned     the exported PSBT
 * @param phase        current phase
 * @param signed       accepted signed data, once received
 * @param reconciled   exported versus signed totals, once received
 * @param error        error of the last failed step
 * @param errorMessage detail for {@code error}
 * @param txid         txid once broadcast
 */
public record PsbtSession(
        UnsignedPsbt unsigned,
        PsbtPhase phase,
        @Nullable SignedPayload signed,
        @Nullable ReconciledTotals reconciled,
        @Nullable ErrorKind error,
        @Nullable String errorMessage,
        @Nullable String txid) {

    public PsbtSession {
        Objects.requireNonNull(unsigned, "unsigned");
        Objects.requireNonNull(phase, "phase");
    }

    static PsbtSession exporting(final UnsignedPsbt unsigned) {
        return new PsbtSession(unsigned, PsbtPhase.EXPORTING, null, null, null, null, null);
    }

    PsbtSession withPhase(final PsbtPhase next) {
        return new PsbtSession(unsigned, next, signed, reconciled, error, errorMessage, txid);
    }

    PsbtSession withError(final ErrorKind kind, final @Nullable String message) {
        return new PsbtSession(unsigned, phase, signed, reconciled, kind, message, txid);
    }

    PsbtSession withSigned(final SignedPayload payload, final ReconciledTotals totals) {
        return new PsbtSession(unsigned, PsbtPhase.CONFIRMING_BROADCAST, payload, totals, null, null, txid);
    }

    PsbtSession done(final String broadcastTxid) {
        return new PsbtSession(unsigned, PsbtPhase.DONE, signed, reconciled, null, null, broadcastTxid);
    }
}
