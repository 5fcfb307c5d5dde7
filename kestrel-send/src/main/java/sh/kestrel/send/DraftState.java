// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.send;

import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import sh.kestrel.core.error.ErrorKind;
import sh.kestrel.core.model.DryRunResult;
import sh.kestrel.core.types.Sats;

/**
 * Immutable snapshot of a {@link SendDraftOrchestrator}.
 *
 * @param version             increases with every observable change
 * @param phase               lifecycle phase
 * @param draft               the draft
 * @param dryRun              latest dry-run for the current draft, or null
 * @param maxSendAmount       under max send: the heuristic, replaced by the exact amount once known
 * @param maxSendExact        whether {@code maxSendAmount} came from the engine
 * @param addressErrors       address error per row index, only for rows with a typed, invalid address
 * @param validRecipientCount rows with a valid address and a positive amount
 * @param totalSending        sum over valid rows (the max-send amount under max send)
 * @param available           balance of the selected coins, or of the wallet
 * @param canCommit           whether {@link SendDraftOrchestrator#commit()} would be accepted
 * @param commitInFlight      whether a commit is running
 * @param lastError           most recent dry-run or commit error
 * @param lastTxid            txid of the last successful send
 * @param connected           whether the network backend is reachable
 * @since 0.1.0
 */
public record DraftState(
        long version,
        DraftPhase phase,
        SendDraft draft,
        @Nullable DryRunResult dryRun,
        @Nullable Sats maxSendAmount,
        boolean maxSendExact,
        Map<Integer, ErrorKind> addressErrors,
        int validRecipientCount,
        Sats totalSending,
        Sats available,
        boolean canCommit,
        boolean commitInFlight,
        @Nullable ErrorKind lastError,
        @Nullable String lastTxid,
        boolean connected) {

    public DraftState {
        Objects.requireNonNull(phase, "phase");
        Objects.requireNonNull(draft, "draft");
        Objects.requireNonNull(addressErrors, "addressErrors");
        Objects.requireNonNull(totalSending, "totalSending");
        Objects.requireNonNull(available, "available");
        addressErrors = Map.copyOf(addressErrors);
    }
}
