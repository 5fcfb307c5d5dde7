// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.send;

import sh.kestrel.core.error.EngineException;
import sh.kestrel.core.model.DryRunRequest;
import sh.kestrel.core.model.DryRunResult;
import sh.kestrel.send.psbt.SignedPayload;
import sh.kestrel.send.psbt.SignedTotals;
import sh.kestrel.send.psbt.UnsignedPsbt;

/**
 * The wallet engine: coin selection, transaction building, signing and broadcast.
 *
 * <p>Every method may block on disk or network I/O; callers run them off the UI thread.
 * Failures are reported as {@link EngineException} carrying the matching error kind.
 *
 * @since 0.1.0
 */
public interface WalletEngine {

    /**
     * Builds, but neither signs nor broadcasts, a transaction for the request.
     *
     * <p>Insufficient funds, dust outputs and connectivity problems are normally returned as
     * error results rather than thrown.
     *
     * @param request the transaction parameters
     * @return the fee and size of the transaction, or an error result
     * @throws EngineException if the estimate could not be produced
     */
    DryRunResult dryRun(DryRunRequest request);

    /**
     * Builds, signs and broadcasts a transaction.
     *
     * @param request approved parameters
     * @return the txid
     * @throws EngineException on any failure
     */
    String commitSend(CommitRequest request);

    /**
     * Builds an unsigned PSBT for an external signer.
     *
     * @param request approved parameters
     * @return the unsigned PSBT and its expected totals
     * @throws EngineException on any failure
     */
    UnsignedPsbt commitPsbtCreate(CommitRequest request);

    /**
     * Decodes signed data returned by an external signer and recomputes its totals.
     *
     * @param payload the classified signed data
     * @return totals as found in the signed data
     * @throws EngineException if the data cannot be decoded
     */
    SignedTotals inspectSigned(SignedPayload payload);

    /**
     * Finalizes and broadcasts signed data. A signed PSBT is combined with the unsigned
     * original first so that fields the signer stripped are restored.
     *
     * @param payload  the signed data
     * @param unsigned the PSBT that was exported
     * @return the txid
     * @throws EngineException on any failure
     */
    String broadcastSigned(SignedPayload payload, UnsignedPsbt unsigned);

    /**
     * @return true if the wallet holds no private keys and must use an external signer
     */
    boolean isWatchOnly();
}
