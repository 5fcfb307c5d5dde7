// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.send.psbt;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.kestrel.core.DebugLogger;
import sh.kestrel.core.error.EngineException;
import sh.kestrel.core.error.ErrorKind;
import sh.kestrel.core.error.PsbtStateException;
import sh.kestrel.send.WalletEngine;

/**
 * Offline-signing session for a watch-only wallet.
 *
 * <p>Drives an unsigned PSBT out to an air-gapped signer and the signed result back in:
 *
 * <pre>
 * EXPORTING ─markExported→ AWAITING_SIGNED ─acceptSignedPayload→ CONFIRMING_BROADCAST
 *     ─confirmBroadcast→ BROADCASTING → DONE | FAILED
 * </pre>
 *
 * <p>{@link #cancel()} ends the session from any phase before BROADCASTING. A failed
 * broadcast is terminal: the signature covers the exact transaction, so a retry with other
 * parameters needs a new session.
 *
 * <p><strong>Thread Safety:</strong> all transitions are synchronized on the handshake;
 * listeners run on the thread that made the transition, under that lock. A listener that
 * throws is logged and does not stop the transition.
 *
 * @since 0.1.0
 */
public final class PsbtHandshake {

    private static final Logger LOG = LoggerFactory.getLogger(PsbtHandshake.class);

    private final WalletEngine engine;
    private final Executor executor;
    private final List<Consumer<PsbtSession>> listeners = new CopyOnWriteArrayList<>();

    private PsbtSession session;

    /**
     * @param engine   engine used to inspect and broadcast signed data
     * @param unsigned the exported PSBT
     * @param executor executor for the broadcast call
     */
    public PsbtHandshake(final WalletEngine engine, final UnsignedPsbt unsigned, final Executor executor) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.session = PsbtSession.exporting(Objects.requireNonNull(unsigned, "unsigned"));
    }

    public synchronized PsbtSession session() {
        return session;
    }

    public void addListener(final Consumer<PsbtSession> listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(final Consumer<PsbtSession> listener) {
        listeners.remove(listener);
    }

    /**
     * Records that the unsigned PSBT has been shown or saved for the signer.
     *
     * @return the new session snapshot
     * @throws PsbtStateException unless in EXPORTING
     */
    public synchronized PsbtSession markExported() {
        requirePhase(PsbtPhase.EXPORTING, "markExported");
        return transition(session.withPhase(PsbtPhase.AWAITING_SIGNED));
    }

    /**
     * Accepts scanned or pasted signed data.
     *
     * @param text base64 PSBT or raw transaction hex
     * @return the new session snapshot; on unusable data the phase stays AWAITING_SIGNED and
     *         {@link PsbtSession#error()} is {@link ErrorKind#PSBT_UNPARSEABLE_SIGNED_PAYLOAD}
     * @throws PsbtStateException unless in AWAITING_SIGNED
     */
    public synchronized PsbtSession acceptSignedPayload(final String text) {
        requirePhase(PsbtPhase.AWAITING_SIGNED, "acceptSignedPayload");
        return accept(SignedPayload.fromText(text));
    }

    /**
     * Accepts signed data loaded from a file.
     *
     * @param bytes binary or text PSBT, or a binary or hex raw transaction
     * @return the new session snapshot, as for {@link #acceptSignedPayload(String)}
     * @throws PsbtStateException unless in AWAITING_SIGNED
     */
    public synchronized PsbtSession acceptSignedPayload(final byte[] bytes) {
        requirePhase(PsbtPhase.AWAITING_SIGNED, "acceptSignedPayload");
        return accept(SignedPayload.fromBytes(bytes));
    }

    /**
     * Broadcasts the accepted signed data.
     *
     * <p>The session moves to BROADCASTING before this method returns. The future completes
     * with the txid once the session reaches DONE, or exceptionally with the engine failure
     * once it reaches FAILED. If the executor refuses the broadcast the session fails at once.
     *
     * @return future txid
     * @throws PsbtStateException unless in CONFIRMING_BROADCAST
     */
    public synchronized CompletableFuture<String> confirmBroadcast() {
        requirePhase(PsbtPhase.CONFIRMING_BROADCAST, "confirmBroadcast");
        final SignedPayload payload = Objects.requireNonNull(session.signed(), "signed");
        final UnsignedPsbt unsigned = session.unsigned();
        transition(session.withPhase(PsbtPhase.BROADCASTING));
        DebugLogger.logPsbt("broadcasting %s payload", payload.format());

        final CompletableFuture<String> broadcast;
        try {
            broadcast = CompletableFuture.supplyAsync(() -> engine.broadcastSigned(payload, unsigned), executor);
        } catch (RejectedExecutionException e) {
            final EngineException failure =
                    new EngineException(ErrorKind.PSBT_BROADCAST_FAILED, "Broadcast could not be scheduled", e);
            onBroadcastComplete(null, failure);
            return CompletableFuture.failedFuture(failure);
        }
        return broadcast.whenComplete((txid, error) -> onBroadcastComplete(txid, error));
    }

    /**
     * Abandons the session.
     *
     * @return the cancelled session snapshot
     * @throws PsbtStateException once broadcasting has begun or the session has ended
     */
    public synchronized PsbtSession cancel() {
        if (!session.phase().isCancellable()) {
            throw new PsbtStateException("Cannot cancel signing session in phase " + session.phase());
        }
        LOG.debug("Signing session cancelled in phase {}", session.phase());
        return transition(session.withPhase(PsbtPhase.CANCELLED));
    }

    private PsbtSession accept(final Optional<SignedPayload> parsed) {
        if (parsed.isEmpty()) {
            LOG.debug("Rejected signed data: not a PSBT or raw transaction");
            return transition(session.withError(
                    ErrorKind.PSBT_UNPARSEABLE_SIGNED_PAYLOAD, ErrorKind.PSBT_UNPARSEABLE_SIGNED_PAYLOAD.message()));
        }
        final SignedPayload payload = parsed.get();
        final SignedTotals totals;
        try {
            totals = engine.inspectSigned(payload);
        } catch (EngineException e) {
            LOG.debug("Engine could not decode signed {}: {}", payload.format(), e.getMessage());
            return transition(session.withError(ErrorKind.PSBT_UNPARSEABLE_SIGNED_PAYLOAD, e.getMessage()));
        }
        final ReconciledTotals reconciled = new ReconciledTotals(session.unsigned(), totals);
        if (reconciled.anyChanged()) {
            LOG.info("Signed transaction differs from export: fee delta {} sats, recipients changed: {}",
                    reconciled.feeDeltaSats(), reconciled.recipientsChanged());
        }
        DebugLogger.logPsbt("accepted signed %s: %s", payload.format(), totals);
        return transition(session.withSigned(payload, reconciled));
    }

    private void onBroadcastComplete(final @Nullable String txid, final @Nullable Throwable error) {
        synchronized (this) {
            if (error == null) {
                LOG.info("Broadcast signed transaction {}", txid);
                transition(session.done(Objects.requireNonNull(txid, "txid")));
                return;
            }
            final Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause()
                    : error;
            LOG.warn("Broadcast of signed transaction failed: {}", cause.getMessage());
            transition(session.withPhase(PsbtPhase.FAILED)
                    .withError(ErrorKind.PSBT_BROADCAST_FAILED, cause.getMessage()));
        }
    }

    private void requirePhase(final PsbtPhase expected, final String operation) {
        if (session.phase() != expected) {
            throw new PsbtStateException(
                    operation + " requires phase " + expected + " but session is " + session.phase());
        }
    }

    private PsbtSession transition(final PsbtSession next) {
        session = next;
        for (final Consumer<PsbtSession> listener : listeners) {
            try {
                listener.accept(next);
            } catch (RuntimeException e) {
                LOG.warn("Signing session listener threw", e);
            }
        }
        return next;
    }
}
