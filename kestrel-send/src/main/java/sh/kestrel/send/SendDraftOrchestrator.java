// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.send;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.kestrel.core.DebugLogger;
import sh.kestrel.core.error.DraftStateException;
import sh.kestrel.core.error.DraftStoreException;
import sh.kestrel.core.error.EngineException;
import sh.kestrel.core.error.ErrorKind;
import sh.kestrel.core.fee.FeeEstimates;
import sh.kestrel.core.fee.FeePriority;
import sh.kestrel.core.model.DryRunRequest;
import sh.kestrel.core.model.DryRunResult;
import sh.kestrel.core.model.Recipient;
import sh.kestrel.core.model.Utxo;
import sh.kestrel.core.types.FeeRate;
import sh.kestrel.core.types.Outpoint;
import sh.kestrel.core.types.Sats;
import sh.kestrel.send.psbt.PsbtHandshake;
import sh.kestrel.send.psbt.UnsignedPsbt;

/**
 * Owns the active {@link SendDraft} and keeps its fee estimate current.
 *
 * <p>Every edit yields a new immutable draft and a new {@link DraftState} snapshot. Edits
 * that affect the transaction (rows, fee rate, coin selection, max send, mode) restart a
 * debounce timer; once the draft has been quiet for {@link SendConfig#debounce()} a single
 * dry-run is sent to the {@link WalletEngine}. Each dry-run is tagged with the estimation
 * generation it was issued for, and results whose tag is no longer current are discarded, so
 * a slow estimate can never overwrite a newer one.
 *
 * <p>The engine is the only authority on feasibility: a draft can be committed only when the
 * latest dry-run for its current contents succeeded.
 *
 * <p><strong>Usage:</strong>
 *
 * <pre>{@code
 * SendDraftOrchestrator orchestrator =
 *         SendDraftOrchestrator.create(engine, walletState, new JsonFileDraftStore(path), SendConfig.defaults());
 * orchestrator.addListener(state -> render(state));
 * orchestrator.restore();
 *
 * orchestrator.setAddress("bc1q...");
 * orchestrator.setAmount("50,000");
 * // ... once state().canCommit() is true
 * orchestrator.commit().thenAccept(outcome -> {
 *     if (outcome instanceof CommitOutcome.PsbtCreated created) {
 *         showForSigning(created.handshake());
 *     }
 * });
 * }</pre>
 *
 * <p><strong>Thread Safety:</strong> all state is guarded by the orchestrator's monitor.
 * Edits may come from any thread; dry-runs and commits run on the engine executor.
 *
 * @since 0.1.0
 */
public final class SendDraftOrchestrator implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(SendDraftOrchestrator.class);

    private final WalletEngine engine;
    private final WalletStateSource walletState;
    private final DraftStore store;
    private final SendConfig config;
    private final ScheduledExecutorService scheduler;
    private final Executor executor;
    private final boolean ownsExecutors;
    private final List<DraftListener> listeners = new CopyOnWriteArrayList<>();
    private final Set<PsbtHandshake> liveHandshakes = new HashSet<>();

    private SendDraft draft;
    private DraftPhase phase = DraftPhase.EMPTY;
    private long version;
    private long estimateTag;
    private @Nullable DryRunResult dryRun;
    private @Nullable DryRunRequest dryRunRequest;
    private @Nullable Sats maxSendAmount;
    private boolean maxSendExact;
    private boolean connected = true;
    private boolean commitInFlight;
    private boolean closed;
    private boolean executorReleased;
    private @Nullable ErrorKind lastError;
    private @Nullable String lastTxid;
    private @Nullable ScheduledFuture<?> pendingEstimate;
    private @Nullable CompletableFuture<DryRunResult> inFlight;
    private DraftState current;

    /**
     * Creates an orchestrator on caller-managed executors.
     *
     * @param engine      the wallet engine
     * @param walletState source of coins and balances
     * @param store       draft persistence
     * @param config      configuration
     * @param scheduler   scheduler for debounce timers
     * @param executor    executor for engine calls
     */
    public SendDraftOrchestrator(
            final WalletEngine engine,
            final WalletStateSource walletState,
            final DraftStore store,
            final SendConfig config,
            final ScheduledExecutorService scheduler,
            final Executor executor) {
        this(engine, walletState, store, config, scheduler, executor, false);
    }

    private SendDraftOrchestrator(
            final WalletEngine engine,
            final WalletStateSource walletState,
            final DraftStore store,
            final SendConfig config,
            final ScheduledExecutorService scheduler,
            final Executor executor,
            final boolean ownsExecutors) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.walletState = Objects.requireNonNull(walletState, "walletState");
        this.store = Objects.requireNonNull(store, "store");
        this.config = Objects.requireNonNull(config, "config");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.ownsExecutors = ownsExecutors;
        this.draft = SendDraft.empty(config.defaultFeeRate(), config.denomination());
        this.current = buildState();
    }

    /**
     * Creates an orchestrator with its own executors from {@link KestrelExecutors}; they are
     * shut down by {@link #close()}.
     *
     * @param engine      the wallet engine
     * @param walletState source of coins and balances
     * @param store       draft persistence
     * @param config      configuration
     * @return the orchestrator
     */
    public static SendDraftOrchestrator create(
            final WalletEngine engine,
            final WalletStateSource walletState,
            final DraftStore store,
            final SendConfig config) {
        return new SendDraftOrchestrator(
                engine,
                walletState,
                store,
                config,
                KestrelExecutors.newDebounceScheduler(),
                KestrelExecutors.newEngineExecutor(),
                true);
    }

    // ---------------------------------------------------------------------
    // Observation
    // ---------------------------------------------------------------------

    public synchronized DraftState state() {
        return current;
    }

    /**
     * Registers a listener; it immediately receives the current state.
     *
     * @param listener the listener
     */
    public synchronized void addListener(final DraftListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
        deliver(listener, current);
    }

    public void removeListener(final DraftListener listener) {
        listeners.remove(listener);
    }

    // ---------------------------------------------------------------------
    // Edits
    // ---------------------------------------------------------------------

    /**
     * Sets the address of the single recipient.
     *
     * @param address address text as typed
     * @throws DraftStateException in multi mode or while a commit is running
     */
    public synchronized void setAddress(final String address) {
        Objects.requireNonNull(address, "address");
        requireEditable();
        requireMode(SendMode.SINGLE, "setAddress");
        update(draft.withRow(0, draft.singleRow().withAddress(address)), true);
    }

    /**
     * Sets the amount of the single recipient. Typing an amount turns max send off.
     *
     * @param amountInput amount text in the draft's denomination
     * @throws DraftStateException in multi mode or while a commit is running
     */
    public synchronized void setAmount(final String amountInput) {
        Objects.requireNonNull(amountInput, "amountInput");
        requireEditable();
        requireMode(SendMode.SINGLE, "setAmount");
        update(draft.withRow(0, draft.singleRow().withAmountInput(amountInput)).withMaxSend(false), true);
    }

    /**
     * Appends an empty recipient row.
     *
     * @return index of the new row
     * @throws DraftStateException in single mode or while a commit is running
     */
    public synchronized int addRow() {
        requireEditable();
        requireMode(SendMode.MULTI, "addRow");
        final List<RecipientRow> rows = new ArrayList<>(draft.rows());
        rows.add(RecipientRow.EMPTY);
        update(draft.withRows(rows), true);
        return rows.size() - 1;
    }

    /**
     * Replaces a recipient row.
     *
     * @param index       row index
     * @param address     address text
     * @param amountInput amount text
     * @throws IllegalArgumentException if the index is out of range
     * @throws DraftStateException      in single mode or while a commit is running
     */
    public synchronized void updateRow(final int index, final String address, final String amountInput) {
        requireEditable();
        requireMode(SendMode.MULTI, "updateRow");
        checkRowIndex(index);
        update(draft.withRow(index, new RecipientRow(address, amountInput)), true);
    }

    /**
     * Removes a recipient row.
     *
     * @param index row index
     * @throws IllegalArgumentException if the index is out of range
     * @throws DraftStateException      in single mode, for the last remaining row, or while a
     *                                  commit is running
     */
    public synchronized void removeRow(final int index) {
        requireEditable();
        requireMode(SendMode.MULTI, "removeRow");
        checkRowIndex(index);
        if (draft.rows().size() == 1) {
            throw new DraftStateException("Cannot remove the only recipient row");
        }
        final List<RecipientRow> rows = new ArrayList<>(draft.rows());
        rows.remove(index);
        update(draft.withRows(rows), true);
    }

    /**
     * Sets the fee rate.
     *
     * @param feeRate the rate
     * @throws IllegalArgumentException if below {@link SendConfig#minFeeRate()}
     */
    public synchronized void setFeeRate(final FeeRate feeRate) {
        Objects.requireNonNull(feeRate, "feeRate");
        requireEditable();
        if (feeRate.isBelow(config.minFeeRate())) {
            throw new IllegalArgumentException("Fee rate " + feeRate.toPlainString()
                    + " sat/vB is below the minimum of " + config.minFeeRate().toPlainString());
        }
        update(draft.withFeeRate(feeRate), true);
    }

    /**
     * Applies a fee preset, raised to the configured minimum if the estimate is lower.
     *
     * @param estimates current network estimates
     * @param priority  chosen confirmation target
     * @return the rate applied
     */
    public synchronized FeeRate applyFeePreset(final FeeEstimates estimates, final FeePriority priority) {
        Objects.requireNonNull(estimates, "estimates");
        final FeeRate estimate = estimates.rateFor(priority);
        final FeeRate rate = estimate.isBelow(config.minFeeRate()) ? config.minFeeRate() : estimate;
        setFeeRate(rate);
        return rate;
    }

    /**
     * Restricts the transaction to the given coins; an empty set restores automatic selection.
     *
     * @param outpoints the coins
     * @throws IllegalArgumentException if an outpoint is not a current, unfrozen wallet coin
     */
    public synchronized void setCoinSelection(final Set<Outpoint> outpoints) {
        Objects.requireNonNull(outpoints, "outpoints");
        requireEditable();
        final Map<Outpoint, Utxo> unspent = unspentByOutpoint();
        for (final Outpoint outpoint : outpoints) {
            final Utxo utxo = unspent.get(outpoint);
            if (utxo == null) {
                throw new IllegalArgumentException("Not an unspent wallet output: " + outpoint);
            }
            if (utxo.frozen()) {
                throw new IllegalArgumentException("Output is frozen: " + outpoint);
            }
        }
        update(draft.withCoinSelection(outpoints), true);
    }

    /**
     * Turns max send on or off. Enabling it shows a heuristic amount immediately; the exact
     * amount replaces it when the dry-run resolves.
     *
     * @param enabled whether to send everything minus fees
     * @throws DraftStateException in multi mode or while a commit is running
     */
    public synchronized void setMaxSend(final boolean enabled) {
        requireEditable();
        requireMode(SendMode.SINGLE, "setMaxSend");
        update(draft.withMaxSend(enabled), true);
    }

    /**
     * Sets the transaction label. Labels do not affect the estimate.
     *
     * @param label the label, or null to remove it
     */
    public synchronized void setLabel(final @Nullable String label) {
        requireEditable();
        update(draft.withLabel(label), false);
    }

    /**
     * Changes the amount unit, converting typed amounts.
     *
     * @param denomination the new unit
     */
    public synchronized void setDenomination(final Denomination denomination) {
        Objects.requireNonNull(denomination, "denomination");
        requireEditable();
        update(draft.withDenomination(denomination), false);
    }

    /**
     * Switches between single and multi mode; see {@link SendDraft#withMode(SendMode)}.
     *
     * @param mode the target mode
     */
    public synchronized void switchMode(final SendMode mode) {
        Objects.requireNonNull(mode, "mode");
        requireEditable();
        update(draft.withMode(mode), true);
    }

    /**
     * Discards the draft, in memory and in the store.
     *
     * @throws DraftStoreException if the stored draft could not be removed; the draft is kept
     */
    public synchronized void discard() {
        requireEditable();
        store.clear();
        resetDraft();
        phase = DraftPhase.EMPTY;
        lastError = null;
        LOG.debug("Send draft discarded");
        publish();
    }

    /**
     * Loads the persisted draft, dropping coins that are no longer spendable.
     *
     * @return true if a draft was restored
     */
    public synchronized boolean restore() {
        requireEditable();
        final Optional<SendDraft> loaded;
        try {
            loaded = store.load();
        } catch (DraftStoreException e) {
            LOG.warn("Could not load send draft", e);
            return false;
        }
        if (loaded.isEmpty()) {
            return false;
        }
        SendDraft restored = loaded.get();
        final Set<Outpoint> kept = retainSelectable(restored.coinSelection());
        if (kept.size() != restored.coinSelection().size()) {
            LOG.debug("Dropped {} stale outpoints from restored draft", restored.coinSelection().size() - kept.size());
            restored = restored.withCoinSelection(kept);
        }
        if (restored.feeRate().isBelow(config.minFeeRate())) {
            restored = restored.withFeeRate(config.minFeeRate());
        }
        update(restored, true);
        return true;
    }

    // ---------------------------------------------------------------------
    // Environment
    // ---------------------------------------------------------------------

    /**
     * Reports backend connectivity. Going offline clears the estimate; coming back online
     * re-estimates.
     *
     * @param online whether the backend is reachable
     */
    public synchronized void onConnectivityChanged(final boolean online) {
        requireOpen();
        if (connected == online) {
            return;
        }
        connected = online;
        LOG.debug("Backend {}", online ? "connected" : "disconnected");
        if (commitInFlight) {
            publish();
            return;
        }
        if (online) {
            restartEstimation(false);
        } else {
            clearEstimation();
        }
        publish();
    }

    /**
     * Reports that the wallet's coins or balance changed, for example after a sync. Spent or
     * newly frozen coins leave the coin selection and the draft is re-estimated; an exact
     * max-send amount is kept until the new estimate arrives.
     */
    public synchronized void onWalletChanged() {
        requireOpen();
        if (commitInFlight) {
            return;
        }
        final Set<Outpoint> kept = retainSelectable(draft.coinSelection());
        if (!kept.equals(draft.coinSelection())) {
            update(draft.withCoinSelection(kept), true);
            return;
        }
        restartEstimation(false);
        publish();
    }

    /**
     * Stops the pending or running dry-run and clears the estimate.
     */
    public synchronized void cancelEstimation() {
        requireOpen();
        if (commitInFlight) {
            return;
        }
        clearEstimation();
        publish();
    }

    // ---------------------------------------------------------------------
    // Commit
    // ---------------------------------------------------------------------

    /**
     * Commits the draft with the fee of its approving dry-run.
     *
     * <p>A signing wallet signs and broadcasts; a watch-only wallet creates an unsigned PSBT
     * and the outcome carries the {@link PsbtHandshake} for it. On success the draft is
     * cleared from memory and from the store. On failure the draft is kept and the error kind
     * is published in {@link DraftState#lastError()}.
     *
     * @return future outcome; completes exceptionally with the engine failure
     * @throws DraftStateException if {@link DraftState#canCommit()} is false or a commit is
     *                             already running
     */
    public CompletableFuture<CommitOutcome> commit() {
        final CommitRequest request;
        synchronized (this) {
            requireOpen();
            if (commitInFlight) {
                throw new DraftStateException("A commit is already in progress");
            }
            if (!canCommit()) {
                throw new DraftStateException("Draft cannot be committed in phase " + phase);
            }
            request = commitRequest();
            cancelPendingWork();
            commitInFlight = true;
            phase = DraftPhase.COMMITTING;
            publish();
        }
        LOG.info("Committing send to {} recipient(s) with fee {} sats",
                request.transaction().recipients().size(), request.precomputedFeeSats());
        return CompletableFuture.supplyAsync(() -> execute(request), executor)
                .whenComplete(this::onCommitComplete);
    }

    /**
     * Stops timers and, when the orchestrator created its own executors, shuts them down.
     * The draft stays persisted.
     *
     * <p>An owned engine executor stays up until an in-flight commit and every signing session
     * it produced have finished, so those sessions can still broadcast.
     */
    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            cancelPendingWork();
        }
        listeners.clear();
        if (ownsExecutors) {
            scheduler.shutdownNow();
        }
        releaseExecutorIfIdle();
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private void update(final SendDraft next, final boolean affectsEstimate) {
        if (next.equals(draft)) {
            return;
        }
        final SendDraft previous = draft;
        draft = next;
        persist();
        if (affectsEstimate) {
            final boolean resetMaxSend = (next.maxSend() && !previous.maxSend())
                    || !next.feeRate().equals(previous.feeRate())
                    || !next.coinSelection().equals(previous.coinSelection());
            restartEstimation(resetMaxSend);
        } else if (phase == DraftPhase.EMPTY || phase == DraftPhase.DONE) {
            phase = restingPhase();
        }
        publish();
    }

    private void restartEstimation(final boolean resetMaxSend) {
        estimateTag++;
        cancelPendingWork();
        dryRun = null;
        dryRunRequest = null;
        lastError = null;
        if (draft.maxSend()) {
            if (resetMaxSend || maxSendAmount == null) {
                maxSendAmount = maxSendHeuristic();
                maxSendExact = false;
            }
        } else {
            maxSendAmount = null;
            maxSendExact = false;
        }
        phase = restingPhase();
        if (connected && buildDryRunRequest() != null) {
            final long tag = estimateTag;
            pendingEstimate = scheduler.schedule(
                    () -> issueDryRun(tag), config.debounce().toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    private void clearEstimation() {
        estimateTag++;
        cancelPendingWork();
        dryRun = null;
        dryRunRequest = null;
        lastError = null;
        if (phase.isEstimation()) {
            phase = DraftPhase.EDITING;
        }
    }

    private void issueDryRun(final long tag) {
        final DryRunRequest request;
        synchronized (this) {
            if (tag != estimateTag || closed || !connected || commitInFlight) {
                return;
            }
            pendingEstimate = null;
            request = buildDryRunRequest();
            if (request == null) {
                return;
            }
            phase = DraftPhase.ESTIMATING;
            publish();
        }
        LOG.debug("Issuing dry-run #{} for {} recipient(s) at {} sat/vB",
                tag, request.recipients().size(), request.feeRate().toPlainString());
        DebugLogger.logEstimation("dry-run #%d request %s", tag, request);

        CompletableFuture<DryRunResult> future = CompletableFuture.supplyAsync(() -> engine.dryRun(request), executor);
        if (config.dryRunTimeout() != null) {
            future = future.orTimeout(config.dryRunTimeout().toMillis(), TimeUnit.MILLISECONDS);
        }
        final CompletableFuture<Void> delivered = future
                .handle((result, error) -> error == null ? result : toErrorResult(error))
                .thenAccept(result -> onDryRunResult(tag, request, result));
        synchronized (this) {
            if (tag == estimateTag && !delivered.isDone()) {
                inFlight = future;
            }
        }
    }

    private synchronized void onDryRunResult(
            final long tag, final DryRunRequest request, final @Nullable DryRunResult result) {
        if (tag != estimateTag || closed) {
            LOG.debug("Discarding superseded dry-run #{}", tag);
            return;
        }
        inFlight = null;
        final DryRunResult resolved = result != null
                ? result
                : DryRunResult.error(ErrorKind.DRY_RUN_FAILED, "Engine returned no result");
        DebugLogger.logEstimation("dry-run #%d result %s", tag, resolved);
        dryRun = resolved;
        dryRunRequest = request;
        if (resolved.isOk()) {
            phase = DraftPhase.ESTIMATED_OK;
            lastError = null;
            if (draft.maxSend()) {
                final Sats exact = Sats.of(resolved.recipientAmountSats());
                if (!maxSendExact || !exact.equals(maxSendAmount)) {
                    LOG.debug("Max send amount resolved to {} sats", exact.value());
                    maxSendAmount = exact;
                    maxSendExact = true;
                }
            }
        } else {
            phase = DraftPhase.ESTIMATED_ERROR;
            lastError = resolved.error();
            LOG.debug("Dry-run #{} failed: {} {}", tag, resolved.error(), resolved.errorMessage());
        }
        publish();
    }

    private DryRunResult toErrorResult(final Throwable error) {
        final Throwable cause = unwrap(error);
        if (cause instanceof TimeoutException) {
            return DryRunResult.error(ErrorKind.DRY_RUN_NETWORK_UNAVAILABLE,
                    "Dry-run timed out after " + config.dryRunTimeout());
        }
        if (cause instanceof EngineException) {
            final EngineException engineError = (EngineException) cause;
            return DryRunResult.error(engineError.kind(), engineError.getMessage());
        }
        if (cause instanceof CancellationException) {
            return DryRunResult.error(ErrorKind.DRY_RUN_FAILED, "Dry-run cancelled");
        }
        LOG.warn("Dry-run failed unexpectedly", cause);
        return DryRunResult.error(ErrorKind.DRY_RUN_FAILED, cause.getMessage());
    }

    private CommitOutcome execute(final CommitRequest request) {
        if (engine.isWatchOnly()) {
            final UnsignedPsbt psbt = engine.commitPsbtCreate(request);
            LOG.info("Created unsigned PSBT with fee {} sats", psbt.feeSats());
            return new CommitOutcome.PsbtCreated(track(new PsbtHandshake(engine, psbt, executor)));
        }
        final String txid = engine.commitSend(request);
        LOG.info("Sent transaction {}", txid);
        return new CommitOutcome.Sent(txid);
    }

    private PsbtHandshake track(final PsbtHandshake handshake) {
        synchronized (this) {
            liveHandshakes.add(handshake);
        }
        handshake.addListener(session -> {
            if (session.phase().isTerminal()) {
                synchronized (this) {
                    liveHandshakes.remove(handshake);
                }
                releaseExecutorIfIdle();
            }
        });
        return handshake;
    }

    private void releaseExecutorIfIdle() {
        synchronized (this) {
            if (!ownsExecutors || !closed || executorReleased || commitInFlight || !liveHandshakes.isEmpty()) {
                return;
            }
            executorReleased = true;
        }
        LOG.debug("Shutting down engine executor");
        ((ExecutorService) executor).shutdown();
    }

    private void onCommitComplete(
            final @Nullable CommitOutcome outcome, final @Nullable Throwable error) {
        completeCommit(outcome, error);
        releaseExecutorIfIdle();
    }

    private synchronized void completeCommit(
            final @Nullable CommitOutcome outcome, final @Nullable Throwable error) {
        commitInFlight = false;
        if (error == null) {
            try {
                store.clear();
            } catch (DraftStoreException e) {
                LOG.warn("Transaction committed but the stored draft could not be cleared", e);
            }
            resetDraft();
            phase = DraftPhase.DONE;
            lastError = null;
            lastTxid = outcome instanceof CommitOutcome.Sent ? ((CommitOutcome.Sent) outcome).txid() : null;
        } else {
            final Throwable cause = unwrap(error);
            lastError = cause instanceof EngineException ? ((EngineException) cause).kind() : ErrorKind.COMMIT_FAILED;
            phase = DraftPhase.FAILED;
            LOG.warn("Commit failed: {}", cause.getMessage());
        }
        publish();
    }

    private void resetDraft() {
        estimateTag++;
        cancelPendingWork();
        draft = SendDraft.empty(config.defaultFeeRate(), config.denomination());
        dryRun = null;
        dryRunRequest = null;
        maxSendAmount = null;
        maxSendExact = false;
    }

    private void cancelPendingWork() {
        if (pendingEstimate != null) {
            pendingEstimate.cancel(false);
            pendingEstimate = null;
        }
        if (inFlight != null) {
            inFlight.cancel(true);
            inFlight = null;
        }
    }

    private void persist() {
        try {
            store.save(draft);
        } catch (DraftStoreException e) {
            LOG.warn("Could not persist send draft", e);
        }
    }

    private DraftPhase restingPhase() {
        return draft.isBlank() ? DraftPhase.EMPTY : DraftPhase.EDITING;
    }

    private @Nullable DryRunRequest buildDryRunRequest() {
        if (draft.mode() == SendMode.SINGLE) {
            final RecipientRow row = draft.singleRow();
            if (!row.hasValidAddress()) {
                return null;
            }
            if (draft.maxSend()) {
                final Sats amount = maxSendAmount != null ? maxSendAmount : maxSendHeuristic();
                return new DryRunRequest(
                        List.of(new Recipient(row.address().trim(), amount)),
                        draft.feeRate(),
                        draft.coinSelection(),
                        true);
            }
            return row.toRecipient(draft.denomination())
                    .map(r -> new DryRunRequest(List.of(r), draft.feeRate(), draft.coinSelection(), false))
                    .orElse(null);
        }
        final List<Recipient> recipients = draft.recipients();
        if (recipients.isEmpty()) {
            return null;
        }
        return new DryRunRequest(recipients, draft.feeRate(), draft.coinSelection(), false);
    }

    private CommitRequest commitRequest() {
        final DryRunResult approved = Objects.requireNonNull(dryRun, "dryRun");
        DryRunRequest transaction = Objects.requireNonNull(dryRunRequest, "dryRunRequest");
        if (transaction.maxSend()) {
            final Recipient recipient = transaction.recipients().get(0);
            transaction = new DryRunRequest(
                    List.of(new Recipient(recipient.address(), Sats.of(approved.recipientAmountSats()))),
                    transaction.feeRate(),
                    transaction.coinSelection(),
                    true);
        }
        return new CommitRequest(transaction, approved.feeSats(), draft.label());
    }

    private boolean isCommittable() {
        if (draft.mode() == SendMode.SINGLE) {
            final RecipientRow row = draft.singleRow();
            return row.hasValidAddress() && (draft.maxSend() || row.amount(draft.denomination()).isPresent());
        }
        return draft.recipients().size() >= 2;
    }

    private boolean canCommit() {
        return !closed
                && !commitInFlight
                && dryRun != null
                && dryRun.isOk()
                && dryRunRequest != null
                && isCommittable();
    }

    private Sats maxSendHeuristic() {
        final long reserve = Math.multiplyExact(draft.feeRate().truncatedSatPerVb(), config.maxSendHeuristicVBytes());
        return availableSats().minusOrZero(Sats.of(reserve));
    }

    private Sats availableSats() {
        if (draft.coinSelection().isEmpty()) {
            return walletState.balance().spendable(config.spendUnconfirmed());
        }
        Sats total = Sats.ZERO;
        for (final Utxo utxo : walletState.unspent()) {
            if (draft.coinSelection().contains(utxo.outpoint())) {
                total = total.plus(utxo.amount());
            }
        }
        return total;
    }

    private Map<Outpoint, Utxo> unspentByOutpoint() {
        final Map<Outpoint, Utxo> byOutpoint = new HashMap<>();
        for (final Utxo utxo : walletState.unspent()) {
            byOutpoint.put(utxo.outpoint(), utxo);
        }
        return byOutpoint;
    }

    private Set<Outpoint> retainSelectable(final Set<Outpoint> outpoints) {
        if (outpoints.isEmpty()) {
            return outpoints;
        }
        final Map<Outpoint, Utxo> unspent = unspentByOutpoint();
        final Set<Outpoint> kept = new LinkedHashSet<>();
        for (final Outpoint outpoint : outpoints) {
            final Utxo utxo = unspent.get(outpoint);
            if (utxo != null && !utxo.frozen()) {
                kept.add(outpoint);
            }
        }
        return kept;
    }

    private void publish() {
        version++;
        current = buildState();
        for (final DraftListener listener : listeners) {
            deliver(listener, current);
        }
    }

    private static void deliver(final DraftListener listener, final DraftState state) {
        try {
            listener.onStateChanged(state);
        } catch (RuntimeException e) {
            LOG.warn("Draft listener threw", e);
        }
    }

    private DraftState buildState() {
        final Map<Integer, ErrorKind> addressErrors = new HashMap<>();
        final List<RecipientRow> rows = draft.rows();
        for (int i = 0; i < rows.size(); i++) {
            final ErrorKind error = rows.get(i).addressError();
            if (error != null) {
                addressErrors.put(i, error);
            }
        }

        final int validCount;
        final Sats totalSending;
        if (draft.maxSend()) {
            final boolean valid = draft.singleRow().hasValidAddress();
            validCount = valid ? 1 : 0;
            totalSending = valid && maxSendAmount != null ? maxSendAmount : Sats.ZERO;
        } else {
            final List<Recipient> recipients = draft.recipients();
            validCount = recipients.size();
            Sats sum = Sats.ZERO;
            for (final Recipient recipient : recipients) {
                sum = sum.plusSaturating(recipient.amount());
            }
            totalSending = sum;
        }

        return new DraftState(
                version,
                phase,
                draft,
                dryRun,
                maxSendAmount,
                maxSendExact,
                addressErrors,
                validCount,
                totalSending,
                availableSats(),
                canCommit(),
                commitInFlight,
                lastError,
                lastTxid,
                connected);
    }

    private void requireOpen() {
        if (closed) {
            throw new DraftStateException("Orchestrator is closed");
        }
    }

    private void requireEditable() {
        requireOpen();
        if (commitInFlight) {
            throw new DraftStateException("Draft is locked while a commit is in progress");
        }
    }

    private void requireMode(final SendMode mode, final String operation) {
        if (draft.mode() != mode) {
            throw new DraftStateException(operation + " is only available in " + mode + " mode");
        }
    }

    private void checkRowIndex(final int index) {
        if (index < 0 || index >= draft.rows().size()) {
            throw new IllegalArgumentException(
                    "Row index " + index + " out of range for " + draft.rows().size() + " rows");
        }
    }

    private static Throwable unwrap(final Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }
}
