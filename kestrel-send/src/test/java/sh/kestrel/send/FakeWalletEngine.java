// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.send;

import java.util.Base64;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import sh.kestrel.core.model.DryRunRequest;
import sh.kestrel.core.model.DryRunResult;
import sh.kestrel.send.psbt.SignedPayload;
import sh.kestrel.send.psbt.SignedTotals;
import sh.kestrel.send.psbt.UnsignedPsbt;

/**
 * Scriptable engine that records every call.
 *
 * <p>By default a dry-run succeeds with a 141 vB transaction paying one sat per vB and the
 * requested amount to the first recipient; commits return fixed identifiers.
 */
final class FakeWalletEngine implements WalletEngine {

    static final String TXID = "4a5e1e4baab89f3a32518a88c31bc87f618f76673e2cc77ab2127b7afdeda33b";
    static final String PSBT = "cHNidP8BAHECAAAAAQ==";
    static final String SIGNED_PSBT =
            Base64.getEncoder().encodeToString(new byte[] {0x70, 0x73, 0x62, 0x74, (byte) 0xff, 0x01, 0x00, 0x52});

    final List<DryRunRequest> dryRuns = new CopyOnWriteArrayList<>();
    final List<CommitRequest> commits = new CopyOnWriteArrayList<>();

    volatile Function<DryRunRequest, DryRunResult> dryRunHandler = FakeWalletEngine::defaultResult;
    volatile Function<CommitRequest, String> sendHandler = request -> TXID;
    volatile Function<SignedPayload, SignedTotals> inspectHandler = payload -> {
        throw new UnsupportedOperationException("not scripted");
    };
    volatile Function<SignedPayload, String> broadcastHandler = payload -> {
        throw new UnsupportedOperationException("not scripted");
    };
    volatile boolean watchOnly;

    static DryRunResult defaultResult(DryRunRequest request) {
        return DryRunResult.success(141, 141.0, 1_000, 1, request.recipients().get(0).amount().value());
    }

    @Override
    public DryRunResult dryRun(DryRunRequest request) {
        dryRuns.add(request);
        return dryRunHandler.apply(request);
    }

    @Override
    public String commitSend(CommitRequest request) {
        commits.add(request);
        return sendHandler.apply(request);
    }

    @Override
    public UnsignedPsbt commitPsbtCreate(CommitRequest request) {
        commits.add(request);
        return new UnsignedPsbt(PSBT, request.precomputedFeeSats(), 100_000,
                request.transaction().recipients(), 1_000);
    }

    @Override
    public SignedTotals inspectSigned(SignedPayload payload) {
        return inspectHandler.apply(payload);
    }

    @Override
    public String broadcastSigned(SignedPayload payload, UnsignedPsbt unsigned) {
        return broadcastHandler.apply(payload);
    }

    @Override
    public boolean isWatchOnly() {
        return watchOnly;
    }

    DryRunRequest lastDryRun() {
        return dryRuns.get(dryRuns.size() - 1);
    }
}
