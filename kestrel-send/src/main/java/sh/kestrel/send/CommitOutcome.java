// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.send;

import java.util.Objects;
import sh.kestrel.send.psbt.PsbtHandshake;

/**
 * Result of a successful {@link SendDraftOrchestrator#commit()}.
 *
 * @since 0.1.0
 */
public sealed interface CommitOutcome {

    /**
     * The transaction was signed and broadcast.
     *
     * @param txid id of the broadcast transaction
     */
    record Sent(String txid) implements CommitOutcome {
        public Sent {
            Objects.requireNonNull(txid, "txid");
        }
    }

    /**
     * A watch-only wallet produced an unsigned PSBT; the handshake drives external signing.
     *
     * @param handshake the signing session
     */
    record PsbtCreated(PsbtHandshake handshake) implements CommitOutcome {
        public PsbtCreated {
            Objects.requireNonNull(handshake, "handshake");
        }
    }
}
