// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.send;

/**
 * Receives a snapshot after every observable change of a {@link SendDraftOrchestrator}.
 *
 * <p>Called on the thread that caused the change while the orchestrator's lock is held, so
 * snapshots arrive in order. Implementations must return quickly and must not block on
 * other threads that use the orchestrator.
 */
@FunctionalInterface
public interface DraftListener {

    void onStateChanged(DraftState state);
}
