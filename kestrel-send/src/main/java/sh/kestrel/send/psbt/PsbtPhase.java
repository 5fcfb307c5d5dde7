// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.send.psbt;

/**
 * Phase of an offline-signing session. Phases only move forward, except for an explicit
 * cancel before broadcasting begins.
 */
public enum PsbtPhase {
    EXPORTING,
    AWAITING_SIGNED,
    CONFIRMING_BROADCAST,
    BROADCASTING,
    DONE,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED || this == CANCELLED;
    }

    public boolean isCancellable() {
        return this == EXPORTING || this == AWAITING_SIGNED || this == CONFIRMING_BROADCAST;
    }
}
