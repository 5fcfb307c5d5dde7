// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.send;

/**
 * Lifecycle phase of the active draft.
 *
 * <pre>
 * EMPTY → EDITING → ESTIMATING → ESTIMATED_OK | ESTIMATED_ERROR → COMMITTING → DONE | FAILED
 * </pre>
 *
 * Any edit returns the draft to EDITING; disconnecting or cancelling estimation does too.
 */
public enum DraftPhase {
    EMPTY,
    EDITING,
    ESTIMATING,
    ESTIMATED_OK,
    ESTIMATED_ERROR,
    COMMITTING,
    DONE,
    FAILED;

    public boolean isEstimation() {
        return this == ESTIMATING || this == ESTIMATED_OK || this == ESTIMATED_ERROR;
    }
}
