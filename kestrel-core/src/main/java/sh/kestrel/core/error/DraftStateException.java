// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.core.error;

/**
 * Thrown when a send-draft operation is not legal in the current state, for example a
 * commit while another commit is in flight or before the latest estimate succeeded.
 */
public final class DraftStateException extends KestrelException {

    public DraftStateException(final String message) {
        super(message);
    }
}
