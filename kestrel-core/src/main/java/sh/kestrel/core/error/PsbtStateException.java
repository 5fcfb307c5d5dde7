// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.core.error;

/**
 * Thrown when an offline-signing handshake operation is called from a phase that does not
 * allow it.
 */
public final class PsbtStateException extends KestrelException {

    public PsbtStateException(final String message) {
        super(message);
    }
}
