// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.core.error;

/** Thrown when a send draft cannot be written to or removed from storage. */
public final class DraftStoreException extends KestrelException {

    public DraftStoreException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
