// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.core.error;

import java.util.Objects;

/**
 * Failure reported by the external wallet engine (dry-run, commit, inspection or broadcast).
 *
 * <p>The {@link #kind()} is always present and is surfaced to callers unchanged.
 */
public final class EngineException extends KestrelException {

    public EngineException(final ErrorKind kind, final String message) {
        super(Objects.requireNonNull(kind, "kind"), message, null);
    }

    public EngineException(final ErrorKind kind, final String message, final Throwable cause) {
        super(Objects.requireNonNull(kind, "kind"), message, cause);
    }

    @Override
    public ErrorKind kind() {
        return Objects.requireNonNull(super.kind());
    }
}
