// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.core.error;

import org.jspecify.annotations.Nullable;

/**
 * Base runtime exception for all Kestrel failures.
 *
 * <p>
 * This sealed class forms the root of the exception hierarchy so callers can catch
 * every Kestrel error with a single clause while still matching on the concrete type.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * KestrelException
 * ├── {@link FeeBumpException} - fee-bump policy violations
 * ├── {@link EngineException} - failures reported by the wallet engine
 * ├── {@link DraftStateException} - operations illegal in the current draft state
 * ├── {@link PsbtStateException} - illegal signing-handshake transitions
 * └── {@link DraftStoreException} - draft persistence failures
 * </pre>
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * try {
 *     handshake.cancel();
 * } catch (PsbtStateException e) {
 *     // broadcast already started
 * } catch (KestrelException e) {
 *     // any other Kestrel error
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public sealed class KestrelException extends RuntimeException
        permits FeeBumpException,
        EngineException,
        DraftStateException,
        PsbtStateException,
        DraftStoreException {

    private final @Nullable ErrorKind kind;

    public KestrelException(final String message) {
        this(null, message, null);
    }

    public KestrelException(final String message, final Throwable cause) {
        this(null, message, cause);
    }

    public KestrelException(final @Nullable ErrorKind kind, final String message, final @Nullable Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /**
     * Returns the structured error kind, when the failure maps onto one.
     *
     * @return the kind, or null
     */
    public @Nullable ErrorKind kind() {
        return kind;
    }
}
