// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.core.error;

/**
 * Thrown when a fee-bump request violates replacement policy or cannot be funded.
 */
public final class FeeBumpException extends KestrelException {

    public FeeBumpException(final ErrorKind kind, final String message) {
        super(kind, message, null);
    }
}
