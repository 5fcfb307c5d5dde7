// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.send;

import java.util.Objects;
import org.jspecify.annotations.Nullable;
import sh.kestrel.core.model.DryRunRequest;

/**
 * Instruction to build (and, for a signing wallet, sign and broadcast) the transaction a
 * dry-run approved.
 *
 * @param transaction        the approved parameters; under max send the recipient amount is
 *                           the exact amount the dry-run reported
 * @param precomputedFeeSats fee of the approving dry-run; the engine must not exceed it
 * @param label              optional transaction label
 */
public record CommitRequest(DryRunRequest transaction, long precomputedFeeSats, @Nullable String label) {

    public CommitRequest {
        Objects.requireNonNull(transaction, "transaction");
        if (precomputedFeeSats < 0) {
            throw new IllegalArgumentException("precomputedFeeSats must be >= 0, got: " + precomputedFeeSats);
        }
    }
}
