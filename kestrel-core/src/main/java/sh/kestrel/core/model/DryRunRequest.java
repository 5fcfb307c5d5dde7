// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import sh.kestrel.core.types.FeeRate;
import sh.kestrel.core.types.Outpoint;

/**
 * Input to the engine's dry-run estimator.
 *
 * <p>An empty {@code coinSelection} lets the engine select coins itself. When
 * {@code maxSend} is set the single recipient's amount is advisory: the engine drains the
 * selected coins (or the whole wallet) to that address and reports the exact amount in
 * {@link DryRunResult#recipientAmountSats()}.
 *
 * @param recipients    ordered destinations, never empty
 * @param feeRate       requested fee rate
 * @param coinSelection explicitly selected coins, or empty
 * @param maxSend       whether to send everything minus fees
 */
public record DryRunRequest(
        List<Recipient> recipients,
        FeeRate feeRate,
        Set<Outpoint> coinSelection,
        boolean maxSend) {

    public DryRunRequest {
        Objects.requireNonNull(recipients, "recipients");
        Objects.requireNonNull(feeRate, "feeRate");
        Objects.requireNonNull(coinSelection, "coinSelection");
        if (recipients.isEmpty()) {
            throw new IllegalArgumentException("Dry-run needs at least one recipient");
        }
        if (maxSend && recipients.size() != 1) {
            throw new IllegalArgumentException("Max send supports exactly one recipient");
        }
        recipients = List.copyOf(recipients);
        coinSelection = Set.copyOf(coinSelection);
    }
}
