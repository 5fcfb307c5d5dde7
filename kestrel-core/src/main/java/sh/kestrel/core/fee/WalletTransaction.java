// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.core.fee;

import java.util.List;
import java.util.Objects;

/**
 * Wallet-side view of a transaction, as needed to decide whether it can be bumped.
 *
 * @param txid                 transaction id
 * @param confirmed            whether it is in a block
 * @param inputSequences       nSequence of every input, as unsigned 32-bit values
 * @param ownedUnspentOutputs  number of its outputs the wallet owns and has not spent
 */
public record WalletTransaction(
        String txid, boolean confirmed, List<Long> inputSequences, int ownedUnspentOutputs) {

    public WalletTransaction {
        Objects.requireNonNull(txid, "txid");
        Objects.requireNonNull(inputSequences, "inputSequences");
        if (ownedUnspentOutputs < 0) {
            throw new IllegalArgumentException("ownedUnspentOutputs must be >= 0, got: " + ownedUnspentOutputs);
        }
        inputSequences = List.copyOf(inputSequences);
    }
}
