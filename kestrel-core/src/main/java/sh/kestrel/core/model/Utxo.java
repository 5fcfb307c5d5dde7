// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.core.model;

import java.util.Objects;
import org.jspecify.annotations.Nullable;
import sh.kestrel.core.types.Outpoint;
import sh.kestrel.core.types.Sats;

/**
 * Unspent transaction output owned by the wallet.
 *
 * @param outpoint  the output reference
 * @param address   the address holding the coin
 * @param amount    value of the output
 * @param confirmed whether the creating transaction is confirmed
 * @param frozen    whether the user excluded this coin from spending
 * @param label     optional user label
 */
public record Utxo(
        Outpoint outpoint,
        String address,
        Sats amount,
        boolean confirmed,
        boolean frozen,
        @Nullable String label) {

    public Utxo {
        Objects.requireNonNull(outpoint, "outpoint");
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(amount, "amount");
    }

    /**
     * Returns whether the coin may be chosen for spending.
     *
     * @param spendUnconfirmed whether unconfirmed coins are allowed
     * @return true if not frozen and confirmed (or unconfirmed spending is allowed)
     */
    public boolean isSpendable(final boolean spendUnconfirmed) {
        return !frozen && (confirmed || spendUnconfirmed);
    }
}
