// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.core.model;

import java.util.Objects;
import sh.kestrel.core.types.Sats;

/**
 * Wallet balance split by confirmation status.
 *
 * @param confirmed   confirmed balance
 * @param unconfirmed balance still waiting for confirmation
 */
public record WalletBalance(Sats confirmed, Sats unconfirmed) {

    public static final WalletBalance EMPTY = new WalletBalance(Sats.ZERO, Sats.ZERO);

    public WalletBalance {
        Objects.requireNonNull(confirmed, "confirmed");
        Objects.requireNonNull(unconfirmed, "unconfirmed");
    }

    /**
     * Returns the amount the send flow may spend.
     *
     * @param spendUnconfirmed whether unconfirmed funds count
     * @return confirmed, plus unconfirmed when allowed
     */
    public Sats spendable(final boolean spendUnconfirmed) {
        return spendUnconfirmed ? confirmed.plus(unconfirmed) : confirmed;
    }
}
