// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.send;

import java.util.List;
import sh.kestrel.core.model.Utxo;
import sh.kestrel.core.model.WalletBalance;

/**
 * Read access to the wallet's current coins and balance.
 */
public interface WalletStateSource {

    /**
     * @return the current unspent outputs, frozen coins included
     */
    List<Utxo> unspent();

    WalletBalance balance();
}
