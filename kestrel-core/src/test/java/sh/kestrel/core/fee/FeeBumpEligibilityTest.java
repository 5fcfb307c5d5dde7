// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.core.fee;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class FeeBumpEligibilityTest {

    private static final String TXID = "4a5e1e4baab89f3a32518a88c31bc87f618f76673e2cc77ab2127b7afdeda33b";

    @Test
    void rbfNeedsSignallingInput() {
        WalletTransaction signalled = tx(false, List.of(0xffffffffL, 0xfffffffdL), 0);
        WalletTransaction finalSeq = tx(false, List.of(0xffffffffL, 0xfffffffeL), 0);

        assertTrue(FeeBumpEligibility.canRbf(signalled, false));
        assertFalse(FeeBumpEligibility.canRbf(finalSeq, false));
    }

    @Test
    void confirmedTransactionsCannotBeBumped() {
        WalletTransaction confirmed = tx(true, List.of(0L), 2);

        assertFalse(FeeBumpEligibility.canRbf(confirmed, false));
        assertFalse(FeeBumpEligibility.canCpfp(confirmed, false));
        assertNull(FeeBumpEligibility.preferredMethod(confirmed, false));
    }

    @Test
    void watchOnlyWalletsCannotBump() {
        WalletTransaction tx = tx(false, List.of(0L), 1);

        assertFalse(FeeBumpEligibility.canRbf(tx, true));
        assertFalse(FeeBumpEligibility.canCpfp(tx, true));
    }

    @Test
    void cpfpNeedsOwnedUnspentOutput() {
        assertTrue(FeeBumpEligibility.canCpfp(tx(false, List.of(0xffffffffL), 1), false));
        assertFalse(FeeBumpEligibility.canCpfp(tx(false, List.of(0xffffffffL), 0), false));
    }

    @Test
    void prefersRbfOverCpfp() {
        assertEquals(BumpMethod.RBF, FeeBumpEligibility.preferredMethod(tx(false, List.of(1L), 1), false));
        assertEquals(BumpMethod.CPFP, FeeBumpEligibility.preferredMethod(tx(false, List.of(0xffffffffL), 1), false));
    }

    private static WalletTransaction tx(boolean confirmed, List<Long> sequences, int owned) {
        return new WalletTransaction(TXID, confirmed, sequences, owned);
    }
}
