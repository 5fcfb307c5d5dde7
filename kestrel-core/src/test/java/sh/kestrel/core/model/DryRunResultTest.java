// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.core.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import sh.kestrel.core.error.ErrorKind;
import sh.kestrel.core.types.FeeRate;

class DryRunResultTest {

    @Test
    void successDerivesEffectiveRate() {
        DryRunResult result = DryRunResult.success(1410, 141.0, 5000, 2, 49_000);

        assertTrue(result.isOk());
        assertTrue(result.hasChange());
        assertEquals(10.0, result.effectiveFeeRate(), 1e-9);
    }

    @Test
    void errorResultCarriesKind() {
        DryRunResult result = DryRunResult.error(ErrorKind.DRY_RUN_BELOW_DUST_LIMIT, "output 300 < 546");

        assertTrue(result.isError());
        assertFalse(result.isOk());
        assertEquals(ErrorKind.DRY_RUN_BELOW_DUST_LIMIT, result.error());
        assertEquals(0, result.feeSats());
    }

    @Test
    void requestRejectsMaxSendWithSeveralRecipients() {
        List<Recipient> two = List.of(Recipient.of("a", 1), Recipient.of("b", 1));

        assertThrows(IllegalArgumentException.class,
                () -> new DryRunRequest(two, FeeRate.of(1), Set.of(), true));
        assertThrows(IllegalArgumentException.class,
                () -> new DryRunRequest(List.of(), FeeRate.of(1), Set.of(), false));
    }
}
