// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.core.fee;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import sh.kestrel.core.types.FeeRate;

class FeeEstimatesTest {

    @Test
    void mapsPriorityToRate() {
        FeeEstimates estimates = new FeeEstimates(FeeRate.of(20), FeeRate.of(12), FeeRate.of(8), FeeRate.of("1.5"));

        assertEquals(FeeRate.of(20), estimates.rateFor(FeePriority.FASTEST));
        assertEquals(FeeRate.of(12), estimates.rateFor(FeePriority.HALF_HOUR));
        assertEquals(FeeRate.of(8), estimates.rateFor(FeePriority.HOUR));
        assertEquals(FeeRate.of("1.5"), estimates.rateFor(FeePriority.MINIMUM));
        assertFalse(estimates.isUniform());
    }

    @Test
    void uniformIgnoresMinimum() {
        FeeEstimates estimates = new FeeEstimates(FeeRate.of(1), FeeRate.of("1.0"), FeeRate.of(1), FeeRate.of("0.5"));

        assertTrue(estimates.isUniform());
    }
}
