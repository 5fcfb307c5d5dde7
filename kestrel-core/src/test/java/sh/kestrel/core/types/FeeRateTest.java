// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.core.types;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class FeeRateTest {

    @Test
    void normalizesScale() {
        assertEquals(FeeRate.of(2), FeeRate.of("2.00"));
        assertEquals("2", FeeRate.of("2.00").toPlainString());
        assertEquals("0.5", FeeRate.of(" 0.50 ").toPlainString());
    }

    @Test
    void rejectsNonPositive() {
        assertThrows(IllegalArgumentException.class, () -> FeeRate.of(0));
        assertThrows(IllegalArgumentException.class, () -> FeeRate.of("-1"));
        assertThrows(IllegalArgumentException.class, () -> FeeRate.of("abc"));
    }

    @Test
    void rounding() {
        FeeRate rate = FeeRate.of("9.2");

        assertEquals(10, rate.ceilSatPerVb());
        assertEquals(9, rate.truncatedSatPerVb());
        assertEquals(Sats.of(1298), rate.feeFor(new BigDecimal("141")));
        assertEquals(Sats.of(1290), rate.feeFor(new BigDecimal("140.2")));
    }

    @Test
    void ordering() {
        assertTrue(FeeRate.of("1.5").isBelow(FeeRate.of(2)));
        assertTrue(FeeRate.of(3).compareTo(FeeRate.of("2.99")) > 0);
    }
}
