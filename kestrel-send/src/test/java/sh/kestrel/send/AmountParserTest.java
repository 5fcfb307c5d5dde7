// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.send;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import org.junit.jupiter.api.Test;
import sh.kestrel.core.types.Sats;

class AmountParserTest {

    @Test
    void parsesSatsWithGroupingCommas() {
        assertEquals(Optional.of(Sats.of(1_234_567)), AmountParser.parse("1,234,567", Denomination.SATS));
        assertEquals(Optional.of(Sats.of(42)), AmountParser.parse(" 42 ", Denomination.SATS));
        assertEquals(Optional.of(Sats.ZERO), AmountParser.parse("0", Denomination.SATS));
    }

    @Test
    void rejectsMalformedSats() {
        assertTrue(AmountParser.parse("1.5", Denomination.SATS).isEmpty());
        assertTrue(AmountParser.parse("-5", Denomination.SATS).isEmpty());
        assertTrue(AmountParser.parse(",100", Denomination.SATS).isEmpty());
        assertTrue(AmountParser.parse("12abc", Denomination.SATS).isEmpty());
        assertTrue(AmountParser.parse("99999999999999999999", Denomination.SATS).isEmpty());
        assertTrue(AmountParser.parse("", Denomination.SATS).isEmpty());
        assertTrue(AmountParser.parse(null, Denomination.SATS).isEmpty());
    }

    @Test
    void parsesBtcUpToEightDecimals() {
        assertEquals(Optional.of(Sats.of(150_000_000)), AmountParser.parse("1.5", Denomination.BTC));
        assertEquals(Optional.of(Sats.of(1)), AmountParser.parse("0.00000001", Denomination.BTC));
        assertEquals(Optional.of(Sats.of(50_000_000)), AmountParser.parse(".5", Denomination.BTC));
        assertEquals(Optional.of(Sats.of(200_000_000)), AmountParser.parse("2.", Denomination.BTC));
        assertEquals(Optional.of(Sats.of(10_000)), AmountParser.parse("0.000100000", Denomination.BTC));
    }

    @Test
    void rejectsMalformedBtc() {
        assertTrue(AmountParser.parse("0.000000001", Denomination.BTC).isEmpty());
        assertTrue(AmountParser.parse(".", Denomination.BTC).isEmpty());
        assertTrue(AmountParser.parse("1,000", Denomination.BTC).isEmpty());
        assertTrue(AmountParser.parse("1.2.3", Denomination.BTC).isEmpty());
    }

    @Test
    void rejectsAmountsAboveTheMoneySupply() {
        assertEquals(Optional.of(Sats.of(Sats.MAX_MONEY)),
                AmountParser.parse("2,100,000,000,000,000", Denomination.SATS));
        assertEquals(Optional.of(Sats.of(Sats.MAX_MONEY)), AmountParser.parse("21000000", Denomination.BTC));
        assertTrue(AmountParser.parse("2100000000000001", Denomination.SATS).isEmpty());
        assertTrue(AmountParser.parse("9000000000000000000", Denomination.SATS).isEmpty());
        assertTrue(AmountParser.parse("21000000.00000001", Denomination.BTC).isEmpty());
    }

    @Test
    void parsePositiveDropsZero() {
        assertTrue(AmountParser.parsePositive("0", Denomination.SATS).isEmpty());
        assertTrue(AmountParser.parsePositive("0.0", Denomination.BTC).isEmpty());
        assertEquals(Optional.of(Sats.of(1)), AmountParser.parsePositive("1", Denomination.SATS));
    }

    @Test
    void formatsForEditing() {
        assertEquals("150000", AmountParser.format(Sats.of(150_000), Denomination.SATS));
        assertEquals("0.0015", AmountParser.format(Sats.of(150_000), Denomination.BTC));
        assertEquals("1", AmountParser.format(Sats.of(100_000_000), Denomination.BTC));
        assertEquals("0", AmountParser.format(Sats.ZERO, Denomination.BTC));
    }

    @Test
    void convertsBetweenUnitsAndKeepsUnparseableText() {
        assertEquals("0.0005", AmountParser.convert("50,000", Denomination.SATS, Denomination.BTC));
        assertEquals("50000", AmountParser.convert("0.0005", Denomination.BTC, Denomination.SATS));
        assertEquals("abc", AmountParser.convert("abc", Denomination.SATS, Denomination.BTC));
        assertEquals("1,000", AmountParser.convert("1,000", Denomination.SATS, Denomination.SATS));
    }
}
