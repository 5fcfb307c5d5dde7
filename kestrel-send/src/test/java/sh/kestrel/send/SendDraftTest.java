// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.send;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import sh.kestrel.core.model.Recipient;
import sh.kestrel.core.types.FeeRate;

class SendDraftTest {

    private static final String ADDRESS_A = "bc1qw508d6qejxtdg4y5r3zarvary0c5xw7kv8f3t4";
    private static final String ADDRESS_B = "1A1zP1eP5QGefi2DMPTfTL5SLmv7DivfNa";

    private final SendDraft empty = SendDraft.empty(FeeRate.of(1), Denomination.SATS);

    @Test
    void emptyDraftIsBlank() {
        assertTrue(empty.isBlank());
        assertEquals(SendMode.SINGLE, empty.mode());
        assertFalse(empty.withLabel("x").isBlank());
        assertTrue(empty.withFeeRate(FeeRate.of(9)).isBlank());
    }

    @Test
    void enforcesModeShape() {
        assertThrows(IllegalArgumentException.class, () -> new SendDraft(SendMode.SINGLE,
                List.of(RecipientRow.EMPTY, RecipientRow.EMPTY), FeeRate.of(1), Set.of(), false, null,
                Denomination.SATS));
        assertThrows(IllegalArgumentException.class, () -> new SendDraft(SendMode.MULTI,
                List.of(), FeeRate.of(1), Set.of(), false, null, Denomination.SATS));
        assertThrows(IllegalArgumentException.class, () -> new SendDraft(SendMode.MULTI,
                List.of(RecipientRow.EMPTY), FeeRate.of(1), Set.of(), true, null, Denomination.SATS));
    }

    @Test
    void recipientsKeepOnlyValidRowsInOrder() {
        SendDraft draft = empty.withMode(SendMode.MULTI).withRows(List.of(
                new RecipientRow(ADDRESS_B, "2,000"),
                new RecipientRow("bc1qbroken", "5"),
                new RecipientRow(ADDRESS_A, "0"),
                new RecipientRow(" " + ADDRESS_A + " ", "700")));

        assertEquals(List.of(Recipient.of(ADDRESS_B, 2_000), Recipient.of(ADDRESS_A, 700)), draft.recipients());
    }

    @Test
    void modeProjection() {
        SendDraft single = empty.withRow(0, new RecipientRow(ADDRESS_A, "10")).withMaxSend(true);

        SendDraft multi = single.withMode(SendMode.MULTI);
        assertEquals(List.of(new RecipientRow(ADDRESS_A, "10"), RecipientRow.EMPTY), multi.rows());
        assertFalse(multi.maxSend());

        SendDraft back = multi.withRow(1, new RecipientRow(ADDRESS_B, "20")).withMode(SendMode.SINGLE);
        assertEquals(List.of(new RecipientRow(ADDRESS_A, "10")), back.rows());
        assertSame(back, back.withMode(SendMode.SINGLE));
    }

    @Test
    void denominationChangeConvertsAmounts() {
        SendDraft draft = empty.withRow(0, new RecipientRow(ADDRESS_A, "123,456"));

        SendDraft btc = draft.withDenomination(Denomination.BTC);

        assertEquals("0.00123456", btc.singleRow().amountInput());
        assertEquals(draft.recipients(), btc.recipients());
        assertEquals("123456", btc.withDenomination(Denomination.SATS).singleRow().amountInput());
    }
}
