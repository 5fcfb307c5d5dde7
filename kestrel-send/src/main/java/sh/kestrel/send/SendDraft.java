// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.send;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import sh.kestrel.core.model.Recipient;
import sh.kestrel.core.types.FeeRate;
import sh.kestrel.core.types.Outpoint;

/**
 * Immutable user intent for one outgoing transaction.
 *
 * <p>Single and multi mode share one row list: single mode holds exactly one row, multi
 * mode at least one (two valid rows are needed to commit). Max send exists only in single
 * mode. Every edit produces a new instance through one of the {@code with*} methods.
 *
 * @param mode          recipient layout
 * @param rows          ordered recipient rows
 * @param feeRate       requested fee rate
 * @param coinSelection explicitly chosen coins; empty lets the engine choose
 * @param maxSend       send everything minus fees (single mode only)
 * @param label         optional label applied to the resulting transaction
 * @param denomination  unit of every row's amount text
 * @since 0.1.0
 */
public record SendDraft(
        SendMode mode,
        List<RecipientRow> rows,
        FeeRate feeRate,
        Set<Outpoint> coinSelection,
        boolean maxSend,
        @Nullable String label,
        Denomination denomination) {

    public SendDraft {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(rows, "rows");
        Objects.requireNonNull(feeRate, "feeRate");
        Objects.requireNonNull(coinSelection, "coinSelection");
        Objects.requireNonNull(denomination, "denomination");
        if (mode == SendMode.SINGLE && rows.size() != 1) {
            throw new IllegalArgumentException("Single mode needs exactly one row, got: " + rows.size());
        }
        if (rows.isEmpty()) {
            throw new IllegalArgumentException("Draft needs at least one row");
        }
        if (maxSend && mode != SendMode.SINGLE) {
            throw new IllegalArgumentException("Max send is only available in single mode");
        }
        rows = List.copyOf(rows);
        coinSelection = Collections.unmodifiableSet(new LinkedHashSet<>(coinSelection));
    }

    /**
     * Creates a blank single-recipient draft.
     *
     * @param feeRate      initial fee rate
     * @param denomination amount unit
     * @return the draft
     */
    public static SendDraft empty(final FeeRate feeRate, final Denomination denomination) {
        return new SendDraft(SendMode.SINGLE, List.of(RecipientRow.EMPTY), feeRate, Set.of(), false, null, denomination);
    }

    /**
     * Returns whether nothing has been entered yet (the fee rate does not count).
     */
    @JsonIgnore
    public boolean isBlank() {
        return mode == SendMode.SINGLE
                && rows.get(0).isBlank()
                && coinSelection.isEmpty()
                && !maxSend
                && (label == null || label.isBlank());
    }

    public RecipientRow singleRow() {
        return rows.get(0);
    }

    /**
     * Derives the recipients that would be committed: rows with a valid address and a
     * positive amount, in row order.
     *
     * @return the valid recipients
     */
    public List<Recipient> recipients() {
        final List<Recipient> out = new ArrayList<>(rows.size());
        for (final RecipientRow row : rows) {
            final Optional<Recipient> recipient = row.toRecipient(denomination);
            recipient.ifPresent(out::add);
        }
        return out;
    }

    public SendDraft withRows(final List<RecipientRow> rows) {
        return new SendDraft(mode, rows, feeRate, coinSelection, maxSend, label, denomination);
    }

    public SendDraft withRow(final int index, final RecipientRow row) {
        final List<RecipientRow> updated = new ArrayList<>(rows);
        updated.set(index, row);
        return withRows(updated);
    }

    public SendDraft withFeeRate(final FeeRate feeRate) {
        return new SendDraft(mode, rows, feeRate, coinSelection, maxSend, label, denomination);
    }

    public SendDraft withCoinSelection(final Set<Outpoint> coinSelection) {
        return new SendDraft(mode, rows, feeRate, coinSelection, maxSend, label, denomination);
    }

    public SendDraft withMaxSend(final boolean maxSend) {
        return new SendDraft(mode, rows, feeRate, coinSelection, maxSend, label, denomination);
    }

    public SendDraft withLabel(final @Nullable String label) {
        return new SendDraft(mode, rows, feeRate, coinSelection, maxSend, label, denomination);
    }

    /**
     * Switches the amount unit, re-expressing every parseable amount in the new unit.
     *
     * @param denomination the new unit
     * @return the converted draft
     */
    public SendDraft withDenomination(final Denomination denomination) {
        final List<RecipientRow> converted = new ArrayList<>(rows.size());
        for (final RecipientRow row : rows) {
            converted.add(row.withAmountInput(AmountParser.convert(row.amountInput(), this.denomination, denomination)));
        }
        return new SendDraft(mode, converted, feeRate, coinSelection, maxSend, label, denomination);
    }

    /**
     * Projects the draft into another mode. Single to multi keeps the row as row 1 and adds
     * an empty row 2; multi to single keeps row 1. Max send is dropped when leaving single mode.
     *
     * @param target the new mode
     * @return the projected draft, or this draft if already in {@code target}
     */
    public SendDraft withMode(final SendMode target) {
        if (target == mode) {
            return this;
        }
        if (target == SendMode.MULTI) {
            return new SendDraft(
                    SendMode.MULTI, List.of(rows.get(0), RecipientRow.EMPTY), feeRate, coinSelection, false, label,
                    denomination);
        }
        return new SendDraft(SendMode.SINGLE, List.of(rows.get(0)), feeRate, coinSelection, false, label, denomination);
    }
}
