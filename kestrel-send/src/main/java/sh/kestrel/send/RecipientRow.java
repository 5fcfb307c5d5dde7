// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.send;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.Objects;
import java.util.Optional;
import org.jspecify.annotations.Nullable;
import sh.kestrel.core.address.AddressValidator;
import sh.kestrel.core.error.ErrorKind;
import sh.kestrel.core.model.Recipient;
import sh.kestrel.core.types.Sats;

/**
 * One editable destination of a draft, holding the text exactly as typed.
 *
 * @param address     address text
 * @param amountInput amount text in the draft's denomination
 */
public record RecipientRow(String address, String amountInput) {

    public static final RecipientRow EMPTY = new RecipientRow("", "");

    public RecipientRow {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(amountInput, "amountInput");
    }

    public RecipientRow withAddress(final String address) {
        return new RecipientRow(address, amountInput);
    }

    public RecipientRow withAmountInput(final String amountInput) {
        return new RecipientRow(address, amountInput);
    }

    @JsonIgnore
    public boolean isBlank() {
        return address.isBlank() && amountInput.isBlank();
    }

    public boolean hasValidAddress() {
        return AddressValidator.isValid(address);
    }

    /**
     * Returns the address validation error, null when valid or still empty.
     */
    public @Nullable ErrorKind addressError() {
        return AddressValidator.validate(address);
    }

    public Optional<Sats> amount(final Denomination denomination) {
        return AmountParser.parsePositive(amountInput, denomination);
    }

    /**
     * Converts the row to a committed recipient.
     *
     * @param denomination unit of {@link #amountInput()}
     * @return the recipient, or empty unless the address validates and the amount is positive
     */
    public Optional<Recipient> toRecipient(final Denomination denomination) {
        if (!hasValidAddress()) {
            return Optional.empty();
        }
        return amount(denomination).map(sats -> new Recipient(address.trim(), sats));
    }
}
