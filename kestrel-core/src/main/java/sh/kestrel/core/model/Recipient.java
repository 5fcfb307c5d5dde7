// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.core.model;

import java.util.Objects;
import sh.kestrel.core.types.Sats;

/**
 * A single transaction destination: address plus amount.
 * Used for both single and multi-recipient sends.
 *
 * @param address destination address, already validated by the caller
 * @param amount  amount to send
 */
public record Recipient(String address, Sats amount) {

    public Recipient {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(amount, "amount");
        if (address.isBlank()) {
            throw new IllegalArgumentException("Recipient address must not be blank");
        }
    }

    public static Recipient of(final String address, final long amountSats) {
        return new Recipient(address, Sats.of(amountSats));
    }
}
