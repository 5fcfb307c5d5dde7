// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.send.psbt;

import java.util.List;
import java.util.Objects;
import sh.kestrel.core.model.Recipient;

/**
 * Unsigned PSBT produced for a watch-only wallet, with the totals it was built with.
 *
 * @param base64         the PSBT, base64 encoded
 * @param feeSats        fee of the transaction
 * @param totalInputSats sum of all inputs
 * @param recipients     outputs paying the recipients
 * @param changeSats     value of the change output, 0 if none
 */
public record UnsignedPsbt(
        String base64, long feeSats, long totalInputSats, List<Recipient> recipients, long changeSats) {

    public UnsignedPsbt {
        Objects.requireNonNull(base64, "base64");
        Objects.requireNonNull(recipients, "recipients");
        if (base64.isEmpty()) {
            throw new IllegalArgumentException("PSBT must not be empty");
        }
        if (feeSats < 0 || totalInputSats < 0 || changeSats < 0) {
            throw new IllegalArgumentException("PSBT totals must be non-negative");
        }
        recipients = List.copyOf(recipients);
    }
}
