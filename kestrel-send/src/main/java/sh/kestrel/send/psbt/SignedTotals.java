// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.send.psbt;

import java.util.List;
import java.util.Objects;
import sh.kestrel.core.model.Recipient;

/**
 * Totals recomputed from signed data.
 *
 * @param feeSats        fee the signed transaction pays
 * @param totalInputSats sum of its inputs
 * @param outputs        outputs that do not return to the wallet
 * @param changeSats     value returning to the wallet, 0 if none
 */
public record SignedTotals(long feeSats, long totalInputSats, List<Recipient> outputs, long changeSats) {

    public SignedTotals {
        Objects.requireNonNull(outputs, "outputs");
        if (feeSats < 0 || totalInputSats < 0 || changeSats < 0) {
            throw new IllegalArgumentException("Signed totals must be non-negative");
        }
        outputs = List.copyOf(outputs);
    }
}
