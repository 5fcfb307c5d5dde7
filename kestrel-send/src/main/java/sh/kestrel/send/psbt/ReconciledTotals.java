// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.send.psbt;

import java.util.HashSet;
import java.util.Objects;

/**
 * What was exported next to what came back signed.
 *
 * <p>Differences are reported, never corrected: the user decides whether to broadcast.
 *
 * @param expected totals of the exported PSBT
 * @param signed   totals recomputed from the signed data
 */
public record ReconciledTotals(UnsignedPsbt expected, SignedTotals signed) {

    public ReconciledTotals {
        Objects.requireNonNull(expected, "expected");
        Objects.requireNonNull(signed, "signed");
    }

    public boolean feeChanged() {
        return expected.feeSats() != signed.feeSats();
    }

    public boolean changeChanged() {
        return expected.changeSats() != signed.changeSats();
    }

    public boolean recipientsChanged() {
        return !new HashSet<>(expected.recipients()).equals(new HashSet<>(signed.outputs()));
    }

    public boolean anyChanged() {
        return feeChanged() || changeChanged() || recipientsChanged();
    }

    /**
     * @return signed fee minus expected fee; positive when the signer raised the fee
     */
    public long feeDeltaSats() {
        return signed.feeSats() - expected.feeSats();
    }
}
