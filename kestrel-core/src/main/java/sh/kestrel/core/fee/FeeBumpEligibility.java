// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.core.fee;

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Decides which bump methods apply to a wallet transaction.
 *
 * <p>Watch-only wallets can never bump: both methods need a signature.
 *
 * @since 0.1.0
 */
public final class FeeBumpEligibility {

    /** Inputs with a sequence below this value signal replaceability (BIP-125). */
    public static final long RBF_SEQUENCE_THRESHOLD = 0xfffffffeL;

    private FeeBumpEligibility() {
        // Utility class
    }

    public static boolean canRbf(final WalletTransaction tx, final boolean watchOnly) {
        Objects.requireNonNull(tx, "tx");
        if (watchOnly || tx.confirmed()) {
            return false;
        }
        for (final long sequence : tx.inputSequences()) {
            if (sequence < RBF_SEQUENCE_THRESHOLD) {
                return true;
            }
        }
        return false;
    }

    public static boolean canCpfp(final WalletTransaction tx, final boolean watchOnly) {
        Objects.requireNonNull(tx, "tx");
        return !watchOnly && !tx.confirmed() && tx.ownedUnspentOutputs() > 0;
    }

    /**
     * Picks the preferred method: RBF when signalled, else CPFP.
     *
     * @param tx        the transaction
     * @param watchOnly whether the wallet is watch-only
     * @return the method, or null when neither applies
     */
    public static @Nullable BumpMethod preferredMethod(
            final WalletTransaction tx, final boolean watchOnly) {
        if (canRbf(tx, watchOnly)) {
            return BumpMethod.RBF;
        }
        return canCpfp(tx, watchOnly) ? BumpMethod.CPFP : null;
    }
}
