// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.core.fee;

/**
 * Strategy for accelerating an unconfirmed transaction.
 *
 * @since 0.1.0
 */
public enum BumpMethod {
    /** Replace-By-Fee: rebroadcast the transaction with a higher fee. */
    RBF,
    /** Child-Pays-For-Parent: spend an output of the parent with a high-fee child. */
    CPFP
}
