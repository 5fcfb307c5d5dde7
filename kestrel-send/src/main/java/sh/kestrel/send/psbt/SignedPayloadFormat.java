// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.send.psbt;

/**
 * Shape of the signed data returned by an external signer.
 */
public enum SignedPayloadFormat {
    /** A signed PSBT, carried as base64. */
    PSBT,
    /** A fully signed raw transaction, carried as lowercase hex. */
    RAW_TRANSACTION
}
