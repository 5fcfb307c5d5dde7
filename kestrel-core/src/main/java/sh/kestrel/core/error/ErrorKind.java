// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.core.error;

/**
 * Structured error taxonomy shared by validators, the send flow and the signing handshake.
 *
 * <p>Each constant carries a short user-facing message. Dry-run kinds are reported by the
 * wallet engine and surfaced verbatim; they are never reinterpreted locally.
 *
 * @since 0.1.0
 */
public enum ErrorKind {
    ADDRESS_INVALID_CHARACTER("Invalid character in address"),
    ADDRESS_INVALID_LENGTH("Invalid address length"),
    ADDRESS_INVALID_CHECKSUM("Invalid checksum"),
    ADDRESS_MIXED_CASE("Mixed case not allowed"),
    ADDRESS_UNKNOWN_FORMAT("Invalid address format"),

    FEE_BUMP_NOT_HIGHER_THAN_CURRENT("New fee rate must be higher than current"),
    FEE_BUMP_INSUFFICIENT_FUNDS("Insufficient funds for fee bump"),

    DRY_RUN_INSUFFICIENT_FUNDS("Insufficient funds"),
    DRY_RUN_BELOW_DUST_LIMIT("Amount below dust limit"),
    DRY_RUN_NETWORK_UNAVAILABLE("Network unavailable"),
    /** Engine failure with no more specific kind. */
    DRY_RUN_FAILED("Transaction build failed"),

    /** Commit (send or PSBT creation) rejected by the engine. */
    COMMIT_FAILED("Transaction failed"),

    PSBT_UNPARSEABLE_SIGNED_PAYLOAD("Signed data is not a PSBT or raw transaction"),
    PSBT_BROADCAST_FAILED("Broadcast failed");

    private final String message;

    ErrorKind(final String message) {
        this.message = message;
    }

    /**
     * Returns the short user-facing description.
     *
     * @return message text
     */
    public String message() {
        return message;
    }

    public boolean isAddressError() {
        return name().startsWith("ADDRESS_");
    }
}
