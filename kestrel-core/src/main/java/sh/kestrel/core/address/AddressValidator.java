// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.core.address;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import org.jspecify.annotations.Nullable;
import sh.kestrel.core.error.ErrorKind;
import sh.kestrel.primitives.Base58;
import sh.kestrel.primitives.Bech32;
import sh.kestrel.primitives.Sha256;

/**
 * Syntactic and checksum validation of Bitcoin addresses.
 *
 * <p>Supports Base58Check (P2PKH / P2SH, mainnet and testnet), Bech32 (segwit v0) and
 * Bech32m (Taproot). The checksum family is chosen from the address prefix, never
 * guessed from the residue, so a Bech32m string is rejected when presented under a
 * Bech32 prefix and vice versa.
 *
 * <p>All methods are pure and thread-safe.
 *
 * <p><strong>Example:</strong>
 * <pre>{@code
 * ErrorKind error = AddressValidator.validate(input);
 * if (error != null) {
 *     showFieldError(error.message());
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public final class AddressValidator {

    private static final int BASE58_MIN_LENGTH = 25;
    private static final int BASE58_MAX_LENGTH = 35;
    private static final int BASE58_DECODED_LENGTH = 25;
    private static final int BASE58_PAYLOAD_LENGTH = 21;

    private static final int P2WPKH_DATA_LENGTH = 1 + 32 + Bech32.CHECKSUM_LENGTH;
    private static final int P2WSH_DATA_LENGTH = 1 + 52 + Bech32.CHECKSUM_LENGTH;

    private AddressValidator() {
        // Utility class
    }

    /**
     * Validates an address.
     *
     * @param address user input; surrounding whitespace is ignored
     * @return null if valid or blank, otherwise the reason it was rejected
     */
    public static @Nullable ErrorKind validate(final @Nullable String address) {
        if (address == null || address.isBlank()) {
            return null;
        }
        final String trimmed = address.trim();
        final String lower = trimmed.toLowerCase(Locale.ROOT);
        if (isBase58Prefix(trimmed)) {
            return validateBase58Check(trimmed);
        }
        if (lower.startsWith("bc1q")) {
            return validateBech32(trimmed, Bech32.Encoding.BECH32);
        }
        if (lower.startsWith("bc1p")) {
            return validateBech32(trimmed, Bech32.Encoding.BECH32M);
        }
        if (lower.startsWith("tb1")) {
            return validateBech32(
                    trimmed, lower.startsWith("tb1p") ? Bech32.Encoding.BECH32M : Bech32.Encoding.BECH32);
        }
        return ErrorKind.ADDRESS_UNKNOWN_FORMAT;
    }

    /**
     * Returns whether the input is a non-blank, checksum-valid address.
     *
     * @param address user input
     * @return true only for a valid address; blank input is not valid
     */
    public static boolean isValid(final @Nullable String address) {
        return address != null && !address.isBlank() && validate(address) == null;
    }

    /**
     * Detects the script family and network of a valid address.
     *
     * @param address user input
     * @return the detected info, or empty if the address is blank, invalid or carries an
     *         unknown Base58 version byte
     */
    public static Optional<AddressInfo> detect(final @Nullable String address) {
        if (!isValid(address)) {
            return Optional.empty();
        }
        final String trimmed = address.trim();
        if (isBase58Prefix(trimmed)) {
            return detectBase58(trimmed);
        }
        final String lower = trimmed.toLowerCase(Locale.ROOT);
        final Network network = lower.startsWith("bc1") ? Network.MAINNET : Network.TESTNET;
        final int dataLength = lower.length() - lower.lastIndexOf('1') - 1;
        final AddressType type;
        if (lower.charAt(3) == 'p') {
            type = AddressType.P2TR;
        } else if (lower.charAt(3) != 'q') {
            type = AddressType.WITNESS_UNKNOWN;
        } else if (dataLength == P2WPKH_DATA_LENGTH) {
            type = AddressType.P2WPKH;
        } else if (dataLength == P2WSH_DATA_LENGTH) {
            type = AddressType.P2WSH;
        } else {
            type = AddressType.WITNESS_UNKNOWN;
        }
        return Optional.of(new AddressInfo(type, network));
    }

    /**
     * Detects the script family of a valid address.
     *
     * @param address user input
     * @return the type, or empty when {@link #detect(String)} is empty
     */
    public static Optional<AddressType> detectType(final @Nullable String address) {
        return detect(address).map(AddressInfo::type);
    }

    /**
     * Detects the network of a valid address.
     *
     * @param address user input
     * @return the network, or empty when {@link #detect(String)} is empty
     */
    public static Optional<Network> detectNetwork(final @Nullable String address) {
        return detect(address).map(AddressInfo::network);
    }

    private static boolean isBase58Prefix(final String address) {
        final char first = address.charAt(0);
        return first == '1' || first == '3' || first == 'm' || first == 'n' || first == '2';
    }

    private static @Nullable ErrorKind validateBase58Check(final String address) {
        if (address.length() < BASE58_MIN_LENGTH || address.length() > BASE58_MAX_LENGTH) {
            return ErrorKind.ADDRESS_INVALID_LENGTH;
        }
        for (int i = 0; i < address.length(); i++) {
            if (Base58.indexOf(address.charAt(i)) < 0) {
                return ErrorKind.ADDRESS_INVALID_CHARACTER;
            }
        }
        final byte[] decoded = Base58.decode(address);
        if (decoded.length < BASE58_DECODED_LENGTH) {
            return ErrorKind.ADDRESS_INVALID_LENGTH;
        }
        final int start = decoded.length - BASE58_DECODED_LENGTH;
        final byte[] payload = Arrays.copyOfRange(decoded, start, start + BASE58_PAYLOAD_LENGTH);
        final byte[] checksum = Arrays.copyOfRange(decoded, decoded.length - Base58.CHECKSUM_LENGTH, decoded.length);
        final byte[] expected = Arrays.copyOf(Sha256.doubleHash(payload), Base58.CHECKSUM_LENGTH);
        return Arrays.equals(checksum, expected) ? null : ErrorKind.ADDRESS_INVALID_CHECKSUM;
    }

    private static @Nullable ErrorKind validateBech32(final String address, final Bech32.Encoding encoding) {
        final String lower = address.toLowerCase(Locale.ROOT);
        if (!address.equals(lower) && !address.equals(address.toUpperCase(Locale.ROOT))) {
            return ErrorKind.ADDRESS_MIXED_CASE;
        }
        final int separator = lower.lastIndexOf('1');
        if (separator < 1
                || separator + Bech32.CHECKSUM_LENGTH + 1 > lower.length()
                || lower.length() > Bech32.MAX_LENGTH) {
            return ErrorKind.ADDRESS_INVALID_LENGTH;
        }
        final String hrp = lower.substring(0, separator);
        final int[] values = new int[lower.length() - separator - 1];
        for (int i = 0; i < values.length; i++) {
            final int v = Bech32.charValue(lower.charAt(separator + 1 + i));
            if (v < 0) {
                return ErrorKind.ADDRESS_INVALID_CHARACTER;
            }
            values[i] = v;
        }
        return Bech32.verifyChecksum(hrp, values, encoding) ? null : ErrorKind.ADDRESS_INVALID_CHECKSUM;
    }

    private static Optional<AddressInfo> detectBase58(final String address) {
        final byte[] decoded = Base58.decode(address);
        final int version = decoded[decoded.length - BASE58_DECODED_LENGTH] & 0xff;
        switch (version) {
            case 0x00:
                return Optional.of(new AddressInfo(AddressType.P2PKH, Network.MAINNET));
            case 0x05:
                return Optional.of(new AddressInfo(AddressType.P2SH, Network.MAINNET));
            case 0x6f:
                return Optional.of(new AddressInfo(AddressType.P2PKH, Network.TESTNET));
            case 0xc4:
                return Optional.of(new AddressInfo(AddressType.P2SH, Network.TESTNET));
            default:
                return Optional.empty();
        }
    }
}
