// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.core.address;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import sh.kestrel.core.error.ErrorKind;
import sh.kestrel.primitives.Base58;
import sh.kestrel.primitives.Bech32;
import sh.kestrel.primitives.Hex;

class AddressValidatorTest {

    private static final String GENESIS_P2PKH = "1A1zP1eP5QGefi2DMPTfTL5SLmv7DivfNa";
    private static final String P2WPKH = "bc1qw508d6qejxtdg4y5r3zarvary0c5xw7kv8f3t4";
    private static final String P2WSH = "bc1qrp33g0q5c5txsp9arysrx4k6zdkfs4nce4xj0gdcccefvpysxf3qccfmv3";
    private static final String P2TR = "bc1p0xlxvlhemja6c4dqv22uapctqupfhlxm9h8z3k2e72q4k9hcz7vqzk5jj0";
    private static final String TESTNET_P2WPKH = "tb1qw508d6qejxtdg4y5r3zarvary0c5xw7kxpjzsx";
    private static final String TESTNET_P2TR = "tb1pqqqqp399et2xygdj5xreqhjjvcmzhxw4aywxecjdzew6hylgvsesf3hn0c";

    private static final String HASH160 = "751e76e8199196d454941c45d1b3a323f1433bd6";

    @ParameterizedTest
    @ValueSource(strings = {
        GENESIS_P2PKH,
        "1BvBMSEYstWetqTFn5Au4m4GFg7xJaNVN2",
        "3J98t1WpEZ73CNmQviecrnyiWrnqRhWNLy",
        P2WPKH,
        P2WSH,
        P2TR,
        TESTNET_P2WPKH,
        TESTNET_P2TR,
        "BC1QW508D6QEJXTDG4Y5R3ZARVARY0C5XW7KV8F3T4"
    })
    void acceptsValidAddresses(String address) {
        assertNull(AddressValidator.validate(address));
        assertTrue(AddressValidator.isValid(address));
    }

    @Test
    void acceptsGeneratedTestnetBase58Addresses() {
        String p2pkh = Base58.encodeChecked(versioned(0x6f));
        String p2sh = Base58.encodeChecked(versioned(0xc4));

        assertTrue(p2pkh.startsWith("m") || p2pkh.startsWith("n"));
        assertTrue(p2sh.startsWith("2"));
        assertNull(AddressValidator.validate(p2pkh));
        assertNull(AddressValidator.validate(p2sh));
    }

    @Test
    void blankInputIsNotAnError() {
        assertNull(AddressValidator.validate(""));
        assertNull(AddressValidator.validate("   "));
        assertNull(AddressValidator.validate(null));
        assertFalse(AddressValidator.isValid(""));
    }

    @Test
    void trimsSurroundingWhitespace() {
        assertNull(AddressValidator.validate("  " + P2WPKH + "\n"));
    }

    @Test
    void base58OneCharacterFlipFailsChecksum() {
        String flipped = GENESIS_P2PKH.substring(0, GENESIS_P2PKH.length() - 1) + "b";

        assertEquals(ErrorKind.ADDRESS_INVALID_CHECKSUM, AddressValidator.validate(flipped));
    }

    @Test
    void base58CharacterOutsideAlphabet() {
        String withZero = GENESIS_P2PKH.substring(0, GENESIS_P2PKH.length() - 2) + "0a";

        assertEquals(ErrorKind.ADDRESS_INVALID_CHARACTER, AddressValidator.validate(withZero));
    }

    @Test
    void base58LengthOutOfRange() {
        assertEquals(ErrorKind.ADDRESS_INVALID_LENGTH, AddressValidator.validate("1A1zP1eP5QGefi2DMPTf"));
        assertEquals(ErrorKind.ADDRESS_INVALID_LENGTH, AddressValidator.validate(GENESIS_P2PKH + "abc"));
    }

    @Test
    void base58DecodingTooShort() {
        // 25 characters of mostly low digits decode to fewer than 25 bytes
        assertEquals(ErrorKind.ADDRESS_INVALID_LENGTH, AddressValidator.validate("3" + "2".repeat(24)));
    }

    @Test
    void bech32DataCharacterChangeFailsChecksum() {
        String changed = P2WPKH.replace("w508", "x508");

        assertEquals(ErrorKind.ADDRESS_INVALID_CHECKSUM, AddressValidator.validate(changed));
    }

    @Test
    void taprootDataCharacterChangeFailsChecksum() {
        String changed = P2TR.substring(0, P2TR.length() - 1) + "q";

        assertEquals(ErrorKind.ADDRESS_INVALID_CHECKSUM, AddressValidator.validate(changed));
    }

    @Test
    void bech32mChecksumUnderBech32PrefixIsRejected() {
        int[] words = Bech32.toWords(Hex.decode(HASH160), 0);
        String bech32mEncoded = Bech32.encode("bc", words, Bech32.Encoding.BECH32M);

        assertTrue(bech32mEncoded.startsWith("bc1q"));
        assertEquals(ErrorKind.ADDRESS_INVALID_CHECKSUM, AddressValidator.validate(bech32mEncoded));
    }

    @Test
    void bech32ChecksumUnderTaprootPrefixIsRejected() {
        int[] words = Bech32.toWords(Hex.decode(HASH160 + HASH160.substring(0, 24)), 1);
        String bech32Encoded = Bech32.encode("bc", words, Bech32.Encoding.BECH32);

        assertTrue(bech32Encoded.startsWith("bc1p"));
        assertEquals(ErrorKind.ADDRESS_INVALID_CHECKSUM, AddressValidator.validate(bech32Encoded));
    }

    @Test
    void mixedCaseIsRejectedFirst() {
        assertEquals(ErrorKind.ADDRESS_MIXED_CASE,
                AddressValidator.validate("bc1qW508d6qejxtdg4y5r3zarvary0c5xw7kv8f3t4"));
        // mixed case wins over a bad character
        assertEquals(ErrorKind.ADDRESS_MIXED_CASE, AddressValidator.validate("bc1qWbbbbbbbbb"));
    }

    @Test
    void bech32InvalidDataCharacter() {
        String withB = P2WPKH.substring(0, P2WPKH.length() - 1) + "b";

        assertEquals(ErrorKind.ADDRESS_INVALID_CHARACTER, AddressValidator.validate(withB));
    }

    @Test
    void bech32TooFewCharactersAfterSeparator() {
        assertEquals(ErrorKind.ADDRESS_INVALID_LENGTH, AddressValidator.validate("bc1qqqq"));
    }

    @Test
    void bech32TooLong() {
        String tooLong = "bc1q" + "q".repeat(87);

        assertEquals(ErrorKind.ADDRESS_INVALID_LENGTH, AddressValidator.validate(tooLong));
    }

    @ParameterizedTest
    @ValueSource(strings = {"xyz", "0x742d35Cc6634C0532925a3b844Bc454e4438f44e", "bc1zw508d6qejxtdg4y5r3zarvaryvg6kdaj", "lnbc1"})
    void unknownPrefixes(String address) {
        assertEquals(ErrorKind.ADDRESS_UNKNOWN_FORMAT, AddressValidator.validate(address));
    }

    @Test
    void detectsSegwitTypes() {
        assertEquals(Optional.of(new AddressInfo(AddressType.P2WPKH, Network.MAINNET)), AddressValidator.detect(P2WPKH));
        assertEquals(Optional.of(AddressType.P2WSH), AddressValidator.detectType(P2WSH));
        assertEquals(Optional.of(AddressType.P2TR), AddressValidator.detectType(P2TR));
        assertEquals(Optional.of(Network.TESTNET), AddressValidator.detectNetwork(TESTNET_P2TR));
        assertEquals(Optional.of(AddressType.P2WPKH), AddressValidator.detectType(TESTNET_P2WPKH));
    }

    @Test
    void detectsBase58Types() {
        assertEquals(Optional.of(new AddressInfo(AddressType.P2PKH, Network.MAINNET)),
                AddressValidator.detect(GENESIS_P2PKH));
        assertEquals(Optional.of(AddressType.P2SH), AddressValidator.detectType("3J98t1WpEZ73CNmQviecrnyiWrnqRhWNLy"));
        assertEquals(Optional.of(new AddressInfo(AddressType.P2PKH, Network.TESTNET)),
                AddressValidator.detect(Base58.encodeChecked(versioned(0x6f))));
        assertEquals(Optional.of(new AddressInfo(AddressType.P2SH, Network.TESTNET)),
                AddressValidator.detect(Base58.encodeChecked(versioned(0xc4))));
    }

    @Test
    void detectIsEmptyForInvalidInput() {
        assertTrue(AddressValidator.detect("").isEmpty());
        assertTrue(AddressValidator.detect(P2WPKH.replace("w508", "x508")).isEmpty());
    }

    @Test
    void segwitTypesAndErrorKinds() {
        assertTrue(AddressValidator.detectType(P2TR).orElseThrow().isSegwit());
        assertFalse(AddressValidator.detectType(GENESIS_P2PKH).orElseThrow().isSegwit());

        ErrorKind error = AddressValidator.validate(P2WPKH.replace("w508", "x508"));
        assertTrue(error.isAddressError());
        assertFalse(ErrorKind.DRY_RUN_FAILED.isAddressError());
    }

    private static byte[] versioned(int version) {
        byte[] payload = new byte[21];
        payload[0] = (byte) version;
        System.arraycopy(Hex.decode(HASH160), 0, payload, 1, 20);
        return payload;
    }
}
