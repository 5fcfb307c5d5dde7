// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.primitives;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

/**
 * Base58 and Base58Check codec using the Bitcoin alphabet.
 *
 * <p>Decoding rebuilds the big-integer value of the string and reinserts one leading
 * zero byte per leading {@code '1'} character. Base58Check appends the first four bytes
 * of {@code SHA-256(SHA-256(payload))}.
 *
 * @since 0.1.0
 */
public final class Base58 {

    /** The 58-character Bitcoin alphabet (no 0, O, I or l). */
    public static final String ALPHABET = "123456789ABCDEFGHJKLMNPQRSTUVWXYZabcdefghijkmnopqrstuvwxyz";

    /** Length of the Base58Check checksum in bytes. */
    public static final int CHECKSUM_LENGTH = 4;

    private static final BigInteger BASE = BigInteger.valueOf(58);
    private static final int[] INDEXES = new int[128];

    static {
        Arrays.fill(INDEXES, -1);
        for (int i = 0; i < ALPHABET.length(); i++) {
            INDEXES[ALPHABET.charAt(i)] = i;
        }
    }

    private Base58() {
        // Utility class
    }

    /**
     * Returns the digit value of a character, or -1 when it is outside the alphabet.
     *
     * @param c the character
     * @return digit value 0..57, or -1
     */
    public static int indexOf(final char c) {
        return c < 128 ? INDEXES[c] : -1;
    }

    /**
     * Decodes a Base58 string.
     *
     * @param input the encoded string
     * @return decoded bytes, including one zero byte per leading '1'
     * @throws IllegalArgumentException if a character is outside the alphabet
     */
    public static byte[] decode(final String input) {
        Objects.requireNonNull(input, "input");

        BigInteger value = BigInteger.ZERO;
        for (int i = 0; i < input.length(); i++) {
            final int digit = indexOf(input.charAt(i));
            if (digit < 0) {
                throw new IllegalArgumentException(
                        "Invalid Base58 character '" + input.charAt(i) + "' at position " + i);
            }
            value = value.multiply(BASE).add(BigInteger.valueOf(digit));
        }

        int leadingZeros = 0;
        while (leadingZeros < input.length() && input.charAt(leadingZeros) == ALPHABET.charAt(0)) {
            leadingZeros++;
        }

        byte[] body = value.signum() == 0 ? new byte[0] : value.toByteArray();
        if (body.length > 1 && body[0] == 0) {
            // drop the sign byte BigInteger adds for values with the top bit set
            body = Arrays.copyOfRange(body, 1, body.length);
        }

        final byte[] result = new byte[leadingZeros + body.length];
        System.arraycopy(body, 0, result, leadingZeros, body.length);
        return result;
    }

    /**
     * Encodes bytes as Base58.
     *
     * @param input bytes to encode
     * @return the Base58 string
     */
    public static String encode(final byte[] input) {
        Objects.requireNonNull(input, "input");

        int leadingZeros = 0;
        while (leadingZeros < input.length && input[leadingZeros] == 0) {
            leadingZeros++;
        }

        BigInteger value = new BigInteger(1, input);
        final StringBuilder sb = new StringBuilder();
        while (value.signum() > 0) {
            final BigInteger[] divRem = value.divideAndRemainder(BASE);
            sb.append(ALPHABET.charAt(divRem[1].intValue()));
            value = divRem[0];
        }
        for (int i = 0; i < leadingZeros; i++) {
            sb.append(ALPHABET.charAt(0));
        }
        return sb.reverse().toString();
    }

    /**
     * Computes the Base58Check checksum of a payload.
     *
     * @param payload the versioned payload
     * @return the first four bytes of SHA-256(SHA-256(payload))
     */
    public static byte[] checksum(final byte[] payload) {
        return Arrays.copyOf(Sha256.doubleHash(payload), CHECKSUM_LENGTH);
    }

    /**
     * Encodes a payload with its Base58Check checksum appended.
     *
     * @param payload the versioned payload
     * @return Base58Check string
     */
    public static String encodeChecked(final byte[] payload) {
        Objects.requireNonNull(payload, "payload");
        final byte[] checksum = checksum(payload);
        final byte[] data = Arrays.copyOf(payload, payload.length + CHECKSUM_LENGTH);
        System.arraycopy(checksum, 0, data, payload.length, CHECKSUM_LENGTH);
        return encode(data);
    }
}
