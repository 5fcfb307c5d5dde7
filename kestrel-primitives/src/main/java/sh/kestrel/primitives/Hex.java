// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.primitives;

import java.util.Arrays;
import java.util.Objects;

/**
 * Utility methods for lowercase hex encoding and decoding.
 *
 * <p>Bitcoin tooling prints transaction ids and raw transactions without a prefix, so
 * {@link #encode(byte[])} never emits one. {@link #decode(String)} tolerates an optional
 * {@code 0x} prefix for input pasted from other tools.
 *
 * @since 0.1.0
 */
public final class Hex {
    private static final char[] HEX_CHARS = "0123456789abcdef".toCharArray();
    private static final int[] NIBBLE_LOOKUP = new int[128];

    static {
        Arrays.fill(NIBBLE_LOOKUP, -1);

        for (int i = 0; i <= 9; i++) {
            NIBBLE_LOOKUP['0' + i] = i;
        }

        for (int i = 0; i < 6; i++) {
            NIBBLE_LOOKUP['a' + i] = 10 + i;
            NIBBLE_LOOKUP['A' + i] = 10 + i;
        }
    }

    private Hex() {
        // Utility class
    }

    /**
     * Decodes a hex string, with or without a {@code 0x} prefix.
     *
     * @param hexString the string to decode
     * @return the decoded bytes
     * @throws IllegalArgumentException if the input is null, has an odd number of
     *                                  characters, or contains invalid hex
     */
    public static byte[] decode(final String hexString) {
        if (hexString == null) {
            throw new IllegalArgumentException("hex string cannot be null");
        }

        final int start = hasPrefix(hexString) ? 2 : 0;
        final int hexLength = hexString.length() - start;

        if ((hexLength & 1) == 1) {
            throw new IllegalArgumentException("hex string must have even length: " + hexString.length());
        }

        final byte[] result = new byte[hexLength / 2];
        for (int i = 0; i < result.length; i++) {
            final int high = toNibble(hexString.charAt(start + i * 2));
            final int low = toNibble(hexString.charAt(start + i * 2 + 1));
            if (high < 0 || low < 0) {
                throw new IllegalArgumentException("invalid hex character at offset " + (start + i * 2));
            }
            result[i] = (byte) ((high << 4) | low);
        }
        return result;
    }

    /**
     * Encodes bytes as lowercase hex without a prefix.
     *
     * @param bytes the bytes to encode
     * @return hex string, two characters per byte
     */
    public static String encode(final byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        final char[] out = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            final int v = bytes[i] & 0xFF;
            out[i * 2] = HEX_CHARS[v >>> 4];
            out[i * 2 + 1] = HEX_CHARS[v & 0x0F];
        }
        return new String(out);
    }

    /**
     * Returns true when every character is a hex digit (either case).
     * An empty sequence is not considered hex.
     *
     * @param value the characters to test
     * @return whether the input is non-empty hex
     */
    public static boolean isHex(final CharSequence value) {
        if (value == null || value.length() == 0) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            if (toNibble(value.charAt(i)) < 0) {
                return false;
            }
        }
        return true;
    }

    public static boolean hasPrefix(final String hexString) {
        return hexString != null
                && hexString.length() >= 2
                && hexString.charAt(0) == '0'
                && (hexString.charAt(1) == 'x' || hexString.charAt(1) == 'X');
    }

    private static int toNibble(final char c) {
        return c < 128 ? NIBBLE_LOOKUP[c] : -1;
    }
}
