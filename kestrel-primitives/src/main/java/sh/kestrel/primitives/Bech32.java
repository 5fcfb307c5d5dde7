// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.primitives;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;

/**
 * Bech32 (BIP-173) and Bech32m (BIP-350) checksum primitives.
 *
 * <p>The two encodings share the charset, the human-readable-part expansion and the
 * BCH generator polynomial; they differ only in the constant the final residue is
 * compared against. Callers choose the {@link Encoding} explicitly so that one family
 * can never be accepted in place of the other.
 *
 * <p><strong>Example:</strong>
 * <pre>{@code
 * int[] data = Bech32.toWords(program, 0);
 * String address = Bech32.encode("bc", data, Bech32.Encoding.BECH32);
 * }</pre>
 *
 * @since 0.1.0
 */
public final class Bech32 {

    /** The 32-symbol data charset. */
    public static final String CHARSET = "qpzry9x8gf2tvdw0s3jn54khce6mua7l";

    /** Number of checksum characters at the end of every string. */
    public static final int CHECKSUM_LENGTH = 6;

    /** Maximum total string length. */
    public static final int MAX_LENGTH = 90;

    private static final int[] GENERATOR = {0x3b6a57b2, 0x26508e6d, 0x1ea119fa, 0x3d4233dd, 0x2a1462b3};
    private static final int[] CHARSET_REV = new int[128];

    static {
        Arrays.fill(CHARSET_REV, -1);
        for (int i = 0; i < CHARSET.length(); i++) {
            CHARSET_REV[CHARSET.charAt(i)] = i;
        }
    }

    /**
     * Checksum variant, identified by the constant the polymod residue must equal.
     */
    public enum Encoding {
        /** BIP-173, used for segwit version 0 outputs. */
        BECH32(1),
        /** BIP-350, used for segwit version 1+ outputs (Taproot). */
        BECH32M(0x2bc830a3);

        private final int constant;

        Encoding(final int constant) {
            this.constant = constant;
        }

        public int constant() {
            return constant;
        }
    }

    private Bech32() {
        // Utility class
    }

    /**
     * Maps a lowercase data character to its 5-bit value.
     *
     * @param c the character
     * @return value 0..31, or -1 when it is not in {@link #CHARSET}
     */
    public static int charValue(final char c) {
        return c < 128 ? CHARSET_REV[c] : -1;
    }

    /**
     * Runs the BCH generator polynomial over a sequence of 5-bit values.
     *
     * @param values the values
     * @return the 30-bit residue
     */
    public static int polymod(final int[] values) {
        int chk = 1;
        for (final int v : values) {
            final int top = chk >>> 25;
            chk = ((chk & 0x1ffffff) << 5) ^ v;
            for (int i = 0; i < 5; i++) {
                if (((top >>> i) & 1) == 1) {
                    chk ^= GENERATOR[i];
                }
            }
        }
        return chk;
    }

    /**
     * Expands the human-readable part: the high bits of each character, a zero
     * separator, then the low five bits of each character.
     *
     * @param hrp the human-readable part
     * @return expanded values, length {@code 2 * hrp.length() + 1}
     */
    public static int[] expandHrp(final String hrp) {
        Objects.requireNonNull(hrp, "hrp");
        final int len = hrp.length();
        final int[] out = new int[len * 2 + 1];
        for (int i = 0; i < len; i++) {
            final int c = hrp.charAt(i);
            out[i] = c >>> 5;
            out[len + 1 + i] = c & 31;
        }
        out[len] = 0;
        return out;
    }

    /**
     * Verifies the checksum of already-decoded data (payload plus six checksum values).
     *
     * @param hrp      lowercase human-readable part
     * @param data     data values including the trailing checksum
     * @param encoding the variant whose constant the residue must match
     * @return whether the checksum is valid for that variant
     */
    public static boolean verifyChecksum(final String hrp, final int[] data, final Encoding encoding) {
        Objects.requireNonNull(encoding, "encoding");
        return polymod(concat(expandHrp(hrp), data)) == encoding.constant();
    }

    /**
     * Computes the six checksum values for a payload.
     *
     * @param hrp      lowercase human-readable part
     * @param data     payload values (without checksum)
     * @param encoding the checksum variant
     * @return six 5-bit checksum values
     */
    public static int[] createChecksum(final String hrp, final int[] data, final Encoding encoding) {
        final int[] values = concat(concat(expandHrp(hrp), data), new int[CHECKSUM_LENGTH]);
        final int mod = polymod(values) ^ encoding.constant();
        final int[] checksum = new int[CHECKSUM_LENGTH];
        for (int i = 0; i < CHECKSUM_LENGTH; i++) {
            checksum[i] = (mod >>> (5 * (5 - i))) & 31;
        }
        return checksum;
    }

    /**
     * Encodes a payload into a lowercase Bech32 or Bech32m string.
     *
     * @param hrp      human-readable part
     * @param data     payload values (5-bit)
     * @param encoding checksum variant
     * @return the encoded string
     */
    public static String encode(final String hrp, final int[] data, final Encoding encoding) {
        final String lowerHrp = hrp.toLowerCase(Locale.ROOT);
        final int[] combined = concat(data, createChecksum(lowerHrp, data, encoding));
        final StringBuilder sb = new StringBuilder(lowerHrp.length() + 1 + combined.length);
        sb.append(lowerHrp).append('1');
        for (final int v : combined) {
            if (v < 0 || v > 31) {
                throw new IllegalArgumentException("data value out of range: " + v);
            }
            sb.append(CHARSET.charAt(v));
        }
        return sb.toString();
    }

    /**
     * Converts a witness program to 5-bit words prefixed with the witness version.
     *
     * @param program        the witness program bytes
     * @param witnessVersion the witness version (0..16)
     * @return data values suitable for {@link #encode}
     */
    public static int[] toWords(final byte[] program, final int witnessVersion) {
        if (witnessVersion < 0 || witnessVersion > 16) {
            throw new IllegalArgumentException("witness version out of range: " + witnessVersion);
        }
        final byte[] converted = convertBits(program, 8, 5, true);
        final int[] out = new int[converted.length + 1];
        out[0] = witnessVersion;
        for (int i = 0; i < converted.length; i++) {
            out[i + 1] = converted[i] & 0xFF;
        }
        return out;
    }

    /**
     * General power-of-two base conversion.
     *
     * @param data     input groups
     * @param fromBits bits per input group
     * @param toBits   bits per output group
     * @param pad      whether to pad the final group with zeros
     * @return converted groups
     * @throws IllegalArgumentException on invalid input or non-zero padding
     */
    public static byte[] convertBits(final byte[] data, final int fromBits, final int toBits, final boolean pad) {
        int acc = 0;
        int bits = 0;
        final ByteArrayOutputStream out = new ByteArrayOutputStream(data.length * fromBits / toBits + 1);
        final int maxv = (1 << toBits) - 1;
        final int maxAcc = (1 << (fromBits + toBits - 1)) - 1;
        for (final byte b : data) {
            final int value = b & 0xFF;
            if ((value >>> fromBits) != 0) {
                throw new IllegalArgumentException("input value exceeds " + fromBits + " bits: " + value);
            }
            acc = ((acc << fromBits) | value) & maxAcc;
            bits += fromBits;
            while (bits >= toBits) {
                bits -= toBits;
                out.write((acc >>> bits) & maxv);
            }
        }
        if (pad) {
            if (bits > 0) {
                out.write((acc << (toBits - bits)) & maxv);
            }
        } else if (bits >= fromBits || ((acc << (toBits - bits)) & maxv) != 0) {
            throw new IllegalArgumentException("invalid padding in bit conversion");
        }
        return out.toByteArray();
    }

    private static int[] concat(final int[] a, final int[] b) {
        final int[] out = Arrays.copyOf(a, a.length + b.length);
        System.arraycopy(b, 0, out, a.length, b.length);
        return out;
    }
}
