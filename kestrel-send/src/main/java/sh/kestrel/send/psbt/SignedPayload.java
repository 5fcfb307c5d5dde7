// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.send.psbt;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.jspecify.annotations.Nullable;
import sh.kestrel.primitives.Hex;

/**
 * Signed data handed back by an external signer, classified by format.
 *
 * <p>Classification rules:
 * <ul>
 * <li>Bytes starting with the PSBT magic {@code 70 73 62 74 ff} are a binary PSBT and are
 * carried as base64.</li>
 * <li>Other bytes that decode as printable UTF-8 text are classified as text.</li>
 * <li>Any remaining bytes are a binary raw transaction and are carried as hex.</li>
 * <li>Text that is even-length hex longer than 20 characters is a raw transaction.</li>
 * <li>Text that is base64 of a PSBT is a PSBT.</li>
 * </ul>
 *
 * @param format the detected format
 * @param data   base64 for {@link SignedPayloadFormat#PSBT}, hex for
 *               {@link SignedPayloadFormat#RAW_TRANSACTION}
 * @since 0.1.0
 */
public record SignedPayload(SignedPayloadFormat format, String data) {

    private static final byte[] PSBT_MAGIC = {0x70, 0x73, 0x62, 0x74, (byte) 0xff};
    private static final int MIN_RAW_TX_HEX_LENGTH = 21;

    public SignedPayload {
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(data, "data");
        if (data.isEmpty()) {
            throw new IllegalArgumentException("Signed payload must not be empty");
        }
    }

    /**
     * Classifies scanned or pasted text.
     *
     * @param text signer output; surrounding whitespace is ignored
     * @return the payload, or empty if the text is neither a PSBT nor a raw transaction
     */
    public static Optional<SignedPayload> fromText(final @Nullable String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        final String trimmed = text.trim();
        if (Hex.isHex(trimmed) && trimmed.length() % 2 == 0 && trimmed.length() >= MIN_RAW_TX_HEX_LENGTH) {
            return Optional.of(new SignedPayload(SignedPayloadFormat.RAW_TRANSACTION, trimmed.toLowerCase(Locale.ROOT)));
        }
        final byte[] decoded;
        try {
            decoded = Base64.getDecoder().decode(trimmed);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        return hasPsbtMagic(decoded)
                ? Optional.of(new SignedPayload(SignedPayloadFormat.PSBT, trimmed))
                : Optional.empty();
    }

    /**
     * Classifies file content.
     *
     * @param bytes file content
     * @return the payload, or empty if the content is empty or unrecognised text
     */
    public static Optional<SignedPayload> fromBytes(final byte @Nullable [] bytes) {
        if (bytes == null || bytes.length == 0) {
            return Optional.empty();
        }
        if (hasPsbtMagic(bytes)) {
            return Optional.of(new SignedPayload(SignedPayloadFormat.PSBT, Base64.getEncoder().encodeToString(bytes)));
        }
        final String text = decodeText(bytes);
        if (text != null) {
            return fromText(text);
        }
        return Optional.of(new SignedPayload(SignedPayloadFormat.RAW_TRANSACTION, Hex.encode(bytes)));
    }

    static boolean hasPsbtMagic(final byte[] bytes) {
        return bytes.length >= PSBT_MAGIC.length
                && Arrays.equals(Arrays.copyOf(bytes, PSBT_MAGIC.length), PSBT_MAGIC);
    }

    private static @Nullable String decodeText(final byte[] bytes) {
        final String decoded;
        try {
            decoded = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            return null;
        }
        final String trimmed = decoded.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        for (int i = 0; i < trimmed.length(); i++) {
            final char c = trimmed.charAt(i);
            if (c < 0x20 && c != '\n' && c != '\r' && c != '\t') {
                return null;
            }
        }
        return trimmed;
    }
}
