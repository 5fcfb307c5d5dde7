// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.primitives;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Objects;

/**
 * SHA-256 hashing utility, including the double hash Bitcoin uses for checksums.
 *
 * <p>Digest instances are cached per thread. In long-lived thread pools call
 * {@link #cleanup()} when a worker is retired.
 *
 * @since 0.1.0
 */
public final class Sha256 {

    private static final String ALGORITHM = "SHA-256";

    private static final ThreadLocal<MessageDigest> DIGEST = ThreadLocal.withInitial(() -> {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            // SHA-256 is required by the Java platform
            throw new AssertionError("SHA-256 algorithm not available", e);
        }
    });

    private Sha256() {
        // Utility class
    }

    /**
     * Computes the SHA-256 hash of the input bytes.
     *
     * @param input the data to hash
     * @return 32-byte hash
     * @throws NullPointerException if input is null
     */
    public static byte[] hash(final byte[] input) {
        Objects.requireNonNull(input, "input cannot be null");

        final MessageDigest digest = DIGEST.get();
        digest.reset();
        return digest.digest(input);
    }

    /**
     * Computes SHA-256(SHA-256(input)).
     *
     * @param input the data to hash
     * @return 32-byte hash
     */
    public static byte[] doubleHash(final byte[] input) {
        return hash(hash(input));
    }

    /**
     * Removes the cached digest instance from the current thread.
     */
    public static void cleanup() {
        DIGEST.remove();
    }
}
