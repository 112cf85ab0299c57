package io.sigv4.auth;

import com.amazonaws.AmazonClientException;
import com.amazonaws.util.BinaryUtils;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * One-shot SHA-256 digests. A new {@link MessageDigest} is obtained for every call.
 */
public final class Sha256Hasher {
    private static final String ALGORITHM = "SHA-256";

    private Sha256Hasher() {
    }

    /**
     * Hashes the given bytes using the SHA-256 algorithm; null hashes as the empty sequence.
     *
     * @param data The bytes to hash.
     * @return The hashed bytes.
     * @throws AmazonClientException If the hash cannot be computed.
     */
    public static byte[] hash(byte[] data) throws AmazonClientException {
        try {
            MessageDigest md = MessageDigest.getInstance(ALGORITHM);
            if (data != null) {
                md.update(data);
            }
            return md.digest();
        } catch (Exception e) {
            throw new AmazonClientException("Unable to compute hash while signing request: " + e.getMessage(), e);
        }
    }

    /**
     * Hashes the string contents (assumed to be UTF-8) using the SHA-256
     * algorithm.
     */
    public static byte[] hash(String text) throws AmazonClientException {
        return hash(text.getBytes(StandardCharsets.UTF_8));
    }

    public static String hashHex(byte[] data) {
        return BinaryUtils.toHex(hash(data));
    }

    public static String hashHex(String text) {
        return BinaryUtils.toHex(hash(text));
    }
}
