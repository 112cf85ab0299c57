package io.sigv4.auth;

import com.amazonaws.AmazonClientException;
import com.amazonaws.auth.SigningAlgorithm;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;

/**
 * Keyed MACs for key derivation and the final signature. Each call initializes its own {@link Mac}.
 */
public final class HmacSigner {

    private HmacSigner() {
    }

    public static byte[] sign(String stringData, byte[] key, SigningAlgorithm algorithm) throws AmazonClientException {
        return sign(stringData.getBytes(StandardCharsets.UTF_8), key, algorithm);
    }

    public static byte[] sign(byte[] data, byte[] key, SigningAlgorithm algorithm) throws AmazonClientException {
        try {
            Mac mac = Mac.getInstance(algorithm.toString());
            mac.init(new SecretKeySpec(key, algorithm.toString()));
            return mac.doFinal(data);
        } catch (Exception e) {
            throw new AmazonClientException("Unable to calculate a request signature: " + e.getMessage(), e);
        }
    }

    public static byte[] hmacSha256(String stringData, byte[] key) throws AmazonClientException {
        return sign(stringData, key, SigningAlgorithm.HmacSHA256);
    }
}
