package io.sigv4.auth;

import io.sigv4.Constants;

import java.nio.charset.StandardCharsets;

public final class SigningKeyDeriver {

    private SigningKeyDeriver() {
    }

    /**
     * Derives the request scoped signing key. AWS4 uses a series of derived
     * keys, formed by hashing different pieces of data; every step is keyed
     * with the raw bytes of the previous one.
     *
     * @return the 32 byte signing key
     */
    public static byte[] deriveSigningKey(String secretKey, String dateStamp, String region, String service) {
        byte[] kSecret = (Constants.SCHEME_PREFIX + secretKey).getBytes(StandardCharsets.UTF_8);
        byte[] kDate = HmacSigner.hmacSha256(dateStamp, kSecret);
        byte[] kRegion = HmacSigner.hmacSha256(region, kDate);
        byte[] kService = HmacSigner.hmacSha256(service, kRegion);
        return HmacSigner.hmacSha256(Constants.TERMINATOR, kService);
    }

    public static byte[] deriveSigningKey(String secretKey, CredentialScope scope) {
        return deriveSigningKey(secretKey, scope.getDateStamp(), scope.getRegion(), scope.getService());
    }
}
