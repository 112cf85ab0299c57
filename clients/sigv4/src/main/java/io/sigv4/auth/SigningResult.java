package io.sigv4.auth;

import io.sigv4.Constants;

/**
 * Everything computed while signing one request. The signing key is not part of it.
 */
public final class SigningResult {
    private final CanonicalRequest canonicalRequest;
    private final CredentialScope scope;
    private final String stringToSign;
    private final String signature;
    private final String accessKeyId;

    SigningResult(CanonicalRequest canonicalRequest, CredentialScope scope, String stringToSign, String signature, String accessKeyId) {
        this.canonicalRequest = canonicalRequest;
        this.scope = scope;
        this.stringToSign = stringToSign;
        this.signature = signature;
        this.accessKeyId = accessKeyId;
    }

    public CanonicalRequest getCanonicalRequest() {
        return canonicalRequest;
    }

    public CredentialScope getScope() {
        return scope;
    }

    public String getStringToSign() {
        return stringToSign;
    }

    public String getSignature() {
        return signature;
    }

    public String getAmzDate() {
        return canonicalRequest.getAmzDate();
    }

    public String getSignedHeaders() {
        return canonicalRequest.getSignedHeaders();
    }

    public String getAuthorizationHeader() {
        return Constants.ALGORITHM + " "
                + RequestSigner.AUTHORIZATION_CREDENTIAL_PREFIX + accessKeyId + "/" + scope + ", "
                + RequestSigner.AUTHORIZATION_SIGNED_HEADERS_PREFIX + getSignedHeaders() + ", "
                + RequestSigner.AUTHORIZATION_SIGNATURE_PREFIX + signature;
    }
}
