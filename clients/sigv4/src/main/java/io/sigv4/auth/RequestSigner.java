package io.sigv4.auth;

import io.sigv4.http.SignableRequest;

public interface RequestSigner {
    String AUTHORIZATION_CREDENTIAL_PREFIX = "Credential=";
    String AUTHORIZATION_SIGNED_HEADERS_PREFIX = "SignedHeaders=";
    String AUTHORIZATION_SIGNATURE_PREFIX = "Signature=";

    // sign the request for the given service and region, adding the signature headers to it
    void sign(SignableRequest request, String service, String region);
}
