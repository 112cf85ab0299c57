package io.sigv4.auth;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of canonicalizing one request at one instant. Built fresh for every
 * signature, never cached.
 */
public final class CanonicalRequest {
    private final String canonicalRequest;
    private final String amzDate;
    private final String signedHeaders;
    private final Map<String, String> headersToAdd;

    CanonicalRequest(String canonicalRequest, String amzDate, String signedHeaders, Map<String, String> headersToAdd) {
        this.canonicalRequest = canonicalRequest;
        this.amzDate = amzDate;
        this.signedHeaders = signedHeaders;
        this.headersToAdd = Collections.unmodifiableMap(new LinkedHashMap<>(headersToAdd));
    }

    // the six newline separated segments
    public String getCanonicalRequest() {
        return canonicalRequest;
    }

    // value of the x-amz-date header, yyyyMMdd'T'HHmmss'Z'
    public String getAmzDate() {
        return amzDate;
    }

    public String getSignedHeaders() {
        return signedHeaders;
    }

    /**
     * @return headers that were signed but are not on the request yet (Host when missing, and x-amz-date)
     */
    public Map<String, String> getHeadersToAdd() {
        return headersToAdd;
    }

    @Override
    public String toString() {
        return canonicalRequest;
    }
}
