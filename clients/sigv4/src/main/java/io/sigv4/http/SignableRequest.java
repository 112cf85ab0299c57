package io.sigv4.http;

import com.google.common.collect.ListMultimap;

import java.io.IOException;
import java.net.URI;

/**
 * The parts of an outgoing HTTP request that take part in a SigV4 signature.
 * Implementations adapt a concrete HTTP client request; the signer reads the
 * request through this view and only ever calls {@link #addHeader}.
 */
public interface SignableRequest {
    // HTTP method, expected to be uppercase
    String getMethod();

    // absolute target URI: scheme, host, optional port, raw path and raw query
    URI getUri();

    /**
     * @return a snapshot of the request headers keyed case-insensitively, values in the order they were added
     */
    ListMultimap<String, String> getHeaders();

    void addHeader(String name, String value);

    // remove every value of a header, name compared case-insensitively
    void removeHeaders(String name);

    /**
     * @return the body bytes, or null when the request has no body
     * @throws IOException if the body cannot be read
     */
    byte[] getContent() throws IOException;
}
