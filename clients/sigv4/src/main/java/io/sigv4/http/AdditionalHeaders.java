package io.sigv4.http;

import com.google.common.collect.ListMultimap;
import io.sigv4.auth.RequestSigner;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Configured headers that go out, signed, on every request that does not set them itself.
 */
public final class AdditionalHeaders {

    private AdditionalHeaders() {
    }

    /**
     * Adds the headers the request is missing and signs it. When signing
     * fails the added headers are removed again and the failure is rethrown.
     */
    public static void addAndSign(RequestSigner signer, SignableRequest request, String service, String region,
                                  Map<String, String> additionalHeaders) {
        List<String> added = new ArrayList<>();
        if (!additionalHeaders.isEmpty()) {
            ListMultimap<String, String> present = request.getHeaders();
            for (Map.Entry<String, String> header : additionalHeaders.entrySet()) {
                if (!present.containsKey(header.getKey())) {
                    request.addHeader(header.getKey(), header.getValue());
                    added.add(header.getKey());
                }
            }
        }
        try {
            signer.sign(request, service, region);
        } catch (RuntimeException e) {
            added.forEach(request::removeHeaders);
            throw e;
        }
    }
}
