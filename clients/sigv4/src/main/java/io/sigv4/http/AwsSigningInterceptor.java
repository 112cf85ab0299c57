package io.sigv4.http;

import io.sigv4.auth.RequestSigner;
import org.apache.http.HttpRequest;
import org.apache.http.HttpRequestInterceptor;
import org.apache.http.protocol.HttpContext;
import org.apache.http.protocol.HttpCoreContext;

import java.util.Collections;
import java.util.Map;

/**
 * Signs every request passing through an Apache HttpClient. Register it with
 * {@code HttpClientBuilder#addInterceptorLast} so that the headers added by
 * the client itself are part of the signature.
 */
public class AwsSigningInterceptor implements HttpRequestInterceptor {
    private final RequestSigner signer;
    private final String service;
    private final String region;
    private final Map<String, String> additionalHeaders;

    public AwsSigningInterceptor(RequestSigner signer, String service, String region) {
        this(signer, service, region, Collections.emptyMap());
    }

    /**
     * @param additionalHeaders headers set on each request that does not have them yet, signed with it
     */
    public AwsSigningInterceptor(RequestSigner signer, String service, String region, Map<String, String> additionalHeaders) {
        this.signer = signer;
        this.service = service;
        this.region = region;
        this.additionalHeaders = additionalHeaders;
    }

    @Override
    public void process(HttpRequest request, HttpContext context) {
        HttpCoreContext coreContext = HttpCoreContext.adapt(context);
        AdditionalHeaders.addAndSign(signer, new HttpClientSignableRequest(request, coreContext.getTargetHost()),
                service, region, additionalHeaders);
    }
}
