package io.sigv4;

import io.sigv4.auth.AwsRequestSigner;
import io.sigv4.http.AdditionalHeaders;
import io.sigv4.http.AwsSigningInterceptor;
import io.sigv4.http.SignableRequest;
import com.amazonaws.util.AwsHostNameUtils;
import org.apache.hadoop.conf.Configuration;
import org.apache.http.HttpRequestInterceptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Collections;
import java.util.Map;

/**
 * Signs requests for one service endpoint.
 * This class uses the configuration to initialize the signer together with the service and region it signs for.
 */
public class SigV4Client {
    private static final Logger LOG = LoggerFactory.getLogger(SigV4Client.class);
    private final AwsRequestSigner signer;
    private final String service;
    private final String region;
    private final Map<String, String> additionalHeaders;

    public SigV4Client(String profile, Configuration conf) throws IOException {
        this.signer = SignerFactory.newSigner(profile, conf);

        this.service = SignerConfiguration.get(conf, profile, Constants.SERVICE_KEY_SUFFIX);
        if (this.service == null || this.service.isEmpty()) {
            throw new IOException("Missing AWS service name");
        }

        String region = SignerConfiguration.get(conf, profile, Constants.REGION_KEY_SUFFIX);
        if (region == null) {
            region = parseRegion(SignerConfiguration.get(conf, profile, Constants.ENDPOINT_KEY_SUFFIX), this.service);
        }
        if (region == null || region.isEmpty()) {
            throw new IOException("Missing AWS region and no endpoint to parse it from");
        }
        this.region = region;

        Map<String, String> additionalHeaders = SignerConfiguration.getHeaders(conf, profile, Constants.ADDITIONAL_HEADERS_KEY_SUFFIX);
        this.additionalHeaders = additionalHeaders == null ? Collections.emptyMap() : additionalHeaders;

        LOG.info("Initiating SigV4 signer for profile {}: service {} region {} access key {}", profile, service, region, signer.getAccessKeyId());
    }

    public SigV4Client(AwsRequestSigner signer, String service, String region) {
        this.signer = signer;
        this.service = service;
        this.region = region;
        this.additionalHeaders = Collections.emptyMap();
    }

    static String parseRegion(String endpoint, String service) throws IOException {
        if (endpoint == null) {
            return null;
        }
        try {
            String host = new URI(endpoint).getHost();
            if (host == null) {
                throw new IOException(String.format("Endpoint %s has no host", endpoint));
            }
            return AwsHostNameUtils.parseRegion(host, service);
        } catch (URISyntaxException e) {
            throw new IOException(String.format("Invalid endpoint %s", endpoint), e);
        }
    }

    /**
     * Adds the configured additional headers that are not already set, then signs the request.
     * The added headers are removed again when signing fails.
     */
    public void sign(SignableRequest request) {
        AdditionalHeaders.addAndSign(signer, request, service, region, additionalHeaders);
    }

    public HttpRequestInterceptor newInterceptor() {
        return new AwsSigningInterceptor(signer, service, region, additionalHeaders);
    }

    public AwsRequestSigner getSigner() {
        return signer;
    }

    public String getService() {
        return service;
    }

    public String getRegion() {
        return region;
    }

    public Map<String, String> getAdditionalHeaders() {
        return additionalHeaders;
    }
}
