package io.sigv4.auth;

import com.amazonaws.auth.AWSCredentials;
import com.amazonaws.auth.BasicAWSCredentials;
import com.amazonaws.util.BinaryUtils;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import io.sigv4.Constants;
import io.sigv4.http.SignableRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

/**
 * AwsRequestSigner signs HTTP requests with AWS Signature Version 4 and adds
 * the x-amz-date and Authorization headers (and Host, when missing) to them.
 * <p>
 * An instance is bound to one credential and keeps no per-request state, so it
 * can sign independent requests from several threads at once. Signing either
 * completes and adds all headers, or fails before the request is touched.
 */
public class AwsRequestSigner implements RequestSigner {
    private static final Logger LOG = LoggerFactory.getLogger(AwsRequestSigner.class);

    private final AWSCredentials credentials;
    private final Clock clock;
    private final CanonicalRequestBuilder canonicalRequestBuilder = new CanonicalRequestBuilder();

    public AwsRequestSigner(String accessKey, String secretKey) {
        this(new BasicAWSCredentials(accessKey, secretKey));
    }

    public AwsRequestSigner(AWSCredentials credentials) {
        this(credentials, Clock.systemUTC());
    }

    /**
     * @param credentials access key id and secret key, both must be non-empty after trimming
     * @param clock       source of the signing instant, must be in UTC
     */
    public AwsRequestSigner(AWSCredentials credentials, Clock clock) {
        Preconditions.checkArgument(credentials != null, "credentials must not be null");
        Preconditions.checkArgument(clock != null, "clock must not be null");
        Preconditions.checkArgument(ZoneOffset.UTC.equals(clock.getZone().normalized()),
                "signing clock must be in UTC, got %s", clock.getZone());
        this.credentials = sanitizeCredentials(credentials);
        this.clock = clock;
    }

    /**
     * Loads the individual access key ID and secret key from the specified
     * credentials, ensuring that access to the credentials is synchronized on
     * the credentials object itself, and trimming any extra whitespace from the
     * credentials.
     *
     * @param credentials the credentials to copy
     * @return A new credentials object with the sanitized credentials.
     */
    protected static AWSCredentials sanitizeCredentials(AWSCredentials credentials) {
        String accessKeyId;
        String secretKey;
        synchronized (credentials) {
            accessKeyId = credentials.getAWSAccessKeyId();
            secretKey = credentials.getAWSSecretKey();
        }
        if (secretKey != null) secretKey = secretKey.trim();
        if (accessKeyId != null) accessKeyId = accessKeyId.trim();

        Preconditions.checkArgument(!Strings.isNullOrEmpty(accessKeyId), "access key must not be empty");
        Preconditions.checkArgument(!Strings.isNullOrEmpty(secretKey), "secret key must not be empty");
        return new BasicAWSCredentials(accessKeyId, secretKey);
    }

    public String getAccessKeyId() {
        return credentials.getAWSAccessKeyId();
    }

    @Override
    public void sign(SignableRequest request, String service, String region) {
        sign(request, service, region, clock.instant());
    }

    public void sign(SignableRequest request, String service, String region, Instant signingTime) {
        SigningResult result = computeSignature(request, service, region, signingTime);

        for (Map.Entry<String, String> header : result.getCanonicalRequest().getHeadersToAdd().entrySet()) {
            request.removeHeaders(header.getKey());
            request.addHeader(header.getKey(), header.getValue());
        }
        request.addHeader(Constants.AUTHORIZATION_HEADER, result.getAuthorizationHeader());
    }

    /**
     * Computes the signature of a request without modifying it.
     *
     * @throws IllegalArgumentException  if the request is null or service or region are empty
     * @throws MalformedRequestException if the request is already signed or has no host
     */
    public SigningResult computeSignature(SignableRequest request, String service, String region, Instant signingTime) {
        Preconditions.checkArgument(request != null, "request must not be null");
        Preconditions.checkArgument(!Strings.isNullOrEmpty(service), "service must not be empty");
        Preconditions.checkArgument(!Strings.isNullOrEmpty(region), "region must not be empty");
        Preconditions.checkArgument(signingTime != null, "signing time must not be null");
        if (request.getHeaders().containsKey(Constants.AUTHORIZATION_HEADER)) {
            throw new MalformedRequestException("Request already carries an Authorization header");
        }

        CanonicalRequest canonicalRequest = canonicalRequestBuilder.build(request, signingTime);

        CredentialScope scope = CredentialScope.of(signingTime, region, service);
        String stringToSign = getStringToSign(canonicalRequest.getAmzDate(), scope, canonicalRequest.getCanonicalRequest());

        byte[] signingKey = SigningKeyDeriver.deriveSigningKey(credentials.getAWSSecretKey(), scope);
        String signature = BinaryUtils.toHex(HmacSigner.hmacSha256(stringToSign, signingKey));

        return new SigningResult(canonicalRequest, scope, stringToSign, signature, credentials.getAWSAccessKeyId());
    }

    protected String getStringToSign(String dateTime, CredentialScope scope, String canonicalRequest) {
        String stringToSign = Constants.ALGORITHM + "\n" + dateTime + "\n" + scope + "\n" + Sha256Hasher.hashHex(canonicalRequest);
        LOG.debug("AWS4 String to Sign: '{}'", stringToSign);
        return stringToSign;
    }
}
