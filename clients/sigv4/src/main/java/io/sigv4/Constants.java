package io.sigv4;

public class Constants {
    public static final String CONFIGURATION_PREFIX = "sigv4";
    public static final String DEFAULT_PROFILE = "default";
    public static final String ACCESS_KEY_KEY_SUFFIX = "access.key";
    public static final String SECRET_KEY_KEY_SUFFIX = "secret.key";
    public static final String REGION_KEY_SUFFIX = "region";
    public static final String SERVICE_KEY_SUFFIX = "service";
    // used to parse the region when no region is configured
    public static final String ENDPOINT_KEY_SUFFIX = "endpoint";
    // extra headers added to every request before signing, "name1:value1,name2:value2"
    public static final String ADDITIONAL_HEADERS_KEY_SUFFIX = "additional_headers";
    // seconds the local clock is ahead of the service clock
    public static final String TIME_OFFSET_SECONDS_KEY_SUFFIX = "time.offset_seconds";

    public static final String ALGORITHM = "AWS4-HMAC-SHA256";
    public static final String TERMINATOR = "aws4_request";
    public static final String SCHEME_PREFIX = "AWS4";

    public static final String AUTHORIZATION_HEADER = "Authorization";
    public static final String HOST_HEADER = "Host";
    public static final String AMZ_DATE_HEADER = "x-amz-date";

    public static final String SEPARATOR = "/";
}
