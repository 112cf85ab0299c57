package io.sigv4.auth;

import com.amazonaws.AmazonClientException;
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Multimap;
import io.sigv4.Constants;
import io.sigv4.http.Headers;
import io.sigv4.http.SignableRequest;
import io.sigv4.utils.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Builds the SigV4 canonical request:
 * <pre>
 * HTTPMethod\n
 * CanonicalURI\n
 * CanonicalQueryString\n
 * CanonicalHeaders\n
 * SignedHeaders\n
 * HexEncode(Hash(RequestPayload))
 * </pre>
 * The request itself is not modified; the Host and x-amz-date headers that
 * take part in the signature are returned in {@link CanonicalRequest#getHeadersToAdd()}.
 */
public class CanonicalRequestBuilder {
    private static final Logger LOG = LoggerFactory.getLogger(CanonicalRequestBuilder.class);

    static final DateTimeFormatter AMZ_DATE_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);

    public CanonicalRequest build(SignableRequest request, Instant signingTime) {
        URI uri = request.getUri();
        if (uri == null || uri.getHost() == null) {
            throw new MalformedRequestException(String.format("Request URI %s has no host", uri));
        }

        ListMultimap<String, String> headers = Headers.copyOf(request.getHeaders());
        Map<String, String> headersToAdd = new LinkedHashMap<>();
        if (!headers.containsKey(Constants.HOST_HEADER)) {
            String host = StringUtils.getHostHeader(uri);
            headers.put(Constants.HOST_HEADER, host);
            headersToAdd.put(Constants.HOST_HEADER, host);
        }
        String amzDate = getTimeStamp(signingTime);
        headers.removeAll(Constants.AMZ_DATE_HEADER);
        headers.put(Constants.AMZ_DATE_HEADER, amzDate);
        headersToAdd.put(Constants.AMZ_DATE_HEADER, amzDate);

        SortedMap<String, List<String>> canonicalHeaders = canonicalizeHeaders(headers);
        String signedHeaders = getSignedHeadersString(canonicalHeaders);
        String contentSha256 = Sha256Hasher.hashHex(readContent(request));

        String canonicalRequest = request.getMethod() + "\n"
                + getCanonicalizedResourcePath(uri.getRawPath()) + "\n"
                + getCanonicalizedQueryString(parseQueryParameters(uri.getRawQuery())) + "\n"
                + getCanonicalizedHeaderString(canonicalHeaders) + "\n"
                + signedHeaders + "\n"
                + contentSha256;

        LOG.debug("AWS4 Canonical Request: '{}'", canonicalRequest);
        return new CanonicalRequest(canonicalRequest, amzDate, signedHeaders, headersToAdd);
    }

    public static String getTimeStamp(Instant instant) {
        return AMZ_DATE_FORMAT.format(instant);
    }

    private static byte[] readContent(SignableRequest request) {
        try {
            return request.getContent();
        } catch (IOException e) {
            throw new AmazonClientException("Unable to read request content to sign it: " + e.getMessage(), e);
        }
    }

    /**
     * Encodes each segment of the path separately so that the '/' separators
     * stay as they are. An empty path is canonicalized to "/".
     */
    public static String getCanonicalizedResourcePath(String rawPath) {
        if (rawPath == null || rawPath.isEmpty()) {
            return Constants.SEPARATOR;
        }
        String[] segments = rawPath.split(Constants.SEPARATOR, -1);
        StringBuilder buffer = new StringBuilder(rawPath.length());
        for (int i = 0; i < segments.length; i++) {
            if (i > 0) {
                buffer.append(Constants.SEPARATOR);
            }
            buffer.append(StringUtils.urlEncode(segments[i]));
        }
        return buffer.toString();
    }

    /**
     * Splits a raw query string into decoded parameters, keeping repeated keys.
     * A parameter without '=' gets an empty value.
     */
    public static ListMultimap<String, String> parseQueryParameters(String rawQuery) {
        ListMultimap<String, String> parameters = ArrayListMultimap.create();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return parameters;
        }
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            if (eq < 0) {
                parameters.put(StringUtils.urlDecode(pair), "");
            } else {
                parameters.put(StringUtils.urlDecode(pair.substring(0, eq)), StringUtils.urlDecode(pair.substring(eq + 1)));
            }
        }
        return parameters;
    }

    /**
     * Examines the specified query string parameters and returns a
     * canonicalized form.
     * <p>
     * The canonicalized query string is formed by first sorting all the query
     * string parameters by encoded name, then URI encoding both the key and
     * value and then joining them, in order, separating key value pairs with
     * an '&amp;'. Values holding commas count as several values. The values of
     * a repeated key are sorted before they are encoded.
     *
     * @param parameters The query string parameters to be canonicalized.
     * @return A canonicalized form for the specified query string parameters.
     */
    public static String getCanonicalizedQueryString(Multimap<String, String> parameters) {
        SortedMap<String, List<String>> sorted = new TreeMap<>();

        for (Map.Entry<String, Collection<String>> pair : parameters.asMap().entrySet()) {
            List<String> values = new ArrayList<>();
            for (String value : pair.getValue()) {
                Collections.addAll(values, (value == null ? "" : value).split(",", -1));
            }
            sorted.computeIfAbsent(StringUtils.urlEncode(pair.getKey()), k -> new ArrayList<>()).addAll(values);
        }

        StringBuilder builder = new StringBuilder();
        Iterator<Map.Entry<String, List<String>>> pairs = sorted.entrySet().iterator();
        while (pairs.hasNext()) {
            Map.Entry<String, List<String>> pair = pairs.next();
            List<String> values = pair.getValue();
            Collections.sort(values);
            for (String value : values) {
                if (builder.length() > 0) {
                    builder.append("&");
                }
                builder.append(pair.getKey());
                builder.append("=");
                builder.append(StringUtils.urlEncode(value));
            }
        }

        return builder.toString();
    }

    /**
     * Lowercases the header names and merges the values of names that only
     * differ in case. Names are ordered by their lowercase form.
     */
    static SortedMap<String, List<String>> canonicalizeHeaders(Multimap<String, String> headers) {
        SortedMap<String, List<String>> canonical = new TreeMap<>();
        for (Map.Entry<String, String> header : headers.entries()) {
            String key = StringUtils.trimAll(header.getKey()).toLowerCase(Locale.ROOT);
            canonical.computeIfAbsent(key, k -> new ArrayList<>()).add(StringUtils.trimAll(header.getValue()));
        }
        return canonical;
    }

    public static String getCanonicalizedHeaderString(Multimap<String, String> headers) {
        return getCanonicalizedHeaderString(canonicalizeHeaders(headers));
    }

    public static String getSignedHeadersString(Multimap<String, String> headers) {
        return getSignedHeadersString(canonicalizeHeaders(headers));
    }

    private static String getCanonicalizedHeaderString(SortedMap<String, List<String>> canonicalHeaders) {
        StringBuilder buffer = new StringBuilder();
        for (Map.Entry<String, List<String>> header : canonicalHeaders.entrySet()) {
            buffer.append(header.getKey()).append(":");
            buffer.append(String.join(",", header.getValue()));
            buffer.append("\n");
        }
        return buffer.toString();
    }

    private static String getSignedHeadersString(SortedMap<String, List<String>> canonicalHeaders) {
        return String.join(";", canonicalHeaders.keySet());
    }
}
