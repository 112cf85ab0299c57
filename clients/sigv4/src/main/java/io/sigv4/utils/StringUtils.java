package io.sigv4.utils;

import java.net.URI;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

public final class StringUtils {
    private static final Pattern WHITESPACE_PATTERN = Pattern.compile("\\s+");

    private StringUtils() {
    }

    /**
     * Percent-encodes a value as RFC 3986 asks for: only the unreserved
     * characters A-Z a-z 0-9 - _ . ~ stay as they are, '/' is encoded too.
     */
    public static String urlEncode(final String value) {
        if (value == null) {
            return "";
        }
        // URLEncoder does form encoding, which differs from RFC 3986 in these three characters
        String encoded = URLEncoder.encode(value, StandardCharsets.UTF_8);
        StringBuilder builder = new StringBuilder(encoded.length() + 8);
        for (int i = 0; i < encoded.length(); i++) {
            char c = encoded.charAt(i);
            if (c == '+') {
                builder.append("%20");
            } else if (c == '*') {
                builder.append("%2A");
            } else if (c == '%' && encoded.startsWith("%7E", i)) {
                builder.append('~');
                i += 2;
            } else {
                builder.append(c);
            }
        }
        return builder.toString();
    }

    /**
     * Decode a form/query component; '+' decodes to a space.
     */
    public static String urlDecode(final String value) {
        if (value == null) {
            return "";
        }
        return URLDecoder.decode(value, StandardCharsets.UTF_8);
    }

    /**
     * Trims the value and replaces every run of whitespace inside it with a single space.
     */
    public static String trimAll(String value) {
        if (value == null) {
            return "";
        }
        return WHITESPACE_PATTERN.matcher(value.trim()).replaceAll(" ");
    }

    /**
     * Returns true if the specified URI is using a non-standard port (i.e. any
     * port other than 80 for HTTP URIs or any port other than 443 for HTTPS
     * URIs).
     *
     * @param uri the uri to check
     * @return True if the specified URI is using a non-standard port, otherwise
     * false.
     */
    public static boolean isUsingNonDefaultPort(URI uri) {
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase();
        int port = uri.getPort();

        if (port <= 0) return false;
        if (scheme.equals("http") && port == 80) return false;
        if (scheme.equals("https") && port == 443) return false;

        return true;
    }

    public static String getHostHeader(URI endpoint) {
        StringBuilder hostHeaderBuilder = new StringBuilder(endpoint.getHost());
        if (isUsingNonDefaultPort(endpoint)) {
            hostHeaderBuilder.append(":").append(endpoint.getPort());
        }
        return hostHeaderBuilder.toString();
    }
}
