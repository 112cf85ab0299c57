package io.sigv4;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import org.apache.hadoop.conf.Configuration;

import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reads signer settings stored under "sigv4.[profile].[suffix]". A setting
 * missing from a named profile is taken from the default profile.
 */
public final class SignerConfiguration {
    private static final Splitter HEADER_ENTRY_SPLITTER = Splitter.on(',').trimResults();
    private static final Splitter HEADER_NAME_VALUE_SPLITTER = Splitter.on(':').limit(2).trimResults();

    private SignerConfiguration() {
    }

    static String formatKey(String profile, String keySuffix) {
        return Constants.CONFIGURATION_PREFIX + "." + profile + "." + keySuffix;
    }

    private static String lookupKey(Configuration conf, String profile, String keySuffix) {
        String key = formatKey(profile, keySuffix);
        if (conf.get(key) == null && !profile.equals(Constants.DEFAULT_PROFILE)) {
            return formatKey(Constants.DEFAULT_PROFILE, keySuffix);
        }
        return key;
    }

    /**
     * @return the profile's value, the default profile's value, or null when neither is set
     */
    public static String get(Configuration conf, String profile, String keySuffix) {
        return conf.get(lookupKey(conf, profile, keySuffix));
    }

    /**
     * @throws IOException if the value is set but is not a whole number
     */
    public static int getInt(Configuration conf, String profile, String keySuffix, int defaultValue) throws IOException {
        String key = lookupKey(conf, profile, keySuffix);
        String value = conf.get(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IOException(String.format("Invalid number '%s' in %s", value, key), e);
        }
    }

    /**
     * Parses a header list in the format "name1:value1,name2:value2". Only the
     * first ':' of an entry separates the name from the value, so values may
     * hold colons. Names are compared case-insensitively.
     *
     * @return headers keyed case-insensitively, or null when the key is not set
     * @throws IOException on an empty list, an entry without a name or ':',
     *                     a name holding whitespace, or a name given twice
     */
    public static Map<String, String> getHeaders(Configuration conf, String profile, String keySuffix) throws IOException {
        String key = lookupKey(conf, profile, keySuffix);
        String value = conf.get(key);
        if (value == null) {
            return null;
        }
        Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (String entry : HEADER_ENTRY_SPLITTER.split(value)) {
            List<String> nameValue = HEADER_NAME_VALUE_SPLITTER.splitToList(entry);
            if (nameValue.size() != 2 || nameValue.get(0).isEmpty()) {
                throw new IOException(String.format("Invalid header '%s' in %s, expected name:value", entry, key));
            }
            String name = nameValue.get(0);
            if (CharMatcher.whitespace().matchesAnyOf(name)) {
                throw new IOException(String.format("Invalid header name '%s' in %s", name, key));
            }
            if (headers.putIfAbsent(name, nameValue.get(1)) != null) {
                throw new IOException(String.format("Header %s given more than once in %s", name, key));
            }
        }
        return Collections.unmodifiableMap(headers);
    }
}
