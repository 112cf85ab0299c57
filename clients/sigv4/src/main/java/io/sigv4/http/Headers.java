package io.sigv4.http;

import com.google.common.collect.ListMultimap;
import com.google.common.collect.Multimap;
import com.google.common.collect.Multimaps;

import java.util.ArrayList;
import java.util.TreeMap;

/**
 * Header multimaps keyed case-insensitively. The first spelling of a name
 * that is added is the one the map keeps.
 */
public final class Headers {

    private Headers() {
    }

    public static ListMultimap<String, String> newMultimap() {
        return Multimaps.newListMultimap(new TreeMap<>(String.CASE_INSENSITIVE_ORDER), ArrayList::new);
    }

    public static ListMultimap<String, String> copyOf(Multimap<String, String> headers) {
        ListMultimap<String, String> copy = newMultimap();
        copy.putAll(headers);
        return copy;
    }
}
