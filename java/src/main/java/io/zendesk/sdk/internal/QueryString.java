package io.zendesk.sdk.internal;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * Query-string builder used by list endpoints. Empty strings, zero numbers and {@code false} flags are skipped so that
 * only parameters the caller actually set reach the API. Keys are emitted in sorted order; repeated keys keep the
 * order in which their values were added.
 */
public final class QueryString {

    private final Map<String, List<String>> values = new TreeMap<>();

    public QueryString add(String key, String value) {
        if (value != null && !value.isEmpty()) {
            values.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
        }
        return this;
    }

    public QueryString add(String key, long value) {
        if (value != 0) {
            add(key, Long.toString(value));
        }
        return this;
    }

    public QueryString add(String key, boolean value) {
        if (value) {
            add(key, "true");
        }
        return this;
    }

    public QueryString addAll(String key, List<String> items) {
        if (items != null) {
            for (String item : items) {
                add(key, item);
            }
        }
        return this;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public String encode() {
        StringJoiner joiner = new StringJoiner("&");
        for (Map.Entry<String, List<String>> entry : values.entrySet()) {
            String key = URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8);
            for (String value : entry.getValue()) {
                joiner.add(key + "=" + URLEncoder.encode(value, StandardCharsets.UTF_8));
            }
        }
        return joiner.toString();
    }

    /**
     * Appends the encoded options to {@code path}. Returns the path untouched when there is nothing to add.
     */
    public static String addOptions(String path, QueryOptions options) {
        if (options == null) {
            return path;
        }
        QueryString query = new QueryString();
        options.appendTo(query);
        if (query.isEmpty()) {
            return path;
        }
        return path + (path.contains("?") ? "&" : "?") + query.encode();
    }
}
