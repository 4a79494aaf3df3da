package io.zendesk.sdk;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Exception representing a request that reached Zendesk but was rejected. The SDK raises it whenever the response status
 * falls outside the set accepted for the HTTP verb, and keeps the raw body untouched so callers can parse the
 * API-specific error document themselves.
 */
public final class ZendeskApiException extends ZendeskException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;
    private final Map<String, List<String>> headers;
    private final byte[] body;

    public ZendeskApiException(int statusCode, Map<String, List<String>> headers, byte[] body) {
        super(statusCode + ": " + (body == null ? "" : new String(body, StandardCharsets.UTF_8)));
        this.statusCode = statusCode;
        this.body = body == null ? new byte[0] : body.clone();
        Map<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            headers.forEach((name, values) -> copy.put(name, values == null ? List.of() : List.copyOf(values)));
        }
        this.headers = copy;
    }

    /**
     * @return HTTP status code returned by the API.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return response headers keyed case-insensitively; never {@code null}.
     */
    public Map<String, List<String>> getHeaders() {
        return Collections.unmodifiableMap(headers);
    }

    /**
     * @return first value of the named response header, or {@code null} when absent.
     */
    public String getHeader(String name) {
        List<String> values = headers.get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    /**
     * @return a copy of the exact response body bytes.
     */
    public byte[] getBody() {
        return body.clone();
    }

    public String getBodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    public boolean isClientError() {
        return statusCode >= 400 && statusCode < 500;
    }

    /**
     * @return {@code true} for 5xx responses, which usually indicate a transient condition on the Zendesk side.
     */
    public boolean isServerError() {
        return statusCode >= 500 && statusCode < 600;
    }
}
