package io.zendesk.sdk.internal;

import io.zendesk.sdk.auth.Credential;

import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.Map;

/**
 * Helper methods for building API requests.
 */
public final class HttpUtil {

    private HttpUtil() {
    }

    /**
     * Builds a request carrying the configured headers and credential.
     *
     * @param body encoded JSON payload, or {@code null} to send no body at all
     * @param credential may be {@code null} for unauthenticated requests
     * @throws IllegalArgumentException when the URL or a header is not valid
     */
    public static HttpRequest buildRequest(
        HttpVerb verb,
        String url,
        byte[] body,
        Map<String, String> headers,
        Credential credential,
        Duration timeout
    ) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(url));

        if (body == null) {
            builder.method(verb.name(), HttpRequest.BodyPublishers.noBody());
        } else {
            builder.method(verb.name(), HttpRequest.BodyPublishers.ofByteArray(body));
        }

        if (timeout != null) {
            builder.timeout(timeout);
        }

        if (headers != null) {
            for (Map.Entry<String, String> entry : headers.entrySet()) {
                builder.setHeader(entry.getKey(), entry.getValue());
            }
        }

        if (credential != null) {
            credential.apply(builder);
        }

        return builder.build();
    }
}
