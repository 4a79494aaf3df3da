package io.zendesk.sdk;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.zendesk.sdk.internal.ApiErrorDecoder;
import io.zendesk.sdk.internal.HttpUtil;
import io.zendesk.sdk.internal.HttpVerb;
import io.zendesk.sdk.internal.Json;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * <p>
 * Primary entry point for the Zendesk Support API. Build one from a {@link Config} and reuse it; the configuration is
 * frozen at construction, so the client is safe to share between threads as long as the underlying
 * {@link HttpClient} is.
 * </p>
 *
 * <h2>Request semantics</h2>
 * <ul>
 *   <li>Every call is a single blocking round trip; nothing is retried, cached or rate limited.</li>
 *   <li>Each verb accepts a fixed set of statuses: GET 200, POST 200/201, PUT and PATCH 200/204, DELETE 204. Any other
 *       status raises {@link ZendeskApiException} carrying the exact response body.</li>
 *   <li>Failures before a status exists (request construction, body encoding, I/O, interruption) raise
 *       {@link ZendeskTransportException}.</li>
 * </ul>
 *
 * <p>
 * Typed resource methods live on per-resource views such as {@link #groups()}. The raw verb methods are the escape
 * hatch for endpoints without a dedicated method; {@code path} is appended to the base endpoint as-is and must already
 * be escaped.
 * </p>
 */
public final class ZendeskClient implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(ZendeskClient.class.getName());

    private final Config config;
    private final HttpClient httpClient;
    private final String baseUrl;
    private final GroupApi groups;

    /**
     * @param config caller-supplied configuration; defaults are applied to a copy, so the client never observes later
     *               changes.
     * @throws IllegalArgumentException when neither a valid subdomain nor an endpoint URL is configured
     */
    public ZendeskClient(Config config) {
        Objects.requireNonNull(config, "config");
        this.config = config.withDefaults();
        this.baseUrl = this.config.getBaseUrl();
        this.httpClient = this.config.getHttpClient();
        this.groups = new GroupClient(this);
    }

    public Config config() {
        return config;
    }

    public GroupApi groups() {
        return groups;
    }

    /**
     * Sends a GET request and returns the response body; succeeds on 200 only.
     */
    public byte[] get(String path) throws ZendeskException {
        return execute(HttpVerb.GET, path, null);
    }

    /**
     * Sends {@code body} as JSON and returns the response body; succeeds on 200 or 201.
     */
    public byte[] post(String path, Object body) throws ZendeskException {
        return execute(HttpVerb.POST, path, body);
    }

    /**
     * Sends {@code body} as JSON and returns the response body, which is empty for 204; succeeds on 200 or 204.
     */
    public byte[] put(String path, Object body) throws ZendeskException {
        return execute(HttpVerb.PUT, path, body);
    }

    /**
     * Same success policy as {@link #put(String, Object)}.
     */
    public byte[] patch(String path, Object body) throws ZendeskException {
        return execute(HttpVerb.PATCH, path, body);
    }

    /**
     * Sends a DELETE request; succeeds on 204 only.
     *
     * @param body optional payload; {@code null} sends no body at all
     */
    public void delete(String path, Object body) throws ZendeskException {
        execute(HttpVerb.DELETE, path, body);
    }

    /**
     * Sends a DELETE request without a body.
     */
    public void delete(String path) throws ZendeskException {
        delete(path, null);
    }

    /**
     * Currently a no-op: the {@link HttpClient} is either supplied by the caller or needs no explicit shutdown.
     */
    @Override
    public void close() {
        // httpClient is managed externally; nothing to close.
    }

    private byte[] execute(HttpVerb verb, String path, Object payload) throws ZendeskException {
        Objects.requireNonNull(path, "path");
        String requestLine = verb + " " + path;

        byte[] encoded = null;
        if (verb.alwaysEncodesBody() || payload != null) {
            try {
                encoded = Json.mapper().writeValueAsBytes(payload);
            } catch (JsonProcessingException ex) {
                throw new ZendeskTransportException("encode " + requestLine + " body: " + ex.getOriginalMessage(), ex);
            }
        }

        HttpRequest request;
        try {
            request = HttpUtil.buildRequest(verb, baseUrl + path, encoded, config.getHeaders(),
                config.getCredential(), config.getHttpTimeout());
        } catch (IllegalArgumentException ex) {
            throw new ZendeskTransportException("build " + requestLine + " request: " + ex.getMessage(), ex);
        }

        LOGGER.fine(() -> "[zendesk-sdk] " + requestLine);
        HttpResponse<byte[]> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ZendeskTransportException(requestLine + " interrupted", ex);
        } catch (IOException ex) {
            throw new ZendeskTransportException(requestLine + " request: " + ex.getMessage(), ex);
        }

        int status = response.statusCode();
        if (!verb.accepts(status)) {
            LOGGER.fine(() -> String.format(Locale.ROOT, "[zendesk-sdk] %s rejected with status %d", requestLine, status));
            throw ApiErrorDecoder.decode(response);
        }

        byte[] body = response.body() == null ? new byte[0] : response.body();
        LOGGER.fine(() -> String.format(Locale.ROOT,
            "[zendesk-sdk] %s returned %d (%d bytes)", requestLine, status, body.length));
        return body;
    }
}
