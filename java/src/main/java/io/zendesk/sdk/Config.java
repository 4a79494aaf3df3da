package io.zendesk.sdk;

import io.zendesk.sdk.auth.Credential;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Immutable configuration container used to bootstrap {@link ZendeskClient} instances.
 *
 * <p>
 * The base endpoint is derived either from a tenant subdomain ({@code https://{subdomain}.zendesk.com/api/v2}) or from an
 * explicit endpoint URL, which takes precedence and skips subdomain validation so tests can point at a mock server.
 * Headers supplied through the builder are layered over {@link #DEFAULT_HEADERS}; a custom header with the same
 * (case-insensitive) name replaces the default.
 * </p>
 */
public final class Config {

    public static final String SDK_VERSION = "0.18.0";
    public static final String BASE_URL_FORMAT = "https://%s.zendesk.com/api/v2";
    public static final Duration DEFAULT_HTTP_TIMEOUT = Duration.ofSeconds(30);
    public static final Map<String, String> DEFAULT_HEADERS = Map.of(
        "User-Agent", "zendesk-java-sdk/" + SDK_VERSION,
        "Content-Type", "application/json"
    );

    private static final Pattern SUBDOMAIN = Pattern.compile("^[a-z0-9][a-z0-9-]+[a-z0-9]$");

    private final String subdomain;
    private final String endpointUrl;
    private final String baseUrl;
    private final Credential credential;
    private final Map<String, String> headers;
    private final HttpClient httpClient;
    private final Duration httpTimeout;

    private Config(Builder builder) {
        this.subdomain = builder.subdomain;
        this.endpointUrl = builder.endpointUrl;
        this.baseUrl = builder.baseUrl;
        this.credential = builder.credential;
        Map<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        copy.putAll(builder.headers);
        this.headers = Collections.unmodifiableMap(copy);
        this.httpClient = builder.httpClient;
        this.httpTimeout = builder.httpTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Config withDefaults() {
        String resolvedBaseUrl;
        if (endpointUrl != null && !endpointUrl.isBlank()) {
            resolvedBaseUrl = sanitizeUrl(endpointUrl);
        } else if (subdomain != null) {
            if (!isValidSubdomain(subdomain)) {
                throw new IllegalArgumentException(subdomain + " is invalid subdomain");
            }
            resolvedBaseUrl = String.format(Locale.ROOT, BASE_URL_FORMAT, subdomain);
        } else {
            throw new IllegalArgumentException("subdomain or endpoint URL is required");
        }

        Duration resolvedTimeout = Optional.ofNullable(httpTimeout).orElse(DEFAULT_HTTP_TIMEOUT);
        if (resolvedTimeout.isNegative() || resolvedTimeout.isZero()) {
            resolvedTimeout = DEFAULT_HTTP_TIMEOUT;
        }

        HttpClient resolvedClient = httpClient;
        if (resolvedClient == null) {
            resolvedClient = HttpClient.newBuilder()
                .connectTimeout(resolvedTimeout)
                .build();
        }

        Map<String, String> resolvedHeaders = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        resolvedHeaders.putAll(DEFAULT_HEADERS);
        resolvedHeaders.putAll(headers);

        Builder resolved = new Builder()
            .subdomain(subdomain)
            .endpointUrl(endpointUrl)
            .credential(credential)
            .headers(resolvedHeaders)
            .httpClient(resolvedClient)
            .httpTimeout(resolvedTimeout);
        resolved.baseUrl = resolvedBaseUrl;
        return resolved.buildInternal();
    }

    /**
     * @return {@code true} when the value is lower-case alphanumeric with inner hyphens, at least three characters long.
     */
    public static boolean isValidSubdomain(String subdomain) {
        return subdomain != null && SUBDOMAIN.matcher(subdomain).matches();
    }

    private static String sanitizeUrl(String url) {
        String trimmed = url.trim();
        try {
            URI uri = new URI(trimmed);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException("URL must include scheme and host");
            }
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("Invalid URL: " + trimmed, ex);
        }
        if (trimmed.endsWith("/")) {
            return trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    public String getSubdomain() {
        return subdomain;
    }

    public String getEndpointUrl() {
        return endpointUrl;
    }

    /**
     * @return resolved base endpoint without a trailing slash; {@code null} until {@link #withDefaults()} has run.
     */
    public String getBaseUrl() {
        return baseUrl;
    }

    public Credential getCredential() {
        return credential;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public HttpClient getHttpClient() {
        return httpClient;
    }

    public Duration getHttpTimeout() {
        return httpTimeout;
    }

    public static final class Builder {
        private String subdomain;
        private String endpointUrl;
        private String baseUrl;
        private Credential credential;
        private final Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        private HttpClient httpClient;
        private Duration httpTimeout;

        public Builder subdomain(String subdomain) {
            this.subdomain = subdomain;
            return this;
        }

        /**
         * Replaces the full endpoint URL without subdomain validation. Mainly used to point at a mock API server.
         */
        public Builder endpointUrl(String endpointUrl) {
            this.endpointUrl = endpointUrl;
            return this;
        }

        public Builder credential(Credential credential) {
            this.credential = credential;
            return this;
        }

        /**
         * Adds a header sent with every request. A later call with the same name wins; a {@code null} value removes it.
         */
        public Builder header(String name, String value) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("header name must be non-empty");
            }
            headers.remove(name);
            if (value != null) {
                headers.put(name, value);
            }
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            if (headers != null) {
                headers.forEach(this::header);
            }
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder httpTimeout(Duration httpTimeout) {
            this.httpTimeout = httpTimeout;
            return this;
        }

        public Config build() {
            return new Config(this).withDefaults();
        }

        private Config buildInternal() {
            return new Config(this);
        }
    }
}
