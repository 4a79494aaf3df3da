package io.zendesk.sdk.auth;

import java.net.http.HttpRequest;

/**
 * Identity material attached to every API request. Exactly two variants exist: {@link BasicCredential} and
 * {@link BearerCredential}. A client configured without a credential sends unauthenticated requests.
 */
public interface Credential {

    /**
     * Adds the {@code Authorization} header for this credential, replacing any value already present on the builder.
     */
    void apply(HttpRequest.Builder request);

    /**
     * HTTP Basic authentication with the agent's email address and password.
     */
    static Credential basic(String email, String password) {
        return new BasicCredential(email, password);
    }

    /**
     * HTTP Basic authentication with an API token; the username becomes {@code email/token}.
     */
    static Credential apiToken(String email, String apiToken) {
        return new BasicCredential(email + "/token", apiToken);
    }

    /**
     * OAuth access token sent as {@code Authorization: Bearer <token>}.
     */
    static Credential bearer(String token) {
        return new BearerCredential(token);
    }
}
