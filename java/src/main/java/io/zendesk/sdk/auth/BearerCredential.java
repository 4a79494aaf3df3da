package io.zendesk.sdk.auth;

import java.net.http.HttpRequest;
import java.util.Objects;

/**
 * OAuth bearer token credential.
 */
public record BearerCredential(String token) implements Credential {

    public BearerCredential {
        Objects.requireNonNull(token, "token");
        if (token.isBlank()) {
            throw new IllegalArgumentException("token must be non-empty");
        }
    }

    @Override
    public void apply(HttpRequest.Builder request) {
        request.setHeader("Authorization", "Bearer " + token);
    }

    @Override
    public String toString() {
        return "BearerCredential[token=***]";
    }
}
