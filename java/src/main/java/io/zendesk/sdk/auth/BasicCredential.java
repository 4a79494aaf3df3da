package io.zendesk.sdk.auth;

import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Objects;

/**
 * HTTP Basic credential. The email acts as the username and the secret as the password.
 */
public record BasicCredential(String email, String secret) implements Credential {

    public BasicCredential {
        Objects.requireNonNull(email, "email");
        Objects.requireNonNull(secret, "secret");
    }

    @Override
    public void apply(HttpRequest.Builder request) {
        request.setHeader("Authorization", headerValue());
    }

    String headerValue() {
        String pair = email + ":" + secret;
        return "Basic " + Base64.getEncoder().encodeToString(pair.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String toString() {
        return "BasicCredential[email=" + email + ", secret=***]";
    }
}
