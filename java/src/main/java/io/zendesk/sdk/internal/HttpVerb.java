package io.zendesk.sdk.internal;

import java.util.Set;

/**
 * HTTP verbs used by the SDK together with the statuses each one treats as success.
 */
public enum HttpVerb {
    GET(false, Set.of(200)),
    POST(true, Set.of(200, 201)),
    // some mutation endpoints answer 204 No Content
    PUT(true, Set.of(200, 204)),
    PATCH(true, Set.of(200, 204)),
    DELETE(false, Set.of(204));

    private final boolean alwaysEncodesBody;
    private final Set<Integer> accepted;

    HttpVerb(boolean alwaysEncodesBody, Set<Integer> accepted) {
        this.alwaysEncodesBody = alwaysEncodesBody;
        this.accepted = accepted;
    }

    /**
     * @return {@code true} when the payload is JSON-encoded even if it is {@code null}; otherwise a body is sent only
     *     when one is supplied.
     */
    public boolean alwaysEncodesBody() {
        return alwaysEncodesBody;
    }

    public boolean accepts(int statusCode) {
        return accepted.contains(statusCode);
    }
}
