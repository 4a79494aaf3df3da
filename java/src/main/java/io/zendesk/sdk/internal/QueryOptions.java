package io.zendesk.sdk.internal;

/**
 * Typed options that know how to render themselves as query parameters.
 */
public interface QueryOptions {

    void appendTo(QueryString query);
}
