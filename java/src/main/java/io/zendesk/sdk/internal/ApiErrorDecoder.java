package io.zendesk.sdk.internal;

import io.zendesk.sdk.ZendeskApiException;

import java.net.http.HttpResponse;

/**
 * Utility for turning rejected responses into {@link ZendeskApiException}. The body is kept verbatim; the Zendesk
 * error document is not interpreted here.
 */
public final class ApiErrorDecoder {

    private ApiErrorDecoder() {
    }

    public static ZendeskApiException decode(HttpResponse<byte[]> response) {
        byte[] body = response.body() == null ? new byte[0] : response.body();
        return new ZendeskApiException(response.statusCode(), response.headers().map(), body);
    }
}
