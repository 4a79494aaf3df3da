package io.zendesk.sdk;

/**
 * Failure that happened before any HTTP status was available: the request could not be built, its body could not be
 * serialised, the connection failed or timed out, or the response body could not be read.
 */
public final class ZendeskTransportException extends ZendeskException {

    private static final long serialVersionUID = 1L;

    public ZendeskTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
