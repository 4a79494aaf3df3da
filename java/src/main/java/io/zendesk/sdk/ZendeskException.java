package io.zendesk.sdk;

/**
 * Base exception thrown by the Zendesk Java SDK.
 *
 * <p>
 * Callers usually catch one of the two concrete kinds: {@link ZendeskApiException} when the API answered with a status
 * outside the accepted set, or {@link ZendeskTransportException} when no usable response exists at all. The base type
 * itself is thrown when a successful response body cannot be decoded into the expected shape.
 * </p>
 */
public class ZendeskException extends Exception {

    private static final long serialVersionUID = 1L;

    public ZendeskException(String message) {
        super(message);
    }

    public ZendeskException(String message, Throwable cause) {
        super(message, cause);
    }
}
