package io.taskrelay.common;

/**
 * HTTP header names used by the A2A protocol.
 */
public final class A2AHeaders {

    /**
     * Carries the client-supplied correlation token on webhook deliveries.
     */
    public static final String X_A2A_NOTIFICATION_TOKEN = "X-A2A-Notification-Token";

    /**
     * Declares the protocol version ({@code Major.Minor}) the caller speaks.
     */
    public static final String A2A_VERSION = "A2A-Version";

    /**
     * Comma separated list of extension URIs requested by the caller.
     */
    public static final String A2A_EXTENSIONS = "A2A-Extensions";

    public static final String AUTHORIZATION = "Authorization";

    public static final String CONTENT_TYPE = "Content-Type";

    public static final String APPLICATION_JSON = "application/json";

    private A2AHeaders() {
    }
}
