package io.taskrelay.client.http;

import java.io.IOException;

/**
 * Signals that the server answered, but with a status the client treats as a failure
 * (authentication or authorization rejected).
 */
public class HttpStatusException extends IOException {

    private final int statusCode;

    public HttpStatusException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }
}
