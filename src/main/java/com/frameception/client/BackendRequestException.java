package com.frameception.client;

/**
 * Thrown when a backend request fails: transport error, HTTP error status or an unreadable body.
 */
public class BackendRequestException extends RuntimeException {
    public BackendRequestException(String message) {
        super(message);
    }

    public BackendRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
