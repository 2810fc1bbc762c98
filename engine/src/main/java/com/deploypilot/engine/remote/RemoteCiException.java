package com.deploypilot.engine.remote;

/**
 * Permanent failure talking to the remote CI backend (bad credentials,
 * unknown repository, malformed response). Not retried.
 */
public class RemoteCiException extends RuntimeException {

    private final int statusCode;

    public RemoteCiException(String message) {
        this(message, -1, null);
    }

    public RemoteCiException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public RemoteCiException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /** HTTP status of the failing call, -1 if no response was received. */
    public int statusCode() { return statusCode; }
}
