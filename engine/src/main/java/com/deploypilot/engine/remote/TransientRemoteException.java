package com.deploypilot.engine.remote;

/**
 * Remote failure that may succeed if repeated: I/O errors, HTTP 429 and 5xx.
 * This is the only exception type the trigger retry loop retries.
 */
public class TransientRemoteException extends RemoteCiException {

    public TransientRemoteException(String message, Throwable cause) {
        super(message, cause);
    }

    public TransientRemoteException(String message, int statusCode) {
        super(message, statusCode, null);
    }
}
