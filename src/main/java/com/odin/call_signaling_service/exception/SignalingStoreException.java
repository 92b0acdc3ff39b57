package com.odin.call_signaling_service.exception;

/**
 * Failure of the shared signaling store (read, write, subscription).
 */
public class SignalingStoreException extends RuntimeException {

    public SignalingStoreException(String message) {
        super(message);
    }

    public SignalingStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
