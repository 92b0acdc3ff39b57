package com.odin.call_signaling_service.exception;

public class NegotiationException extends RuntimeException {

    public NegotiationException(String message) {
        super(message);
    }

    public NegotiationException(String message, Throwable cause) {
        super(message, cause);
    }
}
