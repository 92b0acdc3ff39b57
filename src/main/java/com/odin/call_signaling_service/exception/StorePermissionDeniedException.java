package com.odin.call_signaling_service.exception;

public class StorePermissionDeniedException extends SignalingStoreException {

    public StorePermissionDeniedException(String message) {
        super(message);
    }
}
