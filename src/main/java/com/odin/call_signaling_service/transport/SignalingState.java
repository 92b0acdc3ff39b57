package com.odin.call_signaling_service.transport;

public enum SignalingState {
    NEW,
    STABLE,
    HAVE_LOCAL_OFFER,
    HAVE_REMOTE_OFFER,
    CLOSED;

    /**
     * No offer/answer exchange is half-way through.
     */
    public boolean isIdle() {
        return this == NEW || this == STABLE;
    }
}
