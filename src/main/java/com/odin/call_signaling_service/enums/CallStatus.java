package com.odin.call_signaling_service.enums;

/**
 * Coarse call lifecycle presented to the UI layer.
 */
public enum CallStatus {
    IDLE("Not connected"),
    JOINING("Joining…"),
    CONNECTING("Connecting…"),
    CONNECTED("Connected"),
    RECONNECTING("Reconnecting…"),
    FAILED("Connection failed"),
    LEFT("Left the call");

    private final String defaultText;

    CallStatus(String defaultText) {
        this.defaultText = defaultText;
    }

    public String defaultText() {
        return defaultText;
    }
}
