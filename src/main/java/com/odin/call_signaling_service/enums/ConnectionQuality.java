package com.odin.call_signaling_service.enums;

public enum ConnectionQuality {
    EXCELLENT,
    GOOD,
    POOR,
    DISCONNECTED
}
