package com.odin.call_signaling_service.transport;

public enum MediaKind {
    AUDIO,
    VIDEO,
    SCREEN
}
