package com.odin.call_signaling_service.enums;

public enum ChangeType {
    ADDED,
    MODIFIED,
    REMOVED
}
