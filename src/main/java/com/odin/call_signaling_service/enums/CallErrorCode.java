package com.odin.call_signaling_service.enums;

public enum CallErrorCode {
    MEDIA_ACQUISITION_FAILED,
    RECONNECT_EXHAUSTED,
    JOIN_FAILED,
    REMOVED_FROM_CALL
}
