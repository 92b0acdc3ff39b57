package com.odin.call_signaling_service.enums;

public enum DiagnosticSeverity {
    INFO,
    WARN,
    ERROR
}
