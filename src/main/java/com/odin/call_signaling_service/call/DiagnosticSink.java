package com.odin.call_signaling_service.call;

import com.odin.call_signaling_service.dto.DiagnosticEvent;

/**
 * Destination for diagnostic events beyond the in-memory log.
 */
@FunctionalInterface
public interface DiagnosticSink {

    DiagnosticSink NOOP = event -> { };

    void publish(DiagnosticEvent event);
}
