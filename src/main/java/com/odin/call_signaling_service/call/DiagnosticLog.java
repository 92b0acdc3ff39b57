package com.odin.call_signaling_service.call;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.LongSupplier;

import com.odin.call_signaling_service.dto.DiagnosticEvent;
import com.odin.call_signaling_service.enums.DiagnosticSeverity;

import lombok.extern.slf4j.Slf4j;

/**
 * Bounded record of what happened in a call, newest first. Oldest entries are
 * evicted once the capacity is reached.
 */
@Slf4j
public class DiagnosticLog {

    private final String roomId;
    private final String uid;
    private final int capacity;
    private final LongSupplier clock;
    private final DiagnosticSink sink;
    private final Deque<DiagnosticEvent> events = new ArrayDeque<>();
    private long nextId = 1;

    public DiagnosticLog(String roomId, String uid, int capacity, LongSupplier clock, DiagnosticSink sink) {
        this.roomId = roomId;
        this.uid = uid;
        this.capacity = Math.max(1, capacity);
        this.clock = clock;
        this.sink = sink;
    }

    public void info(String source, String message) {
        record(source, DiagnosticSeverity.INFO, message, null);
    }

    public void warn(String source, String message, Throwable error) {
        record(source, DiagnosticSeverity.WARN, message, error == null ? null : describe(error));
    }

    public void error(String source, String message, Throwable error) {
        record(source, DiagnosticSeverity.ERROR, message, error == null ? null : describe(error));
    }

    public void record(String source, DiagnosticSeverity severity, String message, String details) {
        DiagnosticEvent event;
        synchronized (events) {
            event = DiagnosticEvent.builder()
                    .id(nextId++)
                    .timestamp(clock.getAsLong())
                    .roomId(roomId)
                    .uid(uid)
                    .source(source)
                    .message(message)
                    .severity(severity)
                    .details(details)
                    .build();
            events.addFirst(event);
            while (events.size() > capacity) {
                events.removeLast();
            }
        }
        try {
            sink.publish(event);
        } catch (RuntimeException e) {
            log.warn("Diagnostic sink rejected event {}: {}", event.getId(), e.getMessage());
        }
    }

    /**
     * Copy of the retained events, newest first.
     */
    public List<DiagnosticEvent> snapshot() {
        synchronized (events) {
            return new ArrayList<>(events);
        }
    }

    public int size() {
        synchronized (events) {
            return events.size();
        }
    }

    private static String describe(Throwable error) {
        Throwable root = error;
        while (root.getCause() != null && root != root.getCause()
                && (root instanceof CompletionException
                        || root instanceof ExecutionException)) {
            root = root.getCause();
        }
        return root.getClass().getSimpleName() + ": " + root.getMessage();
    }
}
