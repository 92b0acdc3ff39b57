package com.odin.call_signaling_service.service;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.kafka.KafkaException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.test.util.ReflectionTestUtils;

import com.odin.call_signaling_service.dto.DiagnosticEvent;
import com.odin.call_signaling_service.enums.DiagnosticSeverity;

class DiagnosticEventPublisherTest {

    private KafkaTemplate<String, DiagnosticEvent> kafkaTemplate;
    private DiagnosticEventPublisher publisher;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        kafkaTemplate = mock(KafkaTemplate.class);
        publisher = new DiagnosticEventPublisher(kafkaTemplate);
        ReflectionTestUtils.setField(publisher, "diagnosticsTopic", "call.diagnostics");
        ReflectionTestUtils.setField(publisher, "minSeverity", DiagnosticSeverity.WARN);
    }

    private static DiagnosticEvent event(DiagnosticSeverity severity) {
        return DiagnosticEvent.builder()
                .id(1)
                .timestamp(1_000L)
                .roomId("room-1")
                .uid("alice")
                .source("health")
                .message("disconnected")
                .severity(severity)
                .build();
    }

    @Test
    void warningsAreSentKeyedByRoom() {
        DiagnosticEvent event = event(DiagnosticSeverity.WARN);

        publisher.publish(event);

        verify(kafkaTemplate).send("call.diagnostics", "room-1", event);
    }

    @Test
    void eventsBelowTheThresholdStayLocal() {
        publisher.publish(event(DiagnosticSeverity.INFO));
        publisher.publish(null);

        verify(kafkaTemplate, never()).send(anyString(), anyString(), any());
    }

    @Test
    void brokerFailureDoesNotReachTheCaller() {
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenThrow(new KafkaException("broker unavailable"));

        assertThatCode(() -> publisher.publish(event(DiagnosticSeverity.ERROR))).doesNotThrowAnyException();
    }
}
