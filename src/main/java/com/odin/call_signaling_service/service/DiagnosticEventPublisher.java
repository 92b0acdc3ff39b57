package com.odin.call_signaling_service.service;

import com.odin.call_signaling_service.call.DiagnosticSink;
import com.odin.call_signaling_service.constants.ApplicationConstants;
import com.odin.call_signaling_service.dto.DiagnosticEvent;
import com.odin.call_signaling_service.enums.DiagnosticSeverity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

/**
 * Ships call diagnostics to Kafka, keyed by room so that one room's events
 * stay ordered on a partition. Events below the configured severity are not sent.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = ApplicationConstants.KAFKA_DIAGNOSTICS_ENABLED_PROPERTY, havingValue = "true")
public class DiagnosticEventPublisher implements DiagnosticSink {

    private final KafkaTemplate<String, DiagnosticEvent> kafkaTemplate;

    @Value("${call.diagnostics.kafka.topic:" + ApplicationConstants.KAFKA_DEFAULT_DIAGNOSTICS_TOPIC + "}")
    private String diagnosticsTopic;

    @Value("${call.diagnostics.kafka.min-severity:WARN}")
    private DiagnosticSeverity minSeverity;

    @Override
    public void publish(DiagnosticEvent event) {
        try {
            if (event == null || event.getSeverity() == null) {
                log.warn("publish: Invalid diagnostic event {}", event);
                return;
            }
            if (event.getSeverity().compareTo(minSeverity) < 0) {
                return;
            }
            kafkaTemplate.send(diagnosticsTopic, event.getRoomId(), event);
            log.debug("Published diagnostic event to Kafka - topic={}, room={}, source={}, severity={}",
                    diagnosticsTopic, event.getRoomId(), event.getSource(), event.getSeverity());
        } catch (Exception e) {
            log.error("Failed to publish diagnostic event {} for room={}: {}", event.getId(), event.getRoomId(),
                    e.getMessage(), e);
        }
    }
}
