package com.odin.call_signaling_service.config;

import com.odin.call_signaling_service.constants.ApplicationConstants;
import com.odin.call_signaling_service.dto.DiagnosticEvent;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.annotation.EnableKafka;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.support.serializer.JsonSerializer;

import java.util.HashMap;
import java.util.Map;

/**
 * Kafka producer for shipping call diagnostics. Only active when
 * {@code call.diagnostics.kafka.enabled=true}.
 */
@Slf4j
@Configuration
@EnableKafka
@ConditionalOnProperty(name = ApplicationConstants.KAFKA_DIAGNOSTICS_ENABLED_PROPERTY, havingValue = "true")
public class KafkaProducerConfig {

    @Value("${spring.kafka.bootstrap-servers:localhost:9092}")
    private String bootstrapServers;

    @Value("${spring.kafka.producer.acks:all}")
    private String acks;

    @Value("${spring.kafka.producer.retries:3}")
    private int retries;

    @Value("${spring.kafka.producer.batch-size:16384}")
    private int batchSize;

    @Value("${spring.kafka.producer.linger-ms:10}")
    private int lingerMs;

    @Value("${call.diagnostics.kafka.topic:" + ApplicationConstants.KAFKA_DEFAULT_DIAGNOSTICS_TOPIC + "}")
    private String diagnosticsTopic;

    @Bean
    public ProducerFactory<String, DiagnosticEvent> diagnosticEventProducerFactory() {
        Map<String, Object> configProps = new HashMap<>();
        configProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        configProps.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        configProps.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, JsonSerializer.class);
        configProps.put(ProducerConfig.ACKS_CONFIG, acks);
        configProps.put(ProducerConfig.RETRIES_CONFIG, retries);
        configProps.put(ProducerConfig.BATCH_SIZE_CONFIG, batchSize);
        configProps.put(ProducerConfig.LINGER_MS_CONFIG, lingerMs);
        configProps.put(ProducerConfig.COMPRESSION_TYPE_CONFIG, "snappy");
        configProps.put(JsonSerializer.ADD_TYPE_INFO_HEADERS, false);

        log.info("Initializing Kafka DiagnosticEvent ProducerFactory with bootstrapServers={}, acks={}, retries={}",
                bootstrapServers, acks, retries);

        return new DefaultKafkaProducerFactory<>(configProps);
    }

    @Bean
    public KafkaTemplate<String, DiagnosticEvent> diagnosticEventKafkaTemplate() {
        KafkaTemplate<String, DiagnosticEvent> template = new KafkaTemplate<>(diagnosticEventProducerFactory());
        template.setDefaultTopic(diagnosticsTopic);
        log.info("DiagnosticEvent KafkaTemplate configured with default topic: {}", diagnosticsTopic);
        return template;
    }
}
