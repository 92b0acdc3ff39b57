package com.odin.call_signaling_service.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.odin.call_signaling_service.constants.ApplicationConstants;
import com.odin.call_signaling_service.repo.InMemorySignalingRepository;
import com.odin.call_signaling_service.repo.SignalingRepository;

/**
 * Single-process store for local runs where every endpoint lives in this JVM.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = ApplicationConstants.STORE_TYPE_PROPERTY,
        havingValue = ApplicationConstants.STORE_TYPE_MEMORY)
public class InMemoryStoreConfig {

    @Bean
    public SignalingRepository signalingRepository(ObjectMapper objectMapper) {
        log.info("Using in-memory signaling store");
        return new InMemorySignalingRepository(objectMapper);
    }
}
