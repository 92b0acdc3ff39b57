package com.odin.call_signaling_service.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.odin.call_signaling_service.constants.ApplicationConstants;
import com.odin.call_signaling_service.repo.RedisSignalingRepository;
import com.odin.call_signaling_service.repo.SignalingRepository;

@Slf4j
@Configuration
@ConditionalOnProperty(name = ApplicationConstants.STORE_TYPE_PROPERTY,
        havingValue = ApplicationConstants.STORE_TYPE_REDIS, matchIfMissing = true)
public class RedisConfig {

    @Value("${spring.data.redis.host:localhost}")
    private String redisHost;

    @Value("${spring.data.redis.port:6379}")
    private int redisPort;

    @Value("${call.store.redis.io-threads:4}")
    private int ioThreads;

    @Bean
    public RedisConnectionFactory redisConnectionFactory() {
        log.info("Initializing RedisConnectionFactory with host={} and port={}", redisHost, redisPort);
        return new LettuceConnectionFactory(redisHost, redisPort);
    }

    @Bean
    public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory factory) {
        log.info("Creating StringRedisTemplate with RedisConnectionFactory: {}", factory.getClass().getSimpleName());
        return new StringRedisTemplate(factory);
    }

    /**
     * Room channels are added and removed by the repository as sessions subscribe.
     */
    @Bean
    public RedisMessageListenerContainer redisMessageListenerContainer(RedisConnectionFactory connectionFactory) {
        var container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        return container;
    }

    /**
     * Blocking Redis calls run here so that no call's event loop ever waits on I/O.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService signalingStoreExecutor() {
        AtomicInteger counter = new AtomicInteger();
        log.info("Creating signaling store executor with {} threads", ioThreads);
        return Executors.newFixedThreadPool(ioThreads, r -> {
            Thread thread = new Thread(r, "signaling-store-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public SignalingRepository signalingRepository(StringRedisTemplate stringRedisTemplate,
            RedisMessageListenerContainer redisMessageListenerContainer, ObjectMapper objectMapper,
            ExecutorService signalingStoreExecutor) {
        log.info("Using Redis signaling store at {}:{}", redisHost, redisPort);
        return new RedisSignalingRepository(stringRedisTemplate, redisMessageListenerContainer, objectMapper,
                signalingStoreExecutor);
    }
}
