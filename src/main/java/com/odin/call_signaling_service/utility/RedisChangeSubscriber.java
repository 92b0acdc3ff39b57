package com.odin.call_signaling_service.utility;

import java.util.function.Consumer;

import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;

/**
 * Listener on a room's change channel. Parses the change notification and hands
 * it to the owning subscription when its {@code type} matches.
 */
@Slf4j
public class RedisChangeSubscriber implements MessageListener {

    private final ObjectMapper mapper;
    private final String eventType;
    private final Consumer<JsonNode> handler;

    public RedisChangeSubscriber(ObjectMapper mapper, String eventType, Consumer<JsonNode> handler) {
        this.mapper = mapper;
        this.eventType = eventType;
        this.handler = handler;
    }

    @Override
    public void onMessage(Message message, byte[] pattern) {
        JsonNode json;
        try {
            json = mapper.readTree(message.getBody());
        } catch (Exception e) {
            log.error("Failed to parse Redis change notification: {}", e.getMessage(), e);
            return;
        }
        JsonNode type = json.get("type");
        if (type == null || !eventType.equals(type.asText())) {
            return;
        }
        try {
            handler.accept(json);
        } catch (Exception e) {
            log.error("Failed to process Redis {} notification: {}", eventType, e.getMessage(), e);
        }
    }
}
