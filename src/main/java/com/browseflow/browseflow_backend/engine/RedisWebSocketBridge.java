package com.browseflow.browseflow_backend.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Fans execution events out through Redis Pub/Sub so every instance can deliver them.
 * A batch may run on instance A while the observer's socket is held by instance B.
 * Registered by {@code WebSocketConfig} when the Redis bridge property is enabled.
 */
@Slf4j
@RequiredArgsConstructor
public class RedisWebSocketBridge implements MessageListener {

    public static final String REDIS_CHANNEL = "browseflow:websocket:topic";

    private final StringRedisTemplate redisTemplate;
    private final SimpMessagingTemplate messagingTemplate;
    private final ObjectMapper objectMapper;

    public void publish(String destination, Map<String, Object> payload) {
        try {
            String json = objectMapper.writeValueAsString(new StompMessage(destination, payload));
            redisTemplate.convertAndSend(REDIS_CHANNEL, json);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize event {} for {}", payload.get("type"), destination, e);
        }
    }

    @Override
    public void onMessage(Message message, byte[] pattern) {
        try {
            String body = new String(message.getBody(), StandardCharsets.UTF_8);
            StompMessage stomp = objectMapper.readValue(body, StompMessage.class);
            log.debug("Forwarding {} from Redis to {}", stomp.payload().get("type"), stomp.destination());
            messagingTemplate.convertAndSend(stomp.destination(), stomp.payload());
        } catch (Exception e) {
            log.error("Failed to forward Redis message to WebSocket", e);
        }
    }

    private record StompMessage(String destination, Map<String, Object> payload) {}
}
