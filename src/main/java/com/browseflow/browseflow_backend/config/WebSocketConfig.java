package com.browseflow.browseflow_backend.config;

import com.browseflow.browseflow_backend.engine.RedisWebSocketBridge;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

/**
 * STOMP over WebSocket at {@code /ws}. Clients subscribe to
 * {@code /topic/execution/{executionId}} and {@code /topic/batches}.
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    public static final String REDIS_BRIDGE_PROPERTY = "browseflow.events.redis-bridge";

    @Value("${app.cors.allowed-origins:http://localhost:5173}")
    private String allowedOrigins;

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint("/ws")
                .setAllowedOriginPatterns(CorsConfig.allowedOriginPatterns(allowedOrigins).toArray(String[]::new));
    }

    @Override
    public void configureMessageBroker(MessageBrokerRegistry registry) {
        registry.enableSimpleBroker("/topic");
        registry.setApplicationDestinationPrefixes("/app");
    }

    /**
     * Relays events through Redis so an observer connected to another instance still sees
     * a batch running here. Off unless {@value #REDIS_BRIDGE_PROPERTY} is true.
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(name = REDIS_BRIDGE_PROPERTY, havingValue = "true")
    static class RedisEventRelay {

        @Bean
        RedisWebSocketBridge redisWebSocketBridge(StringRedisTemplate redisTemplate,
                                                  SimpMessagingTemplate messagingTemplate,
                                                  ObjectMapper objectMapper) {
            return new RedisWebSocketBridge(redisTemplate, messagingTemplate, objectMapper);
        }

        @Bean
        RedisMessageListenerContainer redisEventListenerContainer(RedisConnectionFactory connectionFactory,
                                                                  RedisWebSocketBridge bridge) {
            RedisMessageListenerContainer container = new RedisMessageListenerContainer();
            container.setConnectionFactory(connectionFactory);
            container.addMessageListener(bridge, new ChannelTopic(RedisWebSocketBridge.REDIS_CHANNEL));
            return container;
        }
    }
}
