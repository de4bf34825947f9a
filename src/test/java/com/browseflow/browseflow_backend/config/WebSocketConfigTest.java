package com.browseflow.browseflow_backend.config;

import com.browseflow.browseflow_backend.engine.RedisWebSocketBridge;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;

class WebSocketConfigTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(WebSocketConfig.RedisEventRelay.class);

    @Test
    void shouldLeaveRedisRelayOffByDefault() {
        contextRunner.run(context -> assertThat(context).doesNotHaveBean(RedisWebSocketBridge.class));
    }

    @Test
    void shouldLeaveRedisRelayOffWhenDisabled() {
        contextRunner.withPropertyValues(WebSocketConfig.REDIS_BRIDGE_PROPERTY + "=false")
                .run(context -> assertThat(context).doesNotHaveBean(RedisWebSocketBridge.class));
    }
}
