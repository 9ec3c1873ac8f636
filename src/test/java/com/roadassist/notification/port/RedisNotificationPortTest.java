package com.roadassist.notification.port;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;

@ExtendWith(MockitoExtension.class)
class RedisNotificationPortTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    @Mock
    private StringRedisTemplate redisTemplate;

    @Test
    @DisplayName("Events are published as a JSON envelope on the room channel")
    void push_PublishesEnvelope() throws Exception {
        // Given
        RedisNotificationPort port = new RedisNotificationPort(redisTemplate, objectMapper);

        // When
        port.push("mechanic-7", "task-assigned", Map.of("serviceRequestId", 1));

        // Then
        ArgumentCaptor<String> message = ArgumentCaptor.forClass(String.class);
        then(redisTemplate).should().convertAndSend(eq("room:mechanic-7"), message.capture());
        JsonNode envelope = objectMapper.readTree(message.getValue());
        assertThat(envelope.get("event").asText()).isEqualTo("task-assigned");
        assertThat(envelope.get("room").asText()).isEqualTo("mechanic-7");
        assertThat(envelope.get("data").get("serviceRequestId").asInt()).isEqualTo(1);
        assertThat(envelope.get("sentAt").asText()).isNotBlank();
    }

    @Test
    @DisplayName("A Redis outage drops the event without failing the caller")
    void push_RedisDown() {
        RedisNotificationPort port = new RedisNotificationPort(redisTemplate, objectMapper);
        given(redisTemplate.convertAndSend(anyString(), anyString()))
                .willThrow(new RedisConnectionFailureException("connection refused"));

        assertThatCode(() -> port.push("user-10", "status-updated", "data")).doesNotThrowAnyException();
    }
}
