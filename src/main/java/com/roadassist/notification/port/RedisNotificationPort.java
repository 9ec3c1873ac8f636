package com.roadassist.notification.port;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Publishes room events to Redis Pub/Sub.
 *
 * <p>Each room maps to channel {@code room:<room>}; the socket gateway subscribes with
 * {@code PSUBSCRIBE room:*} and relays the envelope to the sockets that joined the room.</p>
 *
 * <pre>{@code
 * channel: room:mechanic-12
 * {"event":"task-assigned","room":"mechanic-12","data":{...},"sentAt":"2024-05-01T10:15:30Z"}
 * }</pre>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisNotificationPort implements NotificationPort {

    static final String CHANNEL_PREFIX = "room:";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    record PushEnvelope(String event, String room, Object data, String sentAt) {}

    @Override
    public void push(String room, String event, Object data) {
        try {
            String message = objectMapper.writeValueAsString(
                    new PushEnvelope(event, room, data, Instant.now().toString()));
            redisTemplate.convertAndSend(CHANNEL_PREFIX + room, message);
            log.debug("Room event published: room={}, event={}", room, event);
        } catch (JsonProcessingException e) {
            log.warn("Room event not serializable, dropped: room={}, event={}", room, event, e);
        } catch (RuntimeException e) {
            log.warn("Room event publish failed, dropped: room={}, event={}, cause={}", room, event, e.getMessage());
        }
    }
}
