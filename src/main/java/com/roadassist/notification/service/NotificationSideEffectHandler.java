package com.roadassist.notification.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.roadassist.common.exception.BusinessException;
import com.roadassist.common.exception.ErrorCode;
import com.roadassist.common.outbox.SideEffectHandler;
import com.roadassist.common.outbox.SideEffectType;
import com.roadassist.notification.entity.Notification;
import com.roadassist.notification.repository.NotificationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationSideEffectHandler implements SideEffectHandler {

    private final NotificationRepository notificationRepository;
    private final ObjectMapper objectMapper;

    @Override
    public SideEffectType type() {
        return SideEffectType.NOTIFICATION;
    }

    @Override
    public void apply(String payload) {
        NotificationDraft draft;
        try {
            draft = objectMapper.readValue(payload, NotificationDraft.class);
        } catch (JsonProcessingException e) {
            throw new BusinessException(ErrorCode.SIDE_EFFECT_FAILED, "Unreadable notification payload", e);
        }
        Notification saved = notificationRepository.save(Notification.builder()
                .userId(draft.userId())
                .title(draft.title())
                .message(draft.message())
                .type(draft.type())
                .relatedId(draft.relatedId())
                .build());
        log.debug("Notification stored: id={}, userId={}, type={}", saved.getId(), draft.userId(), draft.type());
    }
}
