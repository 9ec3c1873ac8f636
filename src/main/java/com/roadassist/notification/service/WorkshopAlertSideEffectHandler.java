package com.roadassist.notification.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.roadassist.common.exception.BusinessException;
import com.roadassist.common.exception.ErrorCode;
import com.roadassist.common.outbox.SideEffectHandler;
import com.roadassist.common.outbox.SideEffectType;
import com.roadassist.notification.port.WorkshopAlertSender;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class WorkshopAlertSideEffectHandler implements SideEffectHandler {

    private final WorkshopAlertSender workshopAlertSender;
    private final ObjectMapper objectMapper;

    @Override
    public SideEffectType type() {
        return SideEffectType.WORKSHOP_ALERT;
    }

    @Override
    public void apply(String payload) {
        WorkshopAlert alert;
        try {
            alert = objectMapper.readValue(payload, WorkshopAlert.class);
        } catch (JsonProcessingException e) {
            throw new BusinessException(ErrorCode.SIDE_EFFECT_FAILED, "Unreadable workshop alert payload", e);
        }
        if (alert.adminEmail() == null || alert.adminEmail().isBlank()) {
            log.info("Workshop has no admin e-mail, alert skipped: workshopId={}, serviceRequestId={}",
                    alert.workshopId(), alert.serviceRequestId());
            return;
        }
        workshopAlertSender.send(alert.adminEmail(), alert.subject(), alert.body());
    }
}
