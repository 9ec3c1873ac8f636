package com.roadassist.mechanic.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.roadassist.common.exception.BusinessException;
import com.roadassist.common.exception.ErrorCode;
import com.roadassist.common.outbox.SideEffectHandler;
import com.roadassist.common.outbox.SideEffectType;
import com.roadassist.mechanic.entity.MechanicSchedule;
import com.roadassist.mechanic.repository.MechanicScheduleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes the SERVICE block of an assignment. At most one block is kept per mechanic and request.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScheduleSideEffectHandler implements SideEffectHandler {

    private final MechanicScheduleRepository mechanicScheduleRepository;
    private final ObjectMapper objectMapper;

    @Override
    public SideEffectType type() {
        return SideEffectType.SCHEDULE_BLOCK;
    }

    @Override
    public void apply(String payload) {
        ScheduleBlock block;
        try {
            block = objectMapper.readValue(payload, ScheduleBlock.class);
        } catch (JsonProcessingException e) {
            throw new BusinessException(ErrorCode.SIDE_EFFECT_FAILED, "Unreadable schedule block payload", e);
        }
        if (mechanicScheduleRepository.existsByMechanicIdAndServiceIdAndType(
                block.mechanicId(), block.serviceRequestId(), MechanicSchedule.SERVICE_TYPE)) {
            log.info("Schedule block already present, skipping: serviceRequestId={}", block.serviceRequestId());
            return;
        }
        mechanicScheduleRepository.save(MechanicSchedule.builder()
                .mechanicId(block.mechanicId())
                .title(block.title())
                .description(block.description())
                .startTime(block.startTime())
                .endTime(block.endTime())
                .allDay(false)
                .type(MechanicSchedule.SERVICE_TYPE)
                .serviceId(block.serviceRequestId())
                .build());
        log.debug("Schedule block stored: mechanicId={}, serviceRequestId={}", block.mechanicId(), block.serviceRequestId());
    }
}
