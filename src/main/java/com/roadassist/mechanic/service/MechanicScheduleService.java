package com.roadassist.mechanic.service;

import com.roadassist.common.exception.BusinessException;
import com.roadassist.common.exception.ErrorCode;
import com.roadassist.common.security.AccessPolicy;
import com.roadassist.common.security.Actor;
import com.roadassist.common.security.Role;
import com.roadassist.mechanic.dto.ScheduleEntryRequest;
import com.roadassist.mechanic.entity.Mechanic;
import com.roadassist.mechanic.entity.MechanicSchedule;
import com.roadassist.mechanic.repository.MechanicScheduleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Mechanic calendars. Viewing is open to the mechanic, the workshop admin and super admins;
 * manual entries are managed by the mechanic alone. SERVICE blocks belong to assignments and
 * are never created, moved or deleted through this service.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class MechanicScheduleService {

    private final MechanicScheduleRepository mechanicScheduleRepository;
    private final MechanicService mechanicService;
    private final AccessPolicy accessPolicy;

    public List<MechanicSchedule> getSchedule(Long mechanicId, LocalDateTime from, LocalDateTime to, Actor actor) {
        Mechanic mechanic = mechanicService.getMechanic(mechanicId);
        if (!accessPolicy.canViewSchedule(actor, mechanicService.accessOf(mechanic))) {
            throw new BusinessException(ErrorCode.ACCESS_DENIED, "Not authorized to view this schedule");
        }
        if (from != null && to != null) {
            return mechanicScheduleRepository
                    .findByMechanicIdAndStartTimeGreaterThanEqualAndEndTimeLessThanEqualOrderByStartTimeAsc(
                            mechanicId, from, to);
        }
        if (from != null) {
            return mechanicScheduleRepository.findByMechanicIdAndStartTimeGreaterThanEqualOrderByStartTimeAsc(mechanicId, from);
        }
        if (to != null) {
            return mechanicScheduleRepository.findByMechanicIdAndEndTimeLessThanEqualOrderByStartTimeAsc(mechanicId, to);
        }
        return mechanicScheduleRepository.findByMechanicIdOrderByStartTimeAsc(mechanicId);
    }

    @Transactional
    public MechanicSchedule createEntry(ScheduleEntryRequest request, Actor actor) {
        Mechanic mechanic = currentMechanic(actor);
        validateManualEntry(request);
        MechanicSchedule entry = mechanicScheduleRepository.save(MechanicSchedule.builder()
                .mechanicId(mechanic.getId())
                .title(request.title())
                .description(request.description())
                .startTime(request.startTime())
                .endTime(request.endTime())
                .allDay(request.allDay())
                .type(request.type())
                .build());
        log.info("Schedule entry created: id={}, mechanicId={}", entry.getId(), mechanic.getId());
        return entry;
    }

    @Transactional
    public MechanicSchedule updateEntry(Long entryId, ScheduleEntryRequest request, Actor actor) {
        MechanicSchedule entry = ownEntry(entryId, actor);
        validateManualEntry(request);
        entry.update(request.title(), request.description(), request.startTime(), request.endTime(),
                request.allDay(), request.type());
        return entry;
    }

    @Transactional
    public void deleteEntry(Long entryId, Actor actor) {
        MechanicSchedule entry = ownEntry(entryId, actor);
        mechanicScheduleRepository.delete(entry);
        log.info("Schedule entry deleted: id={}, mechanicId={}", entryId, entry.getMechanicId());
    }

    private MechanicSchedule ownEntry(Long entryId, Actor actor) {
        MechanicSchedule entry = mechanicScheduleRepository.findById(entryId)
                .orElseThrow(() -> new BusinessException(ErrorCode.SCHEDULE_NOT_FOUND));
        Mechanic mechanic = currentMechanic(actor);
        if (!mechanic.getId().equals(entry.getMechanicId())) {
            throw new BusinessException(ErrorCode.ACCESS_DENIED, "Not authorized to change this schedule entry");
        }
        if (entry.isServiceBlock()) {
            throw new BusinessException(ErrorCode.ACCESS_DENIED, "Service blocks follow their assignment");
        }
        return entry;
    }

    private Mechanic currentMechanic(Actor actor) {
        if (!actor.is(Role.MECHANIC)) {
            throw new BusinessException(ErrorCode.ACCESS_DENIED, "Only mechanics can manage schedule entries");
        }
        return mechanicService.getMechanicOfUser(actor.userId());
    }

    private void validateManualEntry(ScheduleEntryRequest request) {
        if (MechanicSchedule.SERVICE_TYPE.equalsIgnoreCase(request.type().trim()) || request.serviceId() != null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Service blocks cannot be entered manually");
        }
        if (!request.endTime().isAfter(request.startTime())) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "endTime must be after startTime");
        }
    }
}
