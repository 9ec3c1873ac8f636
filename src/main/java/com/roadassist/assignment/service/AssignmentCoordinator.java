package com.roadassist.assignment.service;

import com.roadassist.common.exception.BusinessException;
import com.roadassist.common.exception.ErrorCode;
import com.roadassist.common.outbox.SideEffectOutboxService;
import com.roadassist.common.outbox.SideEffectType;
import com.roadassist.common.security.Actor;
import com.roadassist.common.security.Role;
import com.roadassist.mechanic.entity.Mechanic;
import com.roadassist.mechanic.repository.MechanicRepository;
import com.roadassist.mechanic.service.ScheduleBlock;
import com.roadassist.notification.entity.NotificationType;
import com.roadassist.notification.service.NotificationDraft;
import com.roadassist.notification.service.NotificationFanout;
import com.roadassist.notification.service.RoomKeys;
import com.roadassist.request.dto.RequestEvent;
import com.roadassist.request.dto.ServiceRequestResponse;
import com.roadassist.request.entity.ServiceRequest;
import com.roadassist.request.entity.ServiceStatus;
import com.roadassist.request.entity.ServiceTransitions;
import com.roadassist.request.repository.ServiceRequestRepository;
import com.roadassist.request.service.ServiceRequestService;
import com.roadassist.workshop.entity.Workshop;
import com.roadassist.workshop.service.WorkshopService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Binds a mechanic to a service request.
 *
 * <h3>Assignment flow (one transaction)</h3>
 * <pre>
 *   1. Preconditions, checked before anything is written:
 *      admin's workshop -> mechanic in that workshop -> request routing
 *      -> request unassigned and SUBMITTED -> mechanic AVAILABLE
 *   2. request: mechanicId, workshopId, ASSIGNED, assignedAt
 *      mechanic: IN_SERVICE
 *   3. flush; a concurrent assignment of the same request or mechanic fails here
 *   4. outbox: 2h SERVICE schedule block, NEW_ASSIGNMENT for the mechanic,
 *      SERVICE_UPDATE for the customer
 *   5. after commit: task-assigned to mechanic-{id}, request-assigned to user-{customerId}
 * </pre>
 *
 * <p>Steps 4 and 5 never roll back the assignment. Outbox entries are retried by the relay.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AssignmentCoordinator {

    static final Duration SERVICE_BLOCK_DURATION = Duration.ofHours(2);
    static final String TASK_ASSIGNED_EVENT = "task-assigned";
    static final String REQUEST_ASSIGNED_EVENT = "request-assigned";

    private final ServiceRequestService serviceRequestService;
    private final ServiceRequestRepository serviceRequestRepository;
    private final MechanicRepository mechanicRepository;
    private final WorkshopService workshopService;
    private final SideEffectOutboxService outboxService;
    private final NotificationFanout notificationFanout;

    @Transactional
    public ServiceRequest assign(Long requestId, Long mechanicId, Actor admin) {
        admin.requireRole(Role.WORKSHOP_ADMIN);
        Workshop workshop = workshopService.getWorkshopOfAdmin(admin.userId());
        Mechanic mechanic = mechanicRepository.findById(mechanicId)
                .orElseThrow(() -> new BusinessException(ErrorCode.MECHANIC_NOT_FOUND,
                        "Mechanic #" + mechanicId + " not found"));
        if (!mechanic.belongsTo(workshop.getId())) {
            throw new BusinessException(ErrorCode.MECHANIC_NOT_IN_WORKSHOP,
                    "Mechanic #" + mechanicId + " does not belong to workshop #" + workshop.getId());
        }

        ServiceRequest request = serviceRequestService.getById(requestId);
        if (request.getWorkshopId() != null && !request.isRoutedTo(workshop.getId())) {
            throw new BusinessException(ErrorCode.ACCESS_DENIED,
                    "Service request #" + requestId + " is routed to another workshop");
        }
        if (request.isAssigned()) {
            throw new BusinessException(ErrorCode.REQUEST_ALREADY_ASSIGNED,
                    "Service request #" + requestId + " is already assigned to mechanic #" + request.getMechanicId());
        }
        ServiceTransitions.verify(request.getStatus(), ServiceStatus.ASSIGNED);
        if (!mechanic.isAvailable()) {
            log.warn("Assignment rejected, mechanic not available: requestId={}, mechanicId={}, availability={}",
                    requestId, mechanicId, mechanic.getAvailability());
            throw new BusinessException(ErrorCode.MECHANIC_NOT_AVAILABLE,
                    "Mechanic #" + mechanicId + " is " + mechanic.getAvailability());
        }

        LocalDateTime now = LocalDateTime.now();
        request.assign(mechanic.getId(), workshop.getId(), now);
        mechanic.occupy();
        flush(requestId, mechanicId);
        log.info("Mechanic assigned: requestId={}, mechanicId={}, workshopId={}",
                requestId, mechanicId, workshop.getId());

        enqueueSideEffects(request, mechanic, workshop, now);
        return request;
    }

    private void flush(Long requestId, Long mechanicId) {
        try {
            serviceRequestRepository.flush();
        } catch (ObjectOptimisticLockingFailureException e) {
            log.warn("Concurrent assignment detected: requestId={}, mechanicId={}", requestId, mechanicId);
            throw new BusinessException(ErrorCode.CONCURRENT_MODIFICATION,
                    "Service request #" + requestId + " or mechanic #" + mechanicId + " was modified concurrently", e);
        }
    }

    private void enqueueSideEffects(ServiceRequest request, Mechanic mechanic, Workshop workshop, LocalDateTime now) {
        outboxService.enqueue(SideEffectType.SCHEDULE_BLOCK, request.getId(), new ScheduleBlock(
                mechanic.getId(),
                request.getId(),
                "Service Request #" + request.getId(),
                request.getIssueType() + " - " + request.getVehicleType() + " at " + request.getPickupAddress(),
                now,
                now.plus(SERVICE_BLOCK_DURATION)));

        notificationFanout.notify(new NotificationDraft(mechanic.getUserId(),
                "New Service Assignment",
                "You've been assigned a new " + request.getVehicleType() + " service request in "
                        + request.getPickupAddress(),
                NotificationType.NEW_ASSIGNMENT, request.getId()));
        notificationFanout.notify(new NotificationDraft(request.getCustomerId(),
                "Service Request Update",
                "Your service request has been assigned to a mechanic from " + workshop.getName()
                        + ". They will contact you shortly.",
                NotificationType.SERVICE_UPDATE, request.getId()));

        RequestEvent event = new RequestEvent(ServiceRequestResponse.from(request), null);
        notificationFanout.push(RoomKeys.mechanic(mechanic.getId()), TASK_ASSIGNED_EVENT, event);
        notificationFanout.push(RoomKeys.user(request.getCustomerId()), REQUEST_ASSIGNED_EVENT, event);
    }
}
