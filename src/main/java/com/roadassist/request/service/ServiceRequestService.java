package com.roadassist.request.service;

import com.roadassist.common.exception.BusinessException;
import com.roadassist.common.exception.ErrorCode;
import com.roadassist.common.security.AccessPolicy;
import com.roadassist.common.security.AccessPolicy.RequestAccess;
import com.roadassist.common.security.Actor;
import com.roadassist.common.security.Role;
import com.roadassist.mechanic.entity.Mechanic;
import com.roadassist.mechanic.repository.MechanicRepository;
import com.roadassist.mechanic.service.MechanicService;
import com.roadassist.notification.entity.NotificationType;
import com.roadassist.notification.service.NotificationDraft;
import com.roadassist.notification.service.NotificationFanout;
import com.roadassist.notification.service.RoomKeys;
import com.roadassist.notification.service.WorkshopAlert;
import com.roadassist.request.dto.CreateServiceRequest;
import com.roadassist.request.dto.RequestEvent;
import com.roadassist.request.dto.ServiceRequestResponse;
import com.roadassist.request.dto.StatusChange;
import com.roadassist.request.entity.ServiceRequest;
import com.roadassist.request.entity.ServiceStatus;
import com.roadassist.request.entity.ServiceTransitions;
import com.roadassist.request.repository.ServiceRequestRepository;
import com.roadassist.update.service.ServiceUpdateLog;
import com.roadassist.workshop.entity.Workshop;
import com.roadassist.workshop.service.WorkshopService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Owns the service request state machine.
 *
 * <h3>Who may move a request</h3>
 * <ul>
 *   <li>ASSIGNED: only {@code AssignmentCoordinator}, never through {@link #transition}</li>
 *   <li>IN_PROGRESS, REACHED, COMPLETED: the assigned mechanic</li>
 *   <li>CANCELLED: the assigned mechanic, the customer, the workshop admin or a super admin</li>
 * </ul>
 *
 * <p>Every change is committed together with its outbox entries; room pushes go out after
 * commit. Re-applying the current status is a no-op.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ServiceRequestService {

    static final String NEW_REQUEST_EVENT = "new-service-request";
    static final String STATUS_UPDATED_EVENT = "status-updated";
    static final String TASK_CANCELLED_EVENT = "task-cancelled";
    static final int MIN_DESCRIPTION_LENGTH = 10;
    static final int DEFAULT_PAGE_SIZE = 20;

    private final ServiceRequestRepository serviceRequestRepository;
    private final MechanicRepository mechanicRepository;
    private final MechanicService mechanicService;
    private final WorkshopService workshopService;
    private final ServiceUpdateLog serviceUpdateLog;
    private final NotificationFanout notificationFanout;
    private final RequestAccessResolver requestAccessResolver;
    private final AccessPolicy accessPolicy;

    /**
     * Submits a new request for the calling customer.
     *
     * <p>Unrouted requests are broadcast to the {@code unassigned-requests} room. A request routed
     * to a workshop notifies that workshop's admin (inbox, room push and e-mail alert).</p>
     */
    @Transactional
    public ServiceRequest create(CreateServiceRequest payload, Actor actor) {
        actor.requireRole(Role.END_USER);
        validate(payload);
        Workshop workshop = payload.workshopId() != null
                ? workshopService.getWorkshop(payload.workshopId())
                : null;

        ServiceRequest request = serviceRequestRepository.save(ServiceRequest.builder()
                .customerId(actor.userId())
                .workshopId(workshop != null ? workshop.getId() : null)
                .vehicleType(payload.vehicleType().trim())
                .vehicleMake(payload.vehicleMake())
                .vehicleModel(payload.vehicleModel())
                .issueType(payload.issueType().trim())
                .description(payload.description().trim())
                .urgency(payload.urgency())
                .pickupAddress(payload.pickupAddress().trim())
                .latitude(payload.latitude())
                .longitude(payload.longitude())
                .images(payload.images())
                .build());
        log.info("Service request created: id={}, customerId={}, workshopId={}, urgency={}",
                request.getId(), actor.userId(), request.getWorkshopId(), request.getUrgency());

        RequestEvent event = new RequestEvent(ServiceRequestResponse.from(request), null);
        if (workshop == null) {
            notificationFanout.push(RoomKeys.UNASSIGNED_REQUESTS, NEW_REQUEST_EVENT, event);
            return request;
        }

        notificationFanout.notify(new NotificationDraft(workshop.getAdminId(),
                "New Service Request",
                "New " + request.getIssueType() + " request (" + request.getUrgency() + " priority) at "
                        + request.getPickupAddress(),
                NotificationType.NEW_REQUEST, request.getId()));
        notificationFanout.push(RoomKeys.user(workshop.getAdminId()), NEW_REQUEST_EVENT, event);
        notificationFanout.alertWorkshop(new WorkshopAlert(workshop.getId(), workshop.getName(),
                workshop.getAdminEmail(), request.getId(), request.getVehicleType(), request.getVehicleMake(),
                request.getVehicleModel(), request.getIssueType(), request.getUrgency().name(),
                request.getPickupAddress(), request.getDescription()));
        return request;
    }

    /**
     * Moves a request along the status table on behalf of the actor.
     *
     * <p>Edges outside the table fail with a state conflict before any permission check.
     * Re-applying the current status is a no-op once the actor is authorized: the costs and
     * message carried by the change are ignored and nothing is fanned out.</p>
     */
    @Transactional
    public ServiceRequest transition(Long requestId, StatusChange change, Actor actor) {
        ServiceRequest request = getById(requestId);
        ServiceStatus target = change.status();
        ServiceStatus previous = request.getStatus();
        if (previous != target) {
            ServiceTransitions.verify(previous, target);
        }
        if (target == ServiceStatus.SUBMITTED || target == ServiceStatus.ASSIGNED) {
            throw new BusinessException(ErrorCode.ACCESS_DENIED, target + " cannot be set through a status update");
        }
        authorizeTransition(request, target, actor, requestAccessResolver.accessOf(request));

        if (previous == target) {
            log.debug("Status already applied, ignoring: requestId={}, status={}", requestId, target);
            return request;
        }

        request.changeStatus(target, LocalDateTime.now());
        request.updateCosts(change.estimatedCost(), change.actualCost());
        if (change.message() != null && !change.message().isBlank()) {
            serviceUpdateLog.recordNote(requestId, change.message(), List.of());
        }
        Mechanic releasedMechanic = releaseMechanicIfDone(request, target);
        flush(requestId);
        log.info("Service request status changed: id={}, {} -> {}, by userId={}",
                requestId, previous, target, actor.userId());

        fanOutStatusChange(request, change.message(), releasedMechanic);
        return request;
    }

    public ServiceRequest getById(Long requestId) {
        return serviceRequestRepository.findById(requestId)
                .orElseThrow(() -> new BusinessException(ErrorCode.SERVICE_REQUEST_NOT_FOUND,
                        "Service request #" + requestId + " not found"));
    }

    public ServiceRequest getRequest(Long requestId, Actor actor) {
        ServiceRequest request = getById(requestId);
        if (!accessPolicy.canViewRequest(actor, requestAccessResolver.accessOf(request))) {
            throw new BusinessException(ErrorCode.ACCESS_DENIED, "Access denied");
        }
        return request;
    }

    public List<ServiceRequest> getCustomerRequests(Actor actor) {
        return serviceRequestRepository.findByCustomerIdOrderByCreatedAtDesc(actor.userId());
    }

    public List<ServiceRequest> getMechanicTasks(Actor actor) {
        actor.requireRole(Role.MECHANIC);
        Mechanic mechanic = mechanicService.getMechanicOfUser(actor.userId());
        return serviceRequestRepository.findByMechanicIdOrderByCreatedAtDesc(mechanic.getId());
    }

    /**
     * Work queue. Admins see their workshop's requests plus every unassigned request, mechanics
     * see their own tasks. Offsets are rounded down to a multiple of the limit.
     */
    public List<ServiceRequest> getWorkshopRequests(Actor actor, ServiceStatus status, Integer limit, Integer offset) {
        actor.requireRole(Role.WORKSHOP_ADMIN, Role.MECHANIC);
        if (actor.is(Role.MECHANIC)) {
            return getMechanicTasks(actor).stream()
                    .filter(r -> status == null || r.getStatus() == status)
                    .toList();
        }
        Workshop workshop = workshopService.getWorkshopOfAdmin(actor.userId());
        int size = limit == null || limit <= 0 ? DEFAULT_PAGE_SIZE : limit;
        int skip = offset == null || offset < 0 ? 0 : offset;
        PageRequest page = PageRequest.of(skip / size, size);
        return status == null
                ? serviceRequestRepository.findWorkshopQueue(workshop.getId(), page)
                : serviceRequestRepository.findWorkshopQueueByStatus(workshop.getId(), status, page);
    }

    private void authorizeTransition(ServiceRequest request, ServiceStatus target, Actor actor, RequestAccess access) {
        switch (target) {
            case IN_PROGRESS, REACHED, COMPLETED -> {
                if (!accessPolicy.isAssignedMechanic(actor, access)) {
                    throw new BusinessException(ErrorCode.ACCESS_DENIED,
                            "Service request #" + request.getId() + " is not assigned to you");
                }
            }
            case CANCELLED -> {
                if (!accessPolicy.canCancel(actor, access)) {
                    throw new BusinessException(ErrorCode.ACCESS_DENIED,
                            "Not authorized to cancel service request #" + request.getId());
                }
            }
            default -> throw new BusinessException(ErrorCode.ACCESS_DENIED,
                    target + " cannot be set through a status update");
        }
    }

    private Mechanic releaseMechanicIfDone(ServiceRequest request, ServiceStatus target) {
        if (!target.isTerminal() || !request.isAssigned()) {
            return null;
        }
        Mechanic mechanic = mechanicRepository.findById(request.getMechanicId()).orElse(null);
        if (mechanic != null) {
            mechanic.release();
            log.info("Mechanic released: mechanicId={}, requestId={}", mechanic.getId(), request.getId());
        }
        return mechanic;
    }

    private void flush(Long requestId) {
        try {
            serviceRequestRepository.flush();
        } catch (ObjectOptimisticLockingFailureException e) {
            throw new BusinessException(ErrorCode.CONCURRENT_MODIFICATION,
                    "Service request #" + requestId + " was modified concurrently", e);
        }
    }

    private void fanOutStatusChange(ServiceRequest request, String message, Mechanic assignedMechanic) {
        ServiceStatus status = request.getStatus();
        RequestEvent event = new RequestEvent(ServiceRequestResponse.from(request), message);
        boolean cancelled = status == ServiceStatus.CANCELLED;

        notificationFanout.notify(new NotificationDraft(request.getCustomerId(),
                cancelled ? "Service Request Cancelled" : "Service Request Update",
                message != null && !message.isBlank() ? message : describe(status),
                cancelled ? NotificationType.REQUEST_CANCELLED : NotificationType.SERVICE_UPDATE,
                request.getId()));
        notificationFanout.push(RoomKeys.user(request.getCustomerId()), STATUS_UPDATED_EVENT, event);

        if (cancelled && assignedMechanic != null) {
            notificationFanout.notify(new NotificationDraft(assignedMechanic.getUserId(),
                    "Service Request Cancelled",
                    "Service request #" + request.getId() + " at " + request.getPickupAddress() + " was cancelled",
                    NotificationType.REQUEST_CANCELLED, request.getId()));
            notificationFanout.push(RoomKeys.mechanic(assignedMechanic.getId()), TASK_CANCELLED_EVENT, event);
        }
    }

    private static String describe(ServiceStatus status) {
        return switch (status) {
            case IN_PROGRESS -> "Your mechanic is on the way";
            case REACHED -> "Your mechanic has reached your location";
            case COMPLETED -> "Your service request has been completed";
            case CANCELLED -> "Your service request has been cancelled";
            default -> "Your service request is now " + status;
        };
    }

    private void validate(CreateServiceRequest payload) {
        requireText(payload.vehicleType(), "Vehicle type is required");
        requireText(payload.issueType(), "Issue type is required");
        requireText(payload.pickupAddress(), "Pickup address is required");
        if (payload.description() == null || payload.description().trim().length() < MIN_DESCRIPTION_LENGTH) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "Description must be at least " + MIN_DESCRIPTION_LENGTH + " characters");
        }
        Double lat = payload.latitude();
        Double lon = payload.longitude();
        if (lat == null || lon == null || lat < -90 || lat > 90 || lon < -180 || lon > 180) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Valid latitude and longitude are required");
        }
    }

    private static void requireText(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, message);
        }
    }
}
