package com.roadassist.update.service;

import com.roadassist.common.exception.BusinessException;
import com.roadassist.common.exception.ErrorCode;
import com.roadassist.common.security.AccessPolicy;
import com.roadassist.common.security.AccessPolicy.RequestAccess;
import com.roadassist.common.security.Actor;
import com.roadassist.notification.service.NotificationFanout;
import com.roadassist.notification.service.RoomKeys;
import com.roadassist.request.entity.ServiceRequest;
import com.roadassist.request.repository.ServiceRequestRepository;
import com.roadassist.request.service.RequestAccessResolver;
import com.roadassist.update.entity.ServiceUpdate;
import com.roadassist.update.repository.ServiceUpdateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Append-only progress trail of a service request, newest first when read.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ServiceUpdateLog {

    static final String SERVICE_UPDATE_EVENT = "service-update";

    private final ServiceUpdateRepository serviceUpdateRepository;
    private final ServiceRequestRepository serviceRequestRepository;
    private final RequestAccessResolver requestAccessResolver;
    private final AccessPolicy accessPolicy;
    private final NotificationFanout notificationFanout;

    /**
     * Appends a note written by the mechanic currently assigned to the request and pushes it to
     * the customer.
     */
    @Transactional
    public ServiceUpdate append(Long requestId, Actor actor, String message, List<String> images) {
        ServiceRequest request = findRequest(requestId);
        if (!accessPolicy.isAssignedMechanic(actor, requestAccessResolver.accessOf(request))) {
            throw new BusinessException(ErrorCode.ACCESS_DENIED,
                    "Only the mechanic assigned to request #" + requestId + " can post updates");
        }
        ServiceUpdate update = recordNote(requestId, message, images);
        notificationFanout.push(RoomKeys.user(request.getCustomerId()), SERVICE_UPDATE_EVENT, update);
        return update;
    }

    /**
     * Writes a note in the caller's transaction without access checks or push. Used by status
     * changes that carry a message.
     */
    @Transactional
    public ServiceUpdate recordNote(Long requestId, String message, List<String> images) {
        if (message == null || message.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Message is required");
        }
        ServiceUpdate update = serviceUpdateRepository.save(ServiceUpdate.builder()
                .serviceRequestId(requestId)
                .message(message.trim())
                .images(images)
                .build());
        log.info("Service update appended: requestId={}, updateId={}", requestId, update.getId());
        return update;
    }

    public List<ServiceUpdate> list(Long requestId, Actor actor) {
        ServiceRequest request = findRequest(requestId);
        RequestAccess access = requestAccessResolver.accessOf(request);
        if (!accessPolicy.canReadUpdates(actor, access)) {
            throw new BusinessException(ErrorCode.ACCESS_DENIED, "Access denied");
        }
        return serviceUpdateRepository.findByServiceRequestIdOrderByTimestampDescIdDesc(requestId);
    }

    private ServiceRequest findRequest(Long requestId) {
        return serviceRequestRepository.findById(requestId)
                .orElseThrow(() -> new BusinessException(ErrorCode.SERVICE_REQUEST_NOT_FOUND,
                        "Service request #" + requestId + " not found"));
    }
}
