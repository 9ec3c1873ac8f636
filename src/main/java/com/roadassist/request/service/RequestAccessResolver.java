package com.roadassist.request.service;

import com.roadassist.common.security.AccessPolicy.RequestAccess;
import com.roadassist.mechanic.entity.Mechanic;
import com.roadassist.mechanic.repository.MechanicRepository;
import com.roadassist.request.entity.ServiceRequest;
import com.roadassist.workshop.entity.Workshop;
import com.roadassist.workshop.repository.WorkshopRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Looks up the accounts that own a request: its customer, the assigned mechanic's account and
 * the admin of its workshop.
 */
@Component
@RequiredArgsConstructor
public class RequestAccessResolver {

    private final MechanicRepository mechanicRepository;
    private final WorkshopRepository workshopRepository;

    public RequestAccess accessOf(ServiceRequest request) {
        Long mechanicUserId = request.getMechanicId() == null ? null
                : mechanicRepository.findById(request.getMechanicId()).map(Mechanic::getUserId).orElse(null);
        Long workshopAdminId = request.getWorkshopId() == null ? null
                : workshopRepository.findById(request.getWorkshopId()).map(Workshop::getAdminId).orElse(null);
        return new RequestAccess(request.getCustomerId(), mechanicUserId, workshopAdminId);
    }
}
