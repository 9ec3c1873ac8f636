package com.roadassist.mechanic.service;

import com.roadassist.common.exception.BusinessException;
import com.roadassist.common.exception.ErrorCode;
import com.roadassist.common.security.AccessPolicy;
import com.roadassist.common.security.AccessPolicy.MechanicAccess;
import com.roadassist.common.security.Actor;
import com.roadassist.common.security.Role;
import com.roadassist.mechanic.entity.Availability;
import com.roadassist.mechanic.entity.Mechanic;
import com.roadassist.mechanic.repository.MechanicRepository;
import com.roadassist.workshop.entity.Workshop;
import com.roadassist.workshop.repository.WorkshopRepository;
import com.roadassist.workshop.service.WorkshopService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class MechanicService {

    private final MechanicRepository mechanicRepository;
    private final WorkshopRepository workshopRepository;
    private final WorkshopService workshopService;
    private final AccessPolicy accessPolicy;

    public Mechanic getMechanic(Long mechanicId) {
        return mechanicRepository.findById(mechanicId)
                .orElseThrow(() -> new BusinessException(ErrorCode.MECHANIC_NOT_FOUND,
                        "Mechanic #" + mechanicId + " not found"));
    }

    public Mechanic getMechanicOfUser(Long userId) {
        return mechanicRepository.findByUserId(userId)
                .orElseThrow(() -> new BusinessException(ErrorCode.MECHANIC_NOT_FOUND,
                        "Mechanic profile not found for user #" + userId));
    }

    public List<Mechanic> getWorkshopMechanics(Actor actor) {
        actor.requireRole(Role.WORKSHOP_ADMIN);
        Workshop workshop = workshopService.getWorkshopOfAdmin(actor.userId());
        return mechanicRepository.findByWorkshopIdOrderByIdAsc(workshop.getId());
    }

    public Availability getAvailability(Long mechanicId) {
        return getMechanic(mechanicId).getAvailability();
    }

    /**
     * Manual availability toggle by the mechanic or the admin of the mechanic's workshop.
     */
    @Transactional
    public Mechanic changeAvailability(Long mechanicId, Availability target, Actor actor) {
        Mechanic mechanic = getMechanic(mechanicId);
        if (!accessPolicy.canManageAvailability(actor, accessOf(mechanic))) {
            throw new BusinessException(ErrorCode.ACCESS_DENIED,
                    "Not authorized to update availability of mechanic #" + mechanicId);
        }
        Availability previous = mechanic.getAvailability();
        mechanic.changeAvailability(target);
        log.info("Mechanic availability changed: mechanicId={}, {} -> {}, by userId={}",
                mechanicId, previous, target, actor.userId());
        return mechanic;
    }

    public MechanicAccess accessOf(Mechanic mechanic) {
        Long adminId = workshopRepository.findById(mechanic.getWorkshopId())
                .map(Workshop::getAdminId)
                .orElse(null);
        return new MechanicAccess(mechanic.getUserId(), adminId);
    }
}
