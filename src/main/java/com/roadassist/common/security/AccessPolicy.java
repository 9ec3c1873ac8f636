package com.roadassist.common.security;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Central access decisions for service requests, their update trail and mechanic calendars.
 *
 * <p>Every method is a pure function of the actor and a small context record, so callers
 * resolve ownership (customer, assigned mechanic's account, workshop admin) first and ask
 * afterwards.</p>
 */
@Component
public class AccessPolicy {

    /**
     * Ownership facts about one service request.
     *
     * @param customerId             account that submitted the request
     * @param assignedMechanicUserId account of the assigned mechanic, null while unassigned
     * @param workshopAdminId        admin of the request's workshop, null while not routed
     */
    public record RequestAccess(Long customerId, Long assignedMechanicUserId, Long workshopAdminId) {
    }

    /**
     * Ownership facts about one mechanic.
     *
     * @param mechanicUserId  the mechanic's own account
     * @param workshopAdminId admin of the workshop employing the mechanic
     */
    public record MechanicAccess(Long mechanicUserId, Long workshopAdminId) {
    }

    private final boolean strictUpdateReads;

    public AccessPolicy(@Value("${roadassist.access.strict-update-reads:false}") boolean strictUpdateReads) {
        this.strictUpdateReads = strictUpdateReads;
    }

    public boolean canViewRequest(Actor actor, RequestAccess request) {
        if (actor.isSuperAdmin()) {
            return true;
        }
        return switch (actor.role()) {
            case END_USER -> Objects.equals(actor.userId(), request.customerId());
            case MECHANIC -> isAssignedMechanic(actor, request);
            // unassigned requests are visible to every admin so they can be picked up
            case WORKSHOP_ADMIN -> request.workshopAdminId() == null
                    || Objects.equals(actor.userId(), request.workshopAdminId());
            default -> false;
        };
    }

    public boolean isAssignedMechanic(Actor actor, RequestAccess request) {
        return actor.is(Role.MECHANIC) && request.assignedMechanicUserId() != null
                && request.assignedMechanicUserId().equals(actor.userId());
    }

    public boolean canCancel(Actor actor, RequestAccess request) {
        if (actor.isSuperAdmin() || isAssignedMechanic(actor, request)) {
            return true;
        }
        if (actor.is(Role.END_USER)) {
            return Objects.equals(actor.userId(), request.customerId());
        }
        return actor.is(Role.WORKSHOP_ADMIN) && request.workshopAdminId() != null
                && request.workshopAdminId().equals(actor.userId());
    }

    /**
     * Update trail reads. The default keeps the historical broad rule: the owning customer,
     * any mechanic and any workshop admin. Strict mode applies {@link #canViewRequest}.
     */
    public boolean canReadUpdates(Actor actor, RequestAccess request) {
        if (strictUpdateReads) {
            return canViewRequest(actor, request);
        }
        return switch (actor.role()) {
            case END_USER -> Objects.equals(actor.userId(), request.customerId());
            case MECHANIC, WORKSHOP_ADMIN, SUPER_ADMIN -> true;
        };
    }

    public boolean canViewSchedule(Actor actor, MechanicAccess mechanic) {
        return actor.isSuperAdmin() || isSelfOrOwningAdmin(actor, mechanic);
    }

    public boolean canManageAvailability(Actor actor, MechanicAccess mechanic) {
        return isSelfOrOwningAdmin(actor, mechanic);
    }

    public boolean isSelf(Actor actor, MechanicAccess mechanic) {
        return actor.is(Role.MECHANIC) && Objects.equals(actor.userId(), mechanic.mechanicUserId());
    }

    private boolean isSelfOrOwningAdmin(Actor actor, MechanicAccess mechanic) {
        if (isSelf(actor, mechanic)) {
            return true;
        }
        return actor.is(Role.WORKSHOP_ADMIN) && mechanic.workshopAdminId() != null
                && mechanic.workshopAdminId().equals(actor.userId());
    }
}
