package com.roadassist.common.security;

import com.roadassist.common.exception.BusinessException;
import com.roadassist.common.exception.ErrorCode;

/**
 * The authenticated caller of an operation, as forwarded by the gateway.
 *
 * @param userId account id of the caller
 * @param role   role claimed in the caller's token
 */
public record Actor(Long userId, Role role) {

    public boolean is(Role expected) {
        return role == expected;
    }

    public boolean isSuperAdmin() {
        return role == Role.SUPER_ADMIN;
    }

    /**
     * Fails with {@link ErrorCode#ACCESS_DENIED} unless the actor has one of the given roles.
     */
    public Actor requireRole(Role... allowed) {
        for (Role candidate : allowed) {
            if (role == candidate) {
                return this;
            }
        }
        throw new BusinessException(ErrorCode.ACCESS_DENIED,
                "Role " + role + " is not allowed to perform this operation");
    }
}
