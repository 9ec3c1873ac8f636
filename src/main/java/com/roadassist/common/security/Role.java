package com.roadassist.common.security;

public enum Role {
    END_USER,
    WORKSHOP_ADMIN,
    MECHANIC,
    SUPER_ADMIN
}
