package com.roadassist.common.outbox;

public enum SideEffectType {
    SCHEDULE_BLOCK,
    NOTIFICATION,
    WORKSHOP_ALERT
}
