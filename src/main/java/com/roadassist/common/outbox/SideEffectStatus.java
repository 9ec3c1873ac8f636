package com.roadassist.common.outbox;

public enum SideEffectStatus {
    PENDING,
    DONE,
    FAILED
}
