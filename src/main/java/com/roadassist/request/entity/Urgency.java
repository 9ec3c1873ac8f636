package com.roadassist.request.entity;

public enum Urgency {
    LOW,
    MEDIUM,
    HIGH
}
