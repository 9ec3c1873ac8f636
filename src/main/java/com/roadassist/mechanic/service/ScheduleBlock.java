package com.roadassist.mechanic.service;

import java.time.LocalDateTime;

/**
 * Calendar block reserved for an assignment. Times are fixed when the assignment commits so a
 * delayed or replayed write still records the original slot.
 */
public record ScheduleBlock(Long mechanicId, Long serviceRequestId, String title, String description,
                            LocalDateTime startTime, LocalDateTime endTime) {
}
