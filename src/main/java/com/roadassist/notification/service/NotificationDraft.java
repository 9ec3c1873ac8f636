package com.roadassist.notification.service;

import com.roadassist.notification.entity.NotificationType;

/**
 * A notification waiting in the outbox to be written for its recipient.
 */
public record NotificationDraft(Long userId, String title, String message, NotificationType type, Long relatedId) {
}
