package com.roadassist.notification.service;

import com.roadassist.common.exception.BusinessException;
import com.roadassist.common.exception.ErrorCode;
import com.roadassist.common.security.Actor;
import com.roadassist.notification.entity.Notification;
import com.roadassist.notification.repository.NotificationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * The caller's notification inbox.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class NotificationService {

    static final int DEFAULT_LIMIT = 50;
    static final int MAX_LIMIT = 200;

    private final NotificationRepository notificationRepository;

    public List<Notification> getNotifications(Actor actor, boolean unreadOnly, Integer limit) {
        PageRequest page = PageRequest.of(0, normalizeLimit(limit));
        return unreadOnly
                ? notificationRepository.findByUserIdAndReadFalseOrderByCreatedAtDesc(actor.userId(), page)
                : notificationRepository.findByUserIdOrderByCreatedAtDesc(actor.userId(), page);
    }

    public long getUnreadCount(Actor actor) {
        return notificationRepository.countByUserIdAndReadFalse(actor.userId());
    }

    /**
     * Marks one notification read. Notifications of other users look like missing ones.
     */
    @Transactional
    public Notification markRead(Long notificationId, Actor actor) {
        Notification notification = notificationRepository.findById(notificationId)
                .filter(n -> n.isOwnedBy(actor.userId()))
                .orElseThrow(() -> new BusinessException(ErrorCode.NOTIFICATION_NOT_FOUND));
        notification.markRead();
        return notification;
    }

    @Transactional
    public int markAllRead(Actor actor) {
        int updated = notificationRepository.markAllReadByUserId(actor.userId());
        log.debug("Notifications marked read: userId={}, count={}", actor.userId(), updated);
        return updated;
    }

    private int normalizeLimit(Integer limit) {
        if (limit == null || limit <= 0) {
            return DEFAULT_LIMIT;
        }
        return Math.min(limit, MAX_LIMIT);
    }
}
