package com.roadassist.notification.service;

import com.roadassist.common.outbox.SideEffectOutboxService;
import com.roadassist.common.outbox.SideEffectType;
import com.roadassist.common.transaction.AfterCommitExecutor;
import com.roadassist.notification.port.NotificationPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Delivers one state-change event over both channels.
 *
 * <ul>
 *   <li><b>Durable</b>: a {@link NotificationDraft} is written to the outbox inside the caller's
 *       transaction; the stored notification is the source of truth.</li>
 *   <li><b>Real-time</b>: a room push handed to {@link NotificationPort} after the caller's
 *       transaction commits, on the push executor. Dropped events are not replayed.</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationFanout {

    private final SideEffectOutboxService outboxService;
    private final AfterCommitExecutor afterCommitExecutor;
    private final NotificationPort notificationPort;

    public void notify(NotificationDraft draft) {
        outboxService.enqueue(SideEffectType.NOTIFICATION, draft.relatedId(), draft);
    }

    public void alertWorkshop(WorkshopAlert alert) {
        outboxService.enqueue(SideEffectType.WORKSHOP_ALERT, alert.serviceRequestId(), alert);
    }

    public void push(String room, String event, Object data) {
        afterCommitExecutor.execute(() -> {
            try {
                notificationPort.push(room, event, data);
            } catch (RuntimeException e) {
                log.warn("Push failed, dropped: room={}, event={}, cause={}", room, event, e.getMessage());
            }
        });
    }
}
