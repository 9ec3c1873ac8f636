package com.roadassist.common.outbox;

import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Applies pending side effects, one transaction per attempt.
 *
 * <p>Two paths feed the relay: the post-commit dispatch scheduled by
 * {@link SideEffectOutboxService#enqueue} and the fixed-delay sweep below, which retries
 * whatever is still pending. A concurrent attempt on the same entry loses on the entry's
 * version column and its effect rolls back with it.</p>
 */
@Slf4j
@Component
public class SideEffectRelay {

    private static final long SWEEP_GRACE_SECONDS = 5;

    private final SideEffectEntryRepository sideEffectEntryRepository;
    private final Map<SideEffectType, SideEffectHandler> handlers = new EnumMap<>(SideEffectType.class);
    private final TransactionTemplate transactionTemplate;
    private final int maxAttempts;

    public SideEffectRelay(SideEffectEntryRepository sideEffectEntryRepository,
                           List<SideEffectHandler> handlers,
                           PlatformTransactionManager transactionManager,
                           @Value("${roadassist.outbox.max-attempts:5}") int maxAttempts) {
        this.sideEffectEntryRepository = sideEffectEntryRepository;
        for (SideEffectHandler handler : handlers) {
            this.handlers.put(handler.type(), handler);
        }
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.maxAttempts = maxAttempts;
    }

    @Scheduled(fixedDelayString = "${roadassist.outbox.relay-delay-ms:5000}")
    @SchedulerLock(name = "SideEffectRelay_processPending", lockAtMostFor = "30s", lockAtLeastFor = "2s")
    public void processPending() {
        List<SideEffectEntry> pending = sideEffectEntryRepository
                .findTop100ByStatusAndCreatedAtBeforeOrderByCreatedAtAsc(
                        SideEffectStatus.PENDING, LocalDateTime.now().minusSeconds(SWEEP_GRACE_SECONDS));
        if (!pending.isEmpty()) {
            log.info("Retrying pending side effects: count={}", pending.size());
        }
        for (SideEffectEntry entry : pending) {
            process(entry.getId());
        }
    }

    /**
     * Runs one attempt for the entry. Never throws: failures are recorded on the entry.
     */
    public void process(Long entryId) {
        try {
            transactionTemplate.executeWithoutResult(status -> {
                SideEffectEntry entry = sideEffectEntryRepository.findById(entryId).orElse(null);
                if (entry == null || !entry.isPending()) {
                    return;
                }
                SideEffectHandler handler = handlers.get(entry.getEffectType());
                if (handler == null) {
                    throw new IllegalStateException("No handler for side effect type " + entry.getEffectType());
                }
                handler.apply(entry.getPayload());
                entry.markDone();
                log.debug("Side effect applied: id={}, type={}", entryId, entry.getEffectType());
            });
        } catch (ObjectOptimisticLockingFailureException e) {
            log.debug("Side effect processed concurrently, skipping: id={}", entryId);
        } catch (RuntimeException e) {
            recordFailure(entryId, e);
        }
    }

    private void recordFailure(Long entryId, RuntimeException cause) {
        try {
            transactionTemplate.executeWithoutResult(status -> sideEffectEntryRepository.findById(entryId)
                    .filter(SideEffectEntry::isPending)
                    .ifPresent(entry -> {
                        boolean exhausted = entry.recordFailure(cause.getMessage(), maxAttempts);
                        if (exhausted) {
                            log.error("Side effect FAILED after {} attempts, manual replay required: id={}, type={}, serviceRequestId={}",
                                    entry.getAttempts(), entryId, entry.getEffectType(), entry.getServiceRequestId(), cause);
                        } else {
                            log.warn("Side effect attempt failed, will retry: id={}, type={}, attempt={}/{}, error={}",
                                    entryId, entry.getEffectType(), entry.getAttempts(), maxAttempts, cause.getMessage());
                        }
                    }));
        } catch (RuntimeException e) {
            log.error("Could not record side effect failure: id={}", entryId, e);
        }
    }
}
