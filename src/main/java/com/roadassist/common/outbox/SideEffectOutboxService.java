package com.roadassist.common.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.roadassist.common.exception.BusinessException;
import com.roadassist.common.exception.ErrorCode;
import com.roadassist.common.transaction.AfterCommitExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Records side effects in the caller's transaction and dispatches them once it commits.
 *
 * <pre>
 *   @Transactional
 *   public ServiceRequest assign(...) {
 *       request.assign(mechanic.getId(), workshop.getId());        // primary change
 *       outbox.enqueue(SCHEDULE_BLOCK, request.getId(), block);     // same transaction
 *   }
 *   // after commit: relay.process(entryId) on the push executor
 *   // entries still PENDING are picked up again by the scheduled relay
 * </pre>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SideEffectOutboxService {

    private final SideEffectEntryRepository sideEffectEntryRepository;
    private final SideEffectRelay sideEffectRelay;
    private final AfterCommitExecutor afterCommitExecutor;
    private final ObjectMapper objectMapper;

    public SideEffectEntry enqueue(SideEffectType type, Long serviceRequestId, Object payload) {
        String json;
        try {
            json = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize side effect: type={}, serviceRequestId={}", type, serviceRequestId, e);
            throw new BusinessException(ErrorCode.INTERNAL_ERROR, "Failed to serialize side effect " + type, e);
        }

        SideEffectEntry entry = sideEffectEntryRepository.save(SideEffectEntry.builder()
                .effectType(type)
                .serviceRequestId(serviceRequestId)
                .payload(json)
                .build());
        log.debug("Side effect enqueued: id={}, type={}, serviceRequestId={}",
                entry.getId(), type, serviceRequestId);

        Long entryId = entry.getId();
        afterCommitExecutor.execute(() -> sideEffectRelay.process(entryId));
        return entry;
    }
}
