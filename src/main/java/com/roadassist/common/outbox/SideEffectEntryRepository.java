package com.roadassist.common.outbox;

import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDateTime;
import java.util.List;

public interface SideEffectEntryRepository extends JpaRepository<SideEffectEntry, Long> {

    /**
     * Oldest pending entries created before the cutoff. Younger entries are still owned by
     * the post-commit dispatch of the transaction that wrote them.
     */
    List<SideEffectEntry> findTop100ByStatusAndCreatedAtBeforeOrderByCreatedAtAsc(
            SideEffectStatus status, LocalDateTime cutoff);

    List<SideEffectEntry> findByServiceRequestIdOrderByCreatedAtAsc(Long serviceRequestId);
}
