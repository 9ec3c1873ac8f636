package com.roadassist.common.outbox;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.SequenceGenerator;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * A best-effort write recorded in the same transaction as the change that caused it.
 *
 * <p>Entries start {@link SideEffectStatus#PENDING}. The relay applies the effect in its own
 * transaction and marks the entry {@link SideEffectStatus#DONE}; each failed attempt is counted
 * and once the attempt budget is spent the entry is parked as {@link SideEffectStatus#FAILED}
 * for manual replay. The primary change is never rolled back by a side effect.</p>
 */
@Entity
@Table(name = "side_effect_entries", indexes = {
        @Index(name = "idx_side_effect_status", columnList = "status, createdAt")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class SideEffectEntry {

    private static final int MAX_ERROR_LENGTH = 1000;

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "side_effect_seq")
    @SequenceGenerator(name = "side_effect_seq", sequenceName = "side_effect_seq", allocationSize = 50)
    private Long id;

    @Version
    private Long version;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SideEffectType effectType;

    private Long serviceRequestId;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SideEffectStatus status;

    private int attempts;

    @Column(length = MAX_ERROR_LENGTH)
    private String lastError;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    private LocalDateTime processedAt;

    @Builder
    public SideEffectEntry(SideEffectType effectType, Long serviceRequestId, String payload) {
        this.effectType = effectType;
        this.serviceRequestId = serviceRequestId;
        this.payload = payload;
        this.status = SideEffectStatus.PENDING;
        this.attempts = 0;
        this.createdAt = LocalDateTime.now();
    }

    public boolean isPending() {
        return status == SideEffectStatus.PENDING;
    }

    public void markDone() {
        this.attempts++;
        this.status = SideEffectStatus.DONE;
        this.processedAt = LocalDateTime.now();
        this.lastError = null;
    }

    /**
     * Counts a failed attempt.
     *
     * @return true when the entry ran out of attempts and is now FAILED
     */
    public boolean recordFailure(String error, int maxAttempts) {
        this.attempts++;
        this.lastError = error != null && error.length() > MAX_ERROR_LENGTH
                ? error.substring(0, MAX_ERROR_LENGTH) : error;
        if (attempts >= maxAttempts) {
            this.status = SideEffectStatus.FAILED;
            this.processedAt = LocalDateTime.now();
            return true;
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SideEffectEntry that)) return false;
        return id != null && id.equals(that.getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
