package com.roadassist.update.entity;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.SequenceGenerator;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Progress note on a service request. Append-only: no setters, never deleted.
 */
@Entity
@Table(name = "service_updates", indexes = {
        @Index(name = "idx_update_request_time", columnList = "serviceRequestId, recorded_at")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ServiceUpdate {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "service_update_seq")
    @SequenceGenerator(name = "service_update_seq", sequenceName = "service_update_seq", allocationSize = 50)
    private Long id;

    @Column(nullable = false)
    private Long serviceRequestId;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String message;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "service_update_images", joinColumns = @JoinColumn(name = "service_update_id"))
    @OrderColumn(name = "position")
    @Column(name = "url")
    private List<String> images = new ArrayList<>();

    @Column(name = "recorded_at", nullable = false)
    private LocalDateTime timestamp;

    @Builder
    public ServiceUpdate(Long serviceRequestId, String message, List<String> images) {
        this.serviceRequestId = serviceRequestId;
        this.message = message;
        this.images = images != null ? new ArrayList<>(images) : new ArrayList<>();
        this.timestamp = LocalDateTime.now();
    }
}
