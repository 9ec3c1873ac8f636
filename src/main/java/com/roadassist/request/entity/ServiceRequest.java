package com.roadassist.request.entity;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EntityListeners;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.SequenceGenerator;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * A customer's roadside service job.
 *
 * <h3>Lifecycle timestamps</h3>
 * <ul>
 *   <li>{@code assignedAt} is set together with {@code mechanicId}</li>
 *   <li>{@code startedAt}, {@code reachedAt} and {@code completedAt} are stamped the first time
 *       the matching status is entered and never overwritten</li>
 * </ul>
 *
 * <p>Requests are never deleted. Legal edges live in {@link ServiceTransitions}; this entity
 * only records the outcome. {@code @Version} turns two concurrent assignments of the same request
 * into an optimistic lock failure for the later commit.</p>
 */
@Entity
@Table(name = "service_requests", indexes = {
        @Index(name = "idx_request_customer", columnList = "customerId"),
        @Index(name = "idx_request_mechanic", columnList = "mechanicId"),
        @Index(name = "idx_request_workshop_status", columnList = "workshopId, status")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EntityListeners(AuditingEntityListener.class)
public class ServiceRequest {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "service_request_seq")
    @SequenceGenerator(name = "service_request_seq", sequenceName = "service_request_seq", allocationSize = 50)
    private Long id;

    @Version
    private Long version;

    @Column(nullable = false)
    private Long customerId;

    private Long workshopId;

    private Long mechanicId;

    @Column(nullable = false)
    private String vehicleType;

    private String vehicleMake;

    private String vehicleModel;

    @Column(nullable = false)
    private String issueType;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Urgency urgency;

    @Column(nullable = false)
    private String pickupAddress;

    @Column(nullable = false)
    private double latitude;

    @Column(nullable = false)
    private double longitude;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "service_request_images", joinColumns = @JoinColumn(name = "service_request_id"))
    @OrderColumn(name = "position")
    @Column(name = "url")
    private List<String> images = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ServiceStatus status;

    private BigDecimal estimatedCost;

    private BigDecimal actualCost;

    @CreatedDate
    private LocalDateTime createdAt;

    private LocalDateTime assignedAt;

    private LocalDateTime startedAt;

    private LocalDateTime reachedAt;

    private LocalDateTime completedAt;

    @LastModifiedDate
    private LocalDateTime updatedAt;

    @Builder
    public ServiceRequest(Long customerId, Long workshopId, String vehicleType, String vehicleMake,
                          String vehicleModel, String issueType, String description, Urgency urgency,
                          String pickupAddress, double latitude, double longitude, List<String> images) {
        this.customerId = customerId;
        this.workshopId = workshopId;
        this.vehicleType = vehicleType;
        this.vehicleMake = vehicleMake;
        this.vehicleModel = vehicleModel;
        this.issueType = issueType;
        this.description = description;
        this.urgency = urgency != null ? urgency : Urgency.MEDIUM;
        this.pickupAddress = pickupAddress;
        this.latitude = latitude;
        this.longitude = longitude;
        this.images = images != null ? new ArrayList<>(images) : new ArrayList<>();
        this.status = ServiceStatus.SUBMITTED;
    }

    public boolean isAssigned() {
        return mechanicId != null;
    }

    public boolean isRoutedTo(Long workshopId) {
        return this.workshopId != null && this.workshopId.equals(workshopId);
    }

    /**
     * Binds the mechanic and moves the request to ASSIGNED. Routes the request to the
     * mechanic's workshop when it was not pre-routed.
     */
    public void assign(Long mechanicId, Long workshopId, LocalDateTime now) {
        ServiceTransitions.verify(status, ServiceStatus.ASSIGNED);
        this.mechanicId = mechanicId;
        if (this.workshopId == null) {
            this.workshopId = workshopId;
        }
        this.status = ServiceStatus.ASSIGNED;
        this.assignedAt = now;
    }

    /**
     * Moves the request along a legal edge, stamping the stage timestamp if it is still unset.
     */
    public void changeStatus(ServiceStatus target, LocalDateTime now) {
        ServiceTransitions.verify(status, target);
        this.status = target;
        switch (target) {
            case IN_PROGRESS -> {
                if (startedAt == null) startedAt = now;
            }
            case REACHED -> {
                if (reachedAt == null) reachedAt = now;
            }
            case COMPLETED -> {
                if (completedAt == null) completedAt = now;
            }
            default -> {
            }
        }
    }

    public void updateCosts(BigDecimal estimatedCost, BigDecimal actualCost) {
        if (estimatedCost != null) {
            this.estimatedCost = estimatedCost;
        }
        if (actualCost != null) {
            this.actualCost = actualCost;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ServiceRequest that)) return false;
        return id != null && id.equals(that.getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
