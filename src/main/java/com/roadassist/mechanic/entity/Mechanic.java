package com.roadassist.mechanic.entity;

import com.roadassist.common.exception.BusinessException;
import com.roadassist.common.exception.ErrorCode;
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
import jakarta.persistence.SequenceGenerator;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A workshop-affiliated mechanic.
 *
 * <h3>Availability</h3>
 * <pre>
 *   AVAILABLE --occupy()--> IN_SERVICE --release()--> AVAILABLE
 *   AVAILABLE <--changeAvailability()--> NOT_AVAILABLE
 * </pre>
 *
 * <p>{@code @Version} makes concurrent assignments of the same mechanic conflict at commit:
 * both transactions read AVAILABLE, only the first flush of IN_SERVICE wins.</p>
 */
@Entity
@Table(name = "mechanics", indexes = {
        @Index(name = "idx_mechanic_workshop", columnList = "workshopId")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EntityListeners(AuditingEntityListener.class)
public class Mechanic {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "mechanic_seq")
    @SequenceGenerator(name = "mechanic_seq", sequenceName = "mechanic_seq", allocationSize = 50)
    private Long id;

    @Version
    private Long version;

    @Column(nullable = false, unique = true)
    private Long userId;

    @Column(nullable = false)
    private Long workshopId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Availability availability;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "mechanic_specialties", joinColumns = @JoinColumn(name = "mechanic_id"))
    @Column(name = "specialty")
    private Set<String> specialties = new LinkedHashSet<>();

    private int experience;

    private double rating;

    private int reviewCount;

    @CreatedDate
    private LocalDateTime createdAt;

    @Builder
    public Mechanic(Long userId, Long workshopId, Set<String> specialties, int experience,
                    double rating, int reviewCount) {
        this.userId = userId;
        this.workshopId = workshopId;
        this.specialties = specialties != null ? new LinkedHashSet<>(specialties) : new LinkedHashSet<>();
        this.experience = experience;
        this.rating = rating;
        this.reviewCount = reviewCount;
        this.availability = Availability.AVAILABLE;
    }

    public boolean isAvailable() {
        return availability == Availability.AVAILABLE;
    }

    public boolean belongsTo(Long workshopId) {
        return this.workshopId != null && this.workshopId.equals(workshopId);
    }

    /** Takes the mechanic for an assignment. Only an AVAILABLE mechanic can be occupied. */
    public void occupy() {
        if (!isAvailable()) {
            throw new BusinessException(ErrorCode.MECHANIC_NOT_AVAILABLE,
                    "Mechanic #" + id + " is " + availability);
        }
        this.availability = Availability.IN_SERVICE;
    }

    /** Frees the mechanic after the assigned request completed or was cancelled. */
    public void release() {
        this.availability = Availability.AVAILABLE;
    }

    /**
     * Manual toggle between AVAILABLE and NOT_AVAILABLE.
     */
    public void changeAvailability(Availability target) {
        if (target == Availability.IN_SERVICE) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "IN_SERVICE is set by assignment and cannot be chosen manually");
        }
        if (availability == Availability.IN_SERVICE) {
            throw new BusinessException(ErrorCode.MECHANIC_NOT_AVAILABLE,
                    "Mechanic #" + id + " is in service and cannot change availability");
        }
        this.availability = target;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Mechanic that)) return false;
        return id != null && id.equals(that.getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
