package com.roadassist.mechanic.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EntityListeners;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.SequenceGenerator;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.LocalDateTime;

/**
 * A calendar entry of a mechanic. Informational only: availability is tracked on
 * {@link Mechanic}, not derived from these blocks.
 */
@Entity
@Table(name = "mechanic_schedules", indexes = {
        @Index(name = "idx_schedule_mechanic_start", columnList = "mechanicId, startTime")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EntityListeners(AuditingEntityListener.class)
public class MechanicSchedule {

    public static final String SERVICE_TYPE = "SERVICE";

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "mechanic_schedule_seq")
    @SequenceGenerator(name = "mechanic_schedule_seq", sequenceName = "mechanic_schedule_seq", allocationSize = 50)
    private Long id;

    @Column(nullable = false)
    private Long mechanicId;

    @Column(nullable = false)
    private String title;

    private String description;

    @Column(nullable = false)
    private LocalDateTime startTime;

    @Column(nullable = false)
    private LocalDateTime endTime;

    private boolean allDay;

    @Column(nullable = false)
    private String type;

    private Long serviceId;

    @CreatedDate
    private LocalDateTime createdAt;

    @Builder
    public MechanicSchedule(Long mechanicId, String title, String description, LocalDateTime startTime,
                            LocalDateTime endTime, boolean allDay, String type, Long serviceId) {
        this.mechanicId = mechanicId;
        this.title = title;
        this.description = description;
        this.startTime = startTime;
        this.endTime = endTime;
        this.allDay = allDay;
        this.type = type;
        this.serviceId = serviceId;
    }

    public boolean isServiceBlock() {
        return SERVICE_TYPE.equals(type);
    }

    public void update(String title, String description, LocalDateTime startTime, LocalDateTime endTime,
                       boolean allDay, String type) {
        this.title = title;
        this.description = description;
        this.startTime = startTime;
        this.endTime = endTime;
        this.allDay = allDay;
        this.type = type;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MechanicSchedule that)) return false;
        return id != null && id.equals(that.getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
