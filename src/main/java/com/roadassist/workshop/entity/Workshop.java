package com.roadassist.workshop.entity;

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
 * A workshop owned by exactly one admin account. Employs zero or more mechanics.
 */
@Entity
@Table(name = "workshops", indexes = {
        @Index(name = "idx_workshop_open", columnList = "open")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EntityListeners(AuditingEntityListener.class)
public class Workshop {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "workshop_seq")
    @SequenceGenerator(name = "workshop_seq", sequenceName = "workshop_seq", allocationSize = 50)
    private Long id;

    @Column(nullable = false, unique = true)
    private Long adminId;

    @Column(nullable = false)
    private String name;

    private String description;

    @Column(nullable = false)
    private String address;

    @Column(nullable = false)
    private double latitude;

    @Column(nullable = false)
    private double longitude;

    private String phone;

    private String adminEmail;

    @Column(nullable = false)
    private boolean open;

    private double rating;

    private int reviewCount;

    @CreatedDate
    private LocalDateTime createdAt;

    @Builder
    public Workshop(Long adminId, String name, String description, String address,
                    double latitude, double longitude, String phone, String adminEmail,
                    double rating, int reviewCount) {
        this.adminId = adminId;
        this.name = name;
        this.description = description;
        this.address = address;
        this.latitude = latitude;
        this.longitude = longitude;
        this.phone = phone;
        this.adminEmail = adminEmail;
        this.rating = rating;
        this.reviewCount = reviewCount;
        this.open = true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Workshop that)) return false;
        return id != null && id.equals(that.getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
