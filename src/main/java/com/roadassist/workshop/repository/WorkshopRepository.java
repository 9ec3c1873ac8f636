package com.roadassist.workshop.repository;

import com.roadassist.workshop.entity.Workshop;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface WorkshopRepository extends JpaRepository<Workshop, Long> {

    Optional<Workshop> findByAdminId(Long adminId);

    List<Workshop> findTop50ByOpenTrueOrderByIdAsc();
}
