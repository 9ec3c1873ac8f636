package com.roadassist.mechanic.repository;

import com.roadassist.mechanic.entity.Mechanic;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface MechanicRepository extends JpaRepository<Mechanic, Long> {

    Optional<Mechanic> findByUserId(Long userId);

    List<Mechanic> findByWorkshopIdOrderByIdAsc(Long workshopId);
}
