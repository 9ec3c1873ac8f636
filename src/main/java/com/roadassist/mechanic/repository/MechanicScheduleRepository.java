package com.roadassist.mechanic.repository;

import com.roadassist.mechanic.entity.MechanicSchedule;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDateTime;
import java.util.List;

public interface MechanicScheduleRepository extends JpaRepository<MechanicSchedule, Long> {

    List<MechanicSchedule> findByMechanicIdOrderByStartTimeAsc(Long mechanicId);

    List<MechanicSchedule> findByMechanicIdAndStartTimeGreaterThanEqualAndEndTimeLessThanEqualOrderByStartTimeAsc(
            Long mechanicId, LocalDateTime from, LocalDateTime to);

    List<MechanicSchedule> findByMechanicIdAndStartTimeGreaterThanEqualOrderByStartTimeAsc(
            Long mechanicId, LocalDateTime from);

    List<MechanicSchedule> findByMechanicIdAndEndTimeLessThanEqualOrderByStartTimeAsc(
            Long mechanicId, LocalDateTime to);

    boolean existsByMechanicIdAndServiceIdAndType(Long mechanicId, Long serviceId, String type);
}
