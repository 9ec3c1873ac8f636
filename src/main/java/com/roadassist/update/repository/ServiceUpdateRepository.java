package com.roadassist.update.repository;

import com.roadassist.update.entity.ServiceUpdate;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ServiceUpdateRepository extends JpaRepository<ServiceUpdate, Long> {

    List<ServiceUpdate> findByServiceRequestIdOrderByTimestampDescIdDesc(Long serviceRequestId);
}
