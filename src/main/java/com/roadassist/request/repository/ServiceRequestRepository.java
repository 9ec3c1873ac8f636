package com.roadassist.request.repository;

import com.roadassist.request.entity.ServiceRequest;
import com.roadassist.request.entity.ServiceStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface ServiceRequestRepository extends JpaRepository<ServiceRequest, Long> {

    List<ServiceRequest> findByCustomerIdOrderByCreatedAtDesc(Long customerId);

    List<ServiceRequest> findByMechanicIdOrderByCreatedAtDesc(Long mechanicId);

    /**
     * Requests routed to the workshop plus every unassigned request, newest first.
     */
    @Query("SELECT r FROM ServiceRequest r " +
            "WHERE r.workshopId = :workshopId OR r.workshopId IS NULL " +
            "ORDER BY r.createdAt DESC")
    List<ServiceRequest> findWorkshopQueue(@Param("workshopId") Long workshopId, Pageable pageable);

    @Query("SELECT r FROM ServiceRequest r " +
            "WHERE (r.workshopId = :workshopId OR r.workshopId IS NULL) AND r.status = :status " +
            "ORDER BY r.createdAt DESC")
    List<ServiceRequest> findWorkshopQueueByStatus(@Param("workshopId") Long workshopId,
                                                   @Param("status") ServiceStatus status,
                                                   Pageable pageable);
}
