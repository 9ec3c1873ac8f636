package com.roadassist.workshop.service;

import com.roadassist.common.exception.BusinessException;
import com.roadassist.common.exception.ErrorCode;
import com.roadassist.geo.model.GeoPoint;
import com.roadassist.geo.model.NearbyWorkshop;
import com.roadassist.geo.model.SortKey;
import com.roadassist.geo.service.GeoRankingService;
import com.roadassist.workshop.entity.Workshop;
import com.roadassist.workshop.repository.WorkshopRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Workshop lookups and nearby discovery.
 *
 * <p>Requests may be routed to a workshop at creation, and admins act on behalf of the
 * workshop they are registered for.</p>
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class WorkshopService {

    static final double DEFAULT_RADIUS_KM = 10.0;

    private final WorkshopRepository workshopRepository;
    private final GeoRankingService geoRankingService;

    public Workshop getWorkshop(Long workshopId) {
        return workshopRepository.findById(workshopId)
                .orElseThrow(() -> new BusinessException(ErrorCode.WORKSHOP_NOT_FOUND,
                        "Workshop #" + workshopId + " not found"));
    }

    public Workshop getWorkshopOfAdmin(Long adminId) {
        return workshopRepository.findByAdminId(adminId)
                .orElseThrow(() -> new BusinessException(ErrorCode.WORKSHOP_NOT_FOUND,
                        "No workshop is registered for admin #" + adminId));
    }

    /**
     * Open workshops around the user (at most 50 are considered). A missing radius defaults to
     * {@value #DEFAULT_RADIUS_KM} km; without an origin workshops are ordered by rating.
     */
    public List<NearbyWorkshop> findNearby(GeoPoint origin, SortKey sortKey, Double radiusKm) {
        List<NearbyWorkshop> candidates = workshopRepository.findTop50ByOpenTrueOrderByIdAsc().stream()
                .map(WorkshopService::toCandidate)
                .toList();
        double radius = radiusKm != null && radiusKm > 0 ? radiusKm : DEFAULT_RADIUS_KM;
        return geoRankingService.rankNearby(origin, candidates, sortKey, radius);
    }

    private static NearbyWorkshop toCandidate(Workshop workshop) {
        return new NearbyWorkshop(workshop.getId(), workshop.getName(), workshop.getDescription(),
                workshop.getAddress(), workshop.getPhone(), workshop.getLatitude(), workshop.getLongitude(),
                workshop.getRating(), workshop.getReviewCount(), null);
    }
}
