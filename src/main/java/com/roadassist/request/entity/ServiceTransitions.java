package com.roadassist.request.entity;

import com.roadassist.common.exception.BusinessException;
import com.roadassist.common.exception.ErrorCode;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * The single table of legal service status edges, used by assignment and by status updates.
 *
 * <pre>
 *   SUBMITTED -> ASSIGNED -> IN_PROGRESS -> REACHED -> COMPLETED
 *       |           |            |             |
 *       +-----------+------------+-------------+--> CANCELLED
 * </pre>
 */
public final class ServiceTransitions {

    private static final Map<ServiceStatus, Set<ServiceStatus>> EDGES = new EnumMap<>(ServiceStatus.class);

    static {
        EDGES.put(ServiceStatus.SUBMITTED, EnumSet.of(ServiceStatus.ASSIGNED, ServiceStatus.CANCELLED));
        EDGES.put(ServiceStatus.ASSIGNED, EnumSet.of(ServiceStatus.IN_PROGRESS, ServiceStatus.CANCELLED));
        EDGES.put(ServiceStatus.IN_PROGRESS, EnumSet.of(ServiceStatus.REACHED, ServiceStatus.CANCELLED));
        EDGES.put(ServiceStatus.REACHED, EnumSet.of(ServiceStatus.COMPLETED, ServiceStatus.CANCELLED));
        EDGES.put(ServiceStatus.COMPLETED, EnumSet.noneOf(ServiceStatus.class));
        EDGES.put(ServiceStatus.CANCELLED, EnumSet.noneOf(ServiceStatus.class));
    }

    private ServiceTransitions() {
    }

    public static boolean isAllowed(ServiceStatus from, ServiceStatus to) {
        return EDGES.get(from).contains(to);
    }

    public static Set<ServiceStatus> targetsOf(ServiceStatus from) {
        return Collections.unmodifiableSet(EDGES.get(from));
    }

    public static void verify(ServiceStatus from, ServiceStatus to) {
        if (!isAllowed(from, to)) {
            throw new BusinessException(ErrorCode.INVALID_STATUS_TRANSITION, from + " -> " + to + " is not allowed");
        }
    }
}
