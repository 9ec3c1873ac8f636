package com.roadassist.notification.service;

/**
 * Names of the real-time rooms clients join.
 */
public final class RoomKeys {

    public static final String UNASSIGNED_REQUESTS = "unassigned-requests";

    private RoomKeys() {
    }

    /** Room of a customer or workshop admin account. */
    public static String user(Long userId) {
        return "user-" + userId;
    }

    /** Room of a mechanic, keyed by mechanic id (not account id). */
    public static String mechanic(Long mechanicId) {
        return "mechanic-" + mechanicId;
    }
}
