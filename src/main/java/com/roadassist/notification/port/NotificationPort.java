package com.roadassist.notification.port;

/**
 * Real-time delivery to everyone connected to a room. At-most-once: implementations may drop
 * events and must not throw for delivery failures.
 */
public interface NotificationPort {

    void push(String room, String event, Object data);
}
