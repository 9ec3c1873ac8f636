package com.roadassist.notification.port;

public interface WorkshopAlertSender {

    void send(String to, String subject, String body);
}
