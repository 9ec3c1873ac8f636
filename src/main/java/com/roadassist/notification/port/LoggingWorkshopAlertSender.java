package com.roadassist.notification.port;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Logs alerts instead of sending them. Replace with an SMTP or SES backed sender in deployment.
 */
@Slf4j
@Component
public class LoggingWorkshopAlertSender implements WorkshopAlertSender {

    @Override
    public void send(String to, String subject, String body) {
        log.info("[EMAIL] to={} subject='{}'", to, subject);
    }
}
