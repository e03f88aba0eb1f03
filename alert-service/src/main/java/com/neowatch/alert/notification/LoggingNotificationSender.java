package com.neowatch.alert.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Default sender when no delivery channel is configured: writes the alert to the log.
 */
@Component
public class LoggingNotificationSender implements NotificationSender {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationSender.class);

    @Override
    public Mono<Void> notify(String userId, String subject, String body) {
        return Mono.fromRunnable(() -> {
            log.info("NOTIFICATION userId={} subject=\"{}\"", userId, subject);
            log.debug("NOTIFICATION_BODY userId={}\n{}", userId, body);
        });
    }
}
