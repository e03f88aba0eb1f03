package com.neowatch.alert.notification;

import reactor.core.publisher.Mono;

/**
 * Delivers an alert to a user. Completes once the message has been handed off; errors
 * signal that the user was not notified.
 */
public interface NotificationSender {

    Mono<Void> notify(String userId, String subject, String body);
}
