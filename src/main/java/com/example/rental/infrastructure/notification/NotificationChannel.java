package com.example.rental.infrastructure.notification;

/**
 * Outbound delivery channel for customer notifications.
 */
public interface NotificationChannel {

    String channel();

    void send(String to, String subject, String body);
}
