package com.example.rental.infrastructure.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class SmsChannel implements NotificationChannel {

    private static final Logger log = LoggerFactory.getLogger(SmsChannel.class);
    static final int MAX_LENGTH = 160;

    @Override
    public String channel() {
        return "sms";
    }

    @Override
    public void send(String to, String subject, String body) {
        log.info("[SMS] To: {}, Body: {}", to, body.substring(0, Math.min(MAX_LENGTH, body.length())));
    }
}
