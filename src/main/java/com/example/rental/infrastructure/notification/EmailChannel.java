package com.example.rental.infrastructure.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs outgoing e-mails. Swap for an SMTP or provider SDK client in deployment.
 */
public class EmailChannel implements NotificationChannel {

    private static final Logger log = LoggerFactory.getLogger(EmailChannel.class);

    @Override
    public String channel() {
        return "email";
    }

    @Override
    public void send(String to, String subject, String body) {
        log.info("[EMAIL] To: {}, Subject: {}", to, subject);
        log.debug("[EMAIL] Body:\n{}", body);
    }
}
