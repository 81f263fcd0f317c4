package com.example.rental.infrastructure.observer;

import com.example.rental.application.event.OrderEvent;
import com.example.rental.application.event.OrderEventType;
import com.example.rental.application.event.OrderObserver;
import com.example.rental.infrastructure.notification.NotificationChannel;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Set;

/**
 * Short text messages for the events a customer has to act on.
 */
@Component
public class SmsNotificationObserver implements OrderObserver {

    private static final Set<OrderEventType> EVENTS = EnumSet.of(
            OrderEventType.ORDER_CONFIRMED,
            OrderEventType.ORDER_DELIVERED,
            OrderEventType.LATE_RETURN);

    private final NotificationChannel channel;

    public SmsNotificationObserver(@Qualifier("smsChannel") NotificationChannel channel) {
        this.channel = channel;
    }

    @Override
    public String name() {
        return "SmsNotification";
    }

    @Override
    public Set<OrderEventType> subscribedEvents() {
        return EVENTS;
    }

    @Override
    public void update(OrderEvent event) {
        long number = event.order().number();
        String text = switch (event.type()) {
            case ORDER_CONFIRMED -> "Order #" + number + " confirmed for " + event.order().rentalDate() + ".";
            case ORDER_DELIVERED -> "Order #" + number + " delivered. Enjoy your event!";
            case LATE_RETURN -> "Order #" + number + " was returned " + event.metadataString("daysLate")
                    + " day(s) late.";
            default -> throw new IllegalArgumentException("Unsupported event for SMS: " + event.type());
        };
        channel.send(event.order().customerId(), null, text);
    }
}
