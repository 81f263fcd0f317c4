package com.example.rental.infrastructure.observer;

import com.example.rental.application.dto.RentalOrderResult;
import com.example.rental.application.event.OrderEvent;
import com.example.rental.application.event.OrderObserver;
import com.example.rental.domain.statemachine.OrderStateMachine;
import com.example.rental.infrastructure.notification.NotificationChannel;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Sends a customer e-mail for every lifecycle event.
 */
@Component
public class EmailNotificationObserver implements OrderObserver {

    private final NotificationChannel channel;

    public EmailNotificationObserver(@Qualifier("emailChannel") NotificationChannel channel) {
        this.channel = channel;
    }

    @Override
    public String name() {
        return "EmailNotification";
    }

    @Override
    public void update(OrderEvent event) {
        RentalOrderResult order = event.order();
        channel.send(order.customerId(), subject(event), body(event));
    }

    String subject(OrderEvent event) {
        long number = event.order().number();
        return switch (event.type()) {
            case ORDER_CREATED -> "Rental order #" + number + " registered";
            case ORDER_CONFIRMED -> "Rental order #" + number + " confirmed";
            case ORDER_DELIVERED -> "Your items for order #" + number + " have been delivered";
            case ORDER_RETURNED -> "Thank you for returning order #" + number;
            case ORDER_CANCELLED -> "Rental order #" + number + " cancelled";
            case LATE_RETURN -> "Late return notice for order #" + number;
        };
    }

    String body(OrderEvent event) {
        RentalOrderResult order = event.order();
        StringBuilder body = new StringBuilder()
                .append("Order #").append(order.number()).append('\n')
                .append("Rental date: ").append(order.rentalDate()).append('\n')
                .append("Items: ").append(order.itemIds().size()).append('\n')
                .append("Total: ").append(order.total()).append(' ').append(order.currency()).append('\n');
        switch (event.type()) {
            case ORDER_CREATED -> body.append("We will contact you to confirm your reservation.");
            case ORDER_CONFIRMED -> body.append("Your reservation is confirmed. Items are set aside for you.");
            case ORDER_DELIVERED -> body.append("Please return the items within ")
                    .append(OrderStateMachine.RETURN_GRACE_DAYS)
                    .append(" days of the rental date.");
            case ORDER_RETURNED -> body.append("Returned on ").append(order.returnDate()).append('.');
            case ORDER_CANCELLED -> body.append("Reason: ").append(event.metadataString("reason"));
            case LATE_RETURN -> body.append("The items came back ").append(event.metadataString("daysLate"))
                    .append(" day(s) late. A late fee may apply.");
        }
        return body.toString();
    }
}
