package com.example.rental.unit.observer;

import com.example.rental.application.dto.RentalOrderResult;
import com.example.rental.application.event.OrderEvent;
import com.example.rental.application.event.OrderEventType;
import com.example.rental.infrastructure.notification.NotificationChannel;
import com.example.rental.infrastructure.observer.EmailNotificationObserver;
import com.example.rental.infrastructure.observer.ReportGeneratorObserver;
import com.example.rental.infrastructure.observer.ReportGeneratorObserver.Report;
import com.example.rental.infrastructure.observer.SmsNotificationObserver;
import com.example.rental.support.TestOrders;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for the notification and report observers.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("Notification and Report Observer Tests")
class NotificationAndReportObserverTest {

    private final RentalOrderResult order = RentalOrderResult.from(TestOrders.pending(LocalDate.of(2024, 6, 10)));

    @Mock
    private NotificationChannel channel;

    private OrderEvent event(OrderEventType type, Map<String, Object> metadata) {
        return new OrderEvent(type, order, Instant.parse("2024-06-12T09:00:00Z"), metadata);
    }

    @Nested
    @DisplayName("Email")
    class Email {

        @Test
        @DisplayName("should_subscribe_to_every_event")
        void should_subscribe_to_every_event() {
            EmailNotificationObserver email = new EmailNotificationObserver(channel);

            for (OrderEventType type : OrderEventType.values()) {
                assertThat(email.isSubscribed(type)).isTrue();
            }
        }

        @Test
        @DisplayName("should_send_cancellation_with_reason_to_customer")
        void should_send_cancellation_with_reason_to_customer() {
            // Given
            EmailNotificationObserver email = new EmailNotificationObserver(channel);
            ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);

            // When
            email.update(event(OrderEventType.ORDER_CANCELLED, Map.of("reason", "venue closed")));

            // Then
            verify(channel).send(eq("CUST-1"), eq("Rental order #1 cancelled"), body.capture());
            assertThat(body.getValue()).contains("Reason: venue closed");
        }
    }

    @Nested
    @DisplayName("SMS")
    class Sms {

        @Test
        @DisplayName("should_only_subscribe_to_actionable_events")
        void should_only_subscribe_to_actionable_events() {
            SmsNotificationObserver sms = new SmsNotificationObserver(channel);

            assertThat(sms.isSubscribed(OrderEventType.ORDER_CONFIRMED)).isTrue();
            assertThat(sms.isSubscribed(OrderEventType.ORDER_DELIVERED)).isTrue();
            assertThat(sms.isSubscribed(OrderEventType.LATE_RETURN)).isTrue();
            assertThat(sms.isSubscribed(OrderEventType.ORDER_CREATED)).isFalse();
            assertThat(sms.isSubscribed(OrderEventType.ORDER_CANCELLED)).isFalse();
        }

        @Test
        @DisplayName("should_text_days_late")
        void should_text_days_late() {
            SmsNotificationObserver sms = new SmsNotificationObserver(channel);

            sms.update(event(OrderEventType.LATE_RETURN, Map.of("daysLate", 2L)));

            verify(channel).send(eq("CUST-1"), isNull(), eq("Order #1 was returned 2 day(s) late."));
        }
    }

    @Nested
    @DisplayName("Reports")
    class Reports {

        @Test
        @DisplayName("should_generate_cancellation_report_with_prior_state")
        void should_generate_cancellation_report_with_prior_state() {
            // Given
            ReportGeneratorObserver reports = new ReportGeneratorObserver();

            // When
            reports.update(event(OrderEventType.ORDER_CANCELLED,
                    Map.of("previousState", "CONFIRMED", "reason", "illness", "lateCancellation", false)));

            // Then
            assertThat(reports.getReports()).hasSize(1);
            Report report = reports.getReports().get(0);
            assertThat(report.id()).startsWith("RPT-");
            assertThat(report.content())
                    .contains("CANCELLATION REPORT")
                    .contains("Cancelled from: CONFIRMED")
                    .contains("Reason: illness");
        }

        @Test
        @DisplayName("should_ignore_events_outside_subscription")
        void should_ignore_events_outside_subscription() {
            ReportGeneratorObserver reports = new ReportGeneratorObserver();

            assertThat(reports.isSubscribed(OrderEventType.ORDER_CONFIRMED)).isFalse();
            assertThat(reports.isSubscribed(OrderEventType.LATE_RETURN)).isTrue();
        }
    }
}
