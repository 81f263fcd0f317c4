package com.example.rental.infrastructure.config;

import com.example.rental.application.event.OrderEventBus;
import com.example.rental.application.event.OrderObserver;
import com.example.rental.domain.statemachine.OrderStateMachine;
import com.example.rental.domain.statemachine.StateEntryHook;
import com.example.rental.infrastructure.notification.EmailChannel;
import com.example.rental.infrastructure.notification.NotificationChannel;
import com.example.rental.infrastructure.notification.SmsChannel;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.List;

/**
 * Wiring for the lifecycle core: clock, state machine, event dispatch and notification channels.
 */
@Configuration
public class RentalConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public OrderStateMachine orderStateMachine(Clock clock, StateEntryHook stateEntryHook) {
        return new OrderStateMachine(clock, stateEntryHook);
    }

    @Bean
    public ThreadPoolTaskExecutor eventDispatchExecutor(
            @Value("${rental.events.dispatch.core-pool-size:4}") int corePoolSize,
            @Value("${rental.events.dispatch.max-pool-size:8}") int maxPoolSize,
            @Value("${rental.events.dispatch.queue-capacity:500}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("order-event-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }

    /**
     * Event bus with every observer bean attached.
     */
    @Bean
    public OrderEventBus orderEventBus(
            @Qualifier("eventDispatchExecutor") ThreadPoolTaskExecutor eventDispatchExecutor,
            @Value("${rental.events.observer-timeout-ms:5000}") long observerTimeoutMs,
            Clock clock,
            List<OrderObserver> observers) {
        OrderEventBus bus = new OrderEventBus(eventDispatchExecutor, observerTimeoutMs, clock);
        observers.forEach(bus::attach);
        return bus;
    }

    @Bean
    public NotificationChannel emailChannel() {
        return new EmailChannel();
    }

    @Bean
    public NotificationChannel smsChannel() {
        return new SmsChannel();
    }
}
