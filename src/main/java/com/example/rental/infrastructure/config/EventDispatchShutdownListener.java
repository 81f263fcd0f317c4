package com.example.rental.infrastructure.config;

import com.example.rental.application.event.OrderEventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.stereotype.Component;

/**
 * Holds context shutdown until in-flight observer dispatches finish, up to a bounded wait.
 */
@Component
public class EventDispatchShutdownListener implements ApplicationListener<ContextClosedEvent> {

    private static final Logger log = LoggerFactory.getLogger(EventDispatchShutdownListener.class);

    private final OrderEventBus eventBus;
    private final int maxWaitSeconds;

    public EventDispatchShutdownListener(OrderEventBus eventBus,
                                         @Value("${rental.events.shutdown-wait-seconds:10}") int maxWaitSeconds) {
        this.eventBus = eventBus;
        this.maxWaitSeconds = maxWaitSeconds;
    }

    @Override
    public void onApplicationEvent(ContextClosedEvent event) {
        log.info("Shutdown signal received. In-flight event dispatches: {}", eventBus.getInFlightCount());

        int waitSeconds = maxWaitSeconds;
        while (eventBus.getInFlightCount() > 0 && waitSeconds > 0) {
            log.info("Waiting for {} event dispatch(es) to complete... ({} seconds remaining)",
                    eventBus.getInFlightCount(), waitSeconds);
            try {
                Thread.sleep(1000);
                waitSeconds--;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Shutdown interrupted while waiting for event dispatches");
                break;
            }
        }

        if (eventBus.getInFlightCount() > 0) {
            log.warn("Shutdown wait elapsed. {} event dispatch(es) may be cut off.", eventBus.getInFlightCount());
        } else {
            log.info("All event dispatches finished.");
        }
    }
}
