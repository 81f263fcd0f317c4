package com.example.rental.infrastructure.config;

import com.example.rental.application.exception.SequenceGenerationFailedException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;

/**
 * Logs retry events, chiefly {@code sequenceRetry} around order creation.
 */
@Configuration
public class Resilience4jEventConfig {

    private static final Logger log = LoggerFactory.getLogger(Resilience4jEventConfig.class);

    private final RetryRegistry retryRegistry;

    public Resilience4jEventConfig(RetryRegistry retryRegistry) {
        this.retryRegistry = retryRegistry;
    }

    @PostConstruct
    public void registerEventListeners() {
        retryRegistry.getAllRetries().forEach(this::listenTo);
        retryRegistry.getEventPublisher().onEntryAdded(event -> listenTo(event.getAddedEntry()));
    }

    private void listenTo(Retry retry) {
        retry.getEventPublisher()
                .onRetry(event -> log.warn("[RETRY] {} attempt {} failed on {}, next try in {}ms",
                        event.getName(),
                        event.getNumberOfRetryAttempts(),
                        describe(event.getLastThrowable()),
                        event.getWaitInterval().toMillis()))
                .onSuccess(event -> log.info("[RETRY] {} recovered after {} attempt(s)",
                        event.getName(), event.getNumberOfRetryAttempts()))
                .onError(event -> log.error("[RETRY] {} gave up after {} attempt(s): {}",
                        event.getName(),
                        event.getNumberOfRetryAttempts(),
                        describe(event.getLastThrowable())));
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        if (error instanceof SequenceGenerationFailedException sequenceFailure) {
            return "counter '" + sequenceFailure.getCounterName() + "'";
        }
        return error.getClass().getSimpleName() + ": " + error.getMessage();
    }
}
