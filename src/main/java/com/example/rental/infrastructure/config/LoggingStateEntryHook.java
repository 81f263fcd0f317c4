package com.example.rental.infrastructure.config;

import com.example.rental.domain.model.OrderState;
import com.example.rental.domain.model.RentalOrder;
import com.example.rental.domain.statemachine.StateEntryHook;
import com.example.rental.domain.statemachine.TransitionOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Logs state entries, with the notes the lifecycle rules attach to them.
 */
@Component
public class LoggingStateEntryHook implements StateEntryHook {

    private static final Logger log = LoggerFactory.getLogger(LoggingStateEntryHook.class);

    @Override
    public void onEnter(RentalOrder order, TransitionOutcome outcome) {
        log.info("[STATE] order={} number={} {} -> {}", order.getOrderId(), order.getNumber(),
                outcome.from(), outcome.to());
        if (outcome.lateReturn()) {
            log.warn("[STATE] order={} returned {} day(s) late", order.getOrderId(), outcome.daysLate());
        }
        if (outcome.lateCancellation()) {
            log.warn("[STATE] order={} cancelled less than 2 days before rental date {}, penalty may apply",
                    order.getOrderId(), order.getRentalDate());
        }
    }

    @Override
    public void onTerminalExit(RentalOrder order, OrderState terminalState, OrderState restoredState) {
        log.warn("[STATE] order={} leaving terminal state {} for {}", order.getOrderId(), terminalState, restoredState);
    }

    @Override
    public void onRestore(RentalOrder order, OrderState fromState, OrderState restoredState) {
        log.info("[STATE] order={} number={} {} -> {} (undo)", order.getOrderId(), order.getNumber(),
                fromState, restoredState);
    }
}
