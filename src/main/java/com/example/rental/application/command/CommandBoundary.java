package com.example.rental.application.command;

import com.example.rental.domain.model.RentalOrder;

import java.util.function.Supplier;

/**
 * Unit of work a command step runs in. It returns only once the step's changes are durable,
 * so history is updated after a successful commit and never for a rolled-back step.
 */
@FunctionalInterface
public interface CommandBoundary {

    /**
     * Runs the step in the caller's thread with no surrounding unit of work.
     */
    CommandBoundary DIRECT = Supplier::get;

    RentalOrder run(Supplier<RentalOrder> step);
}
