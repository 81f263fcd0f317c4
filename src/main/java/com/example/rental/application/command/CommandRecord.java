package com.example.rental.application.command;

import com.example.rental.domain.model.OrderSnapshot;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Audit entry for one executed command.
 *
 * @param commandName  command name, e.g. {@code CancelOrder}
 * @param params       command parameters at execution time
 * @param executedAt   when it ran
 * @param result       order state right after execution
 * @param errorMessage last undo/redo failure, if any
 */
public record CommandRecord(
        String commandName,
        Map<String, Object> params,
        Instant executedAt,
        OrderSnapshot result,
        String errorMessage
) {
    public CommandRecord {
        Objects.requireNonNull(commandName, "CommandName cannot be null");
        Objects.requireNonNull(executedAt, "ExecutedAt cannot be null");
        params = params == null ? Map.of() : Map.copyOf(params);
    }

    public static CommandRecord of(TransitionCommand command, Instant executedAt, OrderSnapshot result) {
        return new CommandRecord(command.name(), command.params(), executedAt, result, null);
    }

    public CommandRecord withError(String message) {
        return new CommandRecord(commandName, params, executedAt, result, message);
    }

    public Optional<OrderSnapshot> resultSnapshot() {
        return Optional.ofNullable(result);
    }

    public Optional<String> error() {
        return Optional.ofNullable(errorMessage);
    }
}
