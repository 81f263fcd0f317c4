package com.example.rental.application.command;

import com.example.rental.domain.model.RentalOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs transition commands and keeps their undo/redo history.
 */
@Component
public class CommandExecutor {

    private static final Logger log = LoggerFactory.getLogger(CommandExecutor.class);

    private final CommandHistory history;

    @Autowired
    public CommandExecutor(@Value("${rental.command.history-capacity:50}") int capacity, Clock clock) {
        this(new CommandHistory(capacity, clock));
    }

    public CommandExecutor(CommandHistory history) {
        this.history = history;
    }

    /**
     * Executes the command and records it. A failed command is not recorded.
     */
    public RentalOrder execute(TransitionCommand command) {
        return execute(command, CommandBoundary.DIRECT);
    }

    /**
     * Executes the command inside {@code boundary} and records it once the boundary completes.
     * A command whose boundary fails, including at commit, is not recorded.
     */
    public RentalOrder execute(TransitionCommand command, CommandBoundary boundary) {
        log.debug("[CMD] Executing {} on order {}", command.name(), command.orderId());
        RentalOrder result;
        try {
            result = boundary.run(command::execute);
        } catch (RuntimeException e) {
            log.warn("[CMD] {} failed on order {}: {}", command.name(), command.orderId(), e.getMessage());
            throw e;
        }
        history.push(command, result);
        log.info("[CMD] {} executed on order {}, state now {}", command.name(), command.orderId(), result.getState());
        return result;
    }

    /**
     * Executes the commands in order, stopping at the first failure.
     */
    public List<RentalOrder> executeAll(List<? extends TransitionCommand> commands) {
        List<RentalOrder> results = new ArrayList<>(commands.size());
        for (TransitionCommand command : commands) {
            results.add(execute(command));
        }
        return results;
    }

    public CommandRecord undo() {
        return undo(CommandBoundary.DIRECT);
    }

    public CommandRecord undo(CommandBoundary boundary) {
        CommandRecord record = history.undo(boundary);
        log.info("[CMD] Undone {}", record.commandName());
        return record;
    }

    public CommandRecord redo() {
        return redo(CommandBoundary.DIRECT);
    }

    public CommandRecord redo(CommandBoundary boundary) {
        CommandRecord record = history.redo(boundary);
        log.info("[CMD] Redone {}", record.commandName());
        return record;
    }

    public List<CommandRecord> getHistory() {
        return history.getHistory();
    }

    public List<CommandRecord> getRedoStack() {
        return history.getRedoStack();
    }

    public boolean canUndo() {
        return history.canUndo();
    }

    public boolean canRedo() {
        return history.canRedo();
    }

    public int getHistorySize() {
        return history.size();
    }

    public void clearHistory() {
        history.clear();
        log.info("[CMD] History cleared");
    }
}
