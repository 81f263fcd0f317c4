package com.example.rental.application.command;

import com.example.rental.application.exception.RedoFailedException;
import com.example.rental.application.exception.RedoNotAvailableException;
import com.example.rental.application.exception.UndoFailedException;
import com.example.rental.application.exception.UndoNotAvailableException;
import com.example.rental.domain.model.RentalOrder;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Bounded undo stack plus redo stack of executed commands.
 * <p>
 * Pushing a new command clears the redo stack. When full, the oldest entry is dropped.
 * A failed undo leaves the entry on the history stack and a failed redo leaves it on the
 * redo stack, each with the error recorded.
 */
public class CommandHistory {

    public static final int DEFAULT_CAPACITY = 50;

    private final int capacity;
    private final Clock clock;
    private final Deque<Entry> history = new ArrayDeque<>();
    private final Deque<Entry> redo = new ArrayDeque<>();

    public CommandHistory(int capacity, Clock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("History capacity must be at least 1: " + capacity);
        }
        this.capacity = capacity;
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    public synchronized CommandRecord push(TransitionCommand command, RentalOrder result) {
        CommandRecord record = CommandRecord.of(command, clock.instant(), result == null ? null : result.snapshot());
        redo.clear();
        append(new Entry(command, record));
        return record;
    }

    /**
     * Undoes the most recent command and moves it to the redo stack.
     *
     * @return the record of the undone command
     * @throws UndoNotAvailableException if there is nothing to undo
     * @throws UndoFailedException       if the command's undo threw
     */
    public CommandRecord undo() {
        return undo(CommandBoundary.DIRECT);
    }

    /**
     * Undoes the most recent command inside {@code boundary}. The entry moves to the redo
     * stack only when the boundary completes; otherwise it stays on top of the history.
     */
    public synchronized CommandRecord undo(CommandBoundary boundary) {
        Entry entry = history.pollLast();
        if (entry == null) {
            throw new UndoNotAvailableException();
        }
        try {
            boundary.run(() -> {
                entry.command().undo();
                return null;
            });
        } catch (RuntimeException e) {
            history.addLast(entry.failed(e));
            throw new UndoFailedException(entry.command().name(), e);
        }
        redo.addLast(entry);
        return entry.record();
    }

    /**
     * Re-executes the most recently undone command and puts it back on the history stack.
     *
     * @throws RedoNotAvailableException if there is nothing to redo
     * @throws RedoFailedException       if re-execution threw
     */
    public CommandRecord redo() {
        return redo(CommandBoundary.DIRECT);
    }

    /**
     * Re-executes the most recently undone command inside {@code boundary}. The entry returns
     * to the history only when the boundary completes; otherwise it stays on the redo stack.
     */
    public synchronized CommandRecord redo(CommandBoundary boundary) {
        Entry entry = redo.pollLast();
        if (entry == null) {
            throw new RedoNotAvailableException();
        }
        RentalOrder result;
        try {
            result = boundary.run(entry.command()::execute);
        } catch (RuntimeException e) {
            redo.addLast(entry.failed(e));
            throw new RedoFailedException(entry.command().name(), e);
        }
        CommandRecord record = CommandRecord.of(entry.command(), clock.instant(), result.snapshot());
        append(new Entry(entry.command(), record));
        return record;
    }

    private void append(Entry entry) {
        history.addLast(entry);
        while (history.size() > capacity) {
            history.pollFirst();
        }
    }

    public synchronized int size() {
        return history.size();
    }

    public synchronized int redoSize() {
        return redo.size();
    }

    public synchronized boolean canUndo() {
        return !history.isEmpty();
    }

    public synchronized boolean canRedo() {
        return !redo.isEmpty();
    }

    public synchronized void clear() {
        history.clear();
        redo.clear();
    }

    /**
     * Records oldest first.
     */
    public synchronized List<CommandRecord> getHistory() {
        return history.stream().map(Entry::record).toList();
    }

    /**
     * Records in the order they were undone, the next redo last.
     */
    public synchronized List<CommandRecord> getRedoStack() {
        return redo.stream().map(Entry::record).toList();
    }

    public int getCapacity() {
        return capacity;
    }

    private record Entry(TransitionCommand command, CommandRecord record) {
        Entry failed(Throwable error) {
            return new Entry(command, record.withError(error.getMessage()));
        }
    }
}
