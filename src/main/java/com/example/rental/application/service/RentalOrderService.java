package com.example.rental.application.service;

import com.example.rental.application.command.CancelOrderCommand;
import com.example.rental.application.command.CommandBoundary;
import com.example.rental.application.command.CommandExecutor;
import com.example.rental.application.command.CommandRecord;
import com.example.rental.application.command.TransitionCommand;
import com.example.rental.application.command.TransitionCommandFactory;
import com.example.rental.application.dto.CreateRentalOrderCommand;
import com.example.rental.application.dto.RentalOrderResult;
import com.example.rental.application.event.OrderEventBus;
import com.example.rental.application.event.OrderEventType;
import com.example.rental.application.port.in.RentalOrderUseCase;
import com.example.rental.application.port.out.RentalItemPort;
import com.example.rental.application.port.out.RentalOrderPort;
import com.example.rental.application.port.out.SequenceGenerator;
import com.example.rental.domain.exception.InvalidRentalDateException;
import com.example.rental.domain.exception.ItemUnavailableException;
import com.example.rental.domain.exception.OrderNotDeletableException;
import com.example.rental.domain.exception.OrderNotFoundException;
import com.example.rental.domain.model.ItemId;
import com.example.rental.domain.model.Money;
import com.example.rental.domain.model.OrderId;
import com.example.rental.domain.model.RentalItem;
import com.example.rental.domain.model.RentalOrder;
import com.example.rental.domain.statemachine.OrderStateMachine;
import com.example.rental.domain.statemachine.StateInfo;
import com.example.rental.domain.statemachine.TransitionOutcome;
import io.github.resilience4j.retry.annotation.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Application service tying together order numbering, lifecycle commands and event fan-out.
 * <p>
 * Each write runs in one transaction; history is updated and events are published only
 * after it commits.
 */
@Service
public class RentalOrderService implements RentalOrderUseCase {

    private static final Logger log = LoggerFactory.getLogger(RentalOrderService.class);

    static final String ORDER_COUNTER = "rental-order";

    private final RentalOrderPort orderPort;
    private final RentalItemPort itemPort;
    private final SequenceGenerator sequenceGenerator;
    private final OrderStateMachine stateMachine;
    private final CommandExecutor commandExecutor;
    private final TransitionCommandFactory commandFactory;
    private final OrderEventBus eventBus;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final CommandBoundary transactional;

    public RentalOrderService(
            RentalOrderPort orderPort,
            RentalItemPort itemPort,
            SequenceGenerator sequenceGenerator,
            OrderStateMachine stateMachine,
            CommandExecutor commandExecutor,
            TransitionCommandFactory commandFactory,
            OrderEventBus eventBus,
            TransactionTemplate transactionTemplate,
            Clock clock) {
        this.orderPort = orderPort;
        this.itemPort = itemPort;
        this.sequenceGenerator = sequenceGenerator;
        this.stateMachine = stateMachine;
        this.commandExecutor = commandExecutor;
        this.commandFactory = commandFactory;
        this.eventBus = eventBus;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
        this.transactional = this::inTransaction;
    }

    @Override
    @Retry(name = "sequenceRetry")
    public RentalOrderResult createOrder(CreateRentalOrderCommand command) {
        LocalDate today = LocalDate.now(clock);
        if (command.rentalDate().isBefore(today)) {
            throw new InvalidRentalDateException(command.rentalDate(), today);
        }
        Set<ItemId> itemIds = command.itemIds().stream()
                .map(ItemId::of)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        requireAvailable(itemIds);

        long number = sequenceGenerator.next(ORDER_COUNTER);
        log.debug("Order number {} issued for customer {}", number, command.customerId());

        RentalOrder created = inTransaction(() -> {
            List<RentalItem> items = requireAvailable(itemIds);
            items.forEach(RentalItem::markRented);
            itemPort.saveAll(items);
            return orderPort.save(RentalOrder.create(number, command.rentalDate(), Money.of(command.total()),
                    command.customerId(), command.staffId(), itemIds, clock.instant()));
        });
        log.info("Rental order created: {} number={} items={}", created.getOrderId(), number, itemIds.size());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("newState", created.getState().name());
        metadata.put("number", number);
        eventBus.notify(OrderEventType.ORDER_CREATED, created, metadata).join();
        return RentalOrderResult.from(created);
    }

    private List<RentalItem> requireAvailable(Set<ItemId> itemIds) {
        List<RentalItem> items = itemPort.findAllById(itemIds);
        Set<ItemId> found = items.stream().map(RentalItem::getItemId).collect(Collectors.toSet());
        List<ItemId> missing = itemIds.stream().filter(id -> !found.contains(id)).toList();
        List<ItemId> unavailable = items.stream().filter(item -> !item.isAvailable()).map(RentalItem::getItemId).toList();
        if (!missing.isEmpty() || !unavailable.isEmpty()) {
            throw new ItemUnavailableException(unavailable, missing);
        }
        return items;
    }

    @Override
    public RentalOrderResult confirm(OrderId orderId) {
        return runTransition(commandFactory.confirm(orderId), OrderEventType.ORDER_CONFIRMED);
    }

    @Override
    public RentalOrderResult deliver(OrderId orderId) {
        return runTransition(commandFactory.deliver(orderId), OrderEventType.ORDER_DELIVERED);
    }

    @Override
    public RentalOrderResult returnOrder(OrderId orderId) {
        return runTransition(commandFactory.returnOrder(orderId), OrderEventType.ORDER_RETURNED);
    }

    @Override
    public RentalOrderResult cancel(OrderId orderId, String reason) {
        return runTransition(commandFactory.cancel(orderId, reason), OrderEventType.ORDER_CANCELLED);
    }

    private RentalOrderResult runTransition(TransitionCommand command, OrderEventType eventType) {
        RentalOrder order = commandExecutor.execute(command, transactional);
        TransitionOutcome outcome = command.outcome()
                .orElseThrow(() -> new IllegalStateException(command.name() + " executed without an outcome"));

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("previousState", outcome.from().name());
        metadata.put("newState", outcome.to().name());
        switch (eventType) {
            case ORDER_RETURNED -> {
                metadata.put("returnDate", outcome.returnDate().toString());
                metadata.put("elapsedDays", outcome.elapsedDays());
                metadata.put("lateReturn", outcome.lateReturn());
                metadata.put("daysLate", outcome.daysLate());
            }
            case ORDER_CANCELLED -> {
                CancelOrderCommand cancel = (CancelOrderCommand) command;
                metadata.put("reason", cancel.reason());
                metadata.put("releasedItems", cancel.releasedItems().stream().map(ItemId::getValue).toList());
                metadata.put("lateCancellation", outcome.lateCancellation());
            }
            default -> {
            }
        }

        List<CompletableFuture<Void>> publications = new ArrayList<>();
        publications.add(eventBus.notify(eventType, order, metadata));
        if (outcome.lateReturn()) {
            log.warn("Late return on order {}: {} day(s) past the grace period", order.getOrderId(), outcome.daysLate());
            publications.add(eventBus.notify(OrderEventType.LATE_RETURN, order, metadata));
        }
        publications.forEach(CompletableFuture::join);
        return RentalOrderResult.from(order);
    }

    @Override
    public CommandRecord undo() {
        return commandExecutor.undo(transactional);
    }

    @Override
    public CommandRecord redo() {
        return commandExecutor.redo(transactional);
    }

    @Override
    public List<CommandRecord> getHistory() {
        return commandExecutor.getHistory();
    }

    @Override
    public boolean canUndo() {
        return commandExecutor.canUndo();
    }

    @Override
    public boolean canRedo() {
        return commandExecutor.canRedo();
    }

    @Override
    public StateInfo getStateInfo(OrderId orderId) {
        return stateMachine.describe(load(orderId));
    }

    @Override
    public RentalOrderResult getOrder(OrderId orderId) {
        return RentalOrderResult.from(load(orderId));
    }

    @Override
    public void deleteOrder(OrderId orderId) {
        inTransaction(() -> {
            RentalOrder order = load(orderId);
            if (!stateMachine.canDelete(order)) {
                throw new OrderNotDeletableException(orderId, order.getState());
            }
            List<RentalItem> items = itemPort.findAllById(order.getItemIds());
            items.forEach(RentalItem::markAvailable);
            itemPort.saveAll(items);
            orderPort.delete(orderId);
            return order;
        });
        log.info("Rental order deleted: {}", orderId);
    }

    private RentalOrder load(OrderId orderId) {
        return orderPort.findById(orderId).orElseThrow(() -> new OrderNotFoundException(orderId));
    }

    private <T> T inTransaction(Supplier<T> work) {
        return transactionTemplate.execute(status -> work.get());
    }
}
