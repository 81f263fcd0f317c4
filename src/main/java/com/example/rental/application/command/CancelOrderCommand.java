package com.example.rental.application.command;

import com.example.rental.application.port.out.RentalItemPort;
import com.example.rental.application.port.out.RentalOrderPort;
import com.example.rental.domain.model.ItemId;
import com.example.rental.domain.model.OrderId;
import com.example.rental.domain.model.RentalItem;
import com.example.rental.domain.model.RentalOrder;
import com.example.rental.domain.statemachine.OrderStateMachine;
import com.example.rental.domain.statemachine.TransitionAction;
import com.example.rental.domain.statemachine.TransitionOutcome;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Cancels the order and releases its items. Undo puts each item's availability flag back
 * to what it was before the cancellation.
 */
public class CancelOrderCommand extends AbstractTransitionCommand {

    private final RentalItemPort itemPort;
    private final String reason;
    private final Map<ItemId, Boolean> availabilityBefore = new LinkedHashMap<>();

    public CancelOrderCommand(OrderId orderId, String reason, RentalOrderPort orderPort,
                              RentalItemPort itemPort, OrderStateMachine stateMachine) {
        super(orderId, TransitionAction.CANCEL, orderPort, stateMachine);
        this.itemPort = Objects.requireNonNull(itemPort, "ItemPort cannot be null");
        this.reason = reason == null || reason.isBlank() ? "not specified" : reason;
    }

    @Override
    protected void beforeApply(RentalOrder order) {
        availabilityBefore.clear();
        for (RentalItem item : itemPort.findAllById(order.getItemIds())) {
            availabilityBefore.put(item.getItemId(), item.isAvailable());
        }
    }

    @Override
    protected void afterApply(RentalOrder order, TransitionOutcome outcome) {
        List<RentalItem> items = itemPort.findAllById(order.getItemIds());
        items.forEach(RentalItem::markAvailable);
        itemPort.saveAll(items);
    }

    @Override
    protected void afterUndo(RentalOrder order) {
        List<RentalItem> items = itemPort.findAllById(availabilityBefore.keySet());
        for (RentalItem item : items) {
            item.restoreAvailability(availabilityBefore.get(item.getItemId()));
        }
        itemPort.saveAll(items);
    }

    public String reason() {
        return reason;
    }

    /**
     * Items whose availability was captured by the last execution.
     */
    public List<ItemId> releasedItems() {
        return new ArrayList<>(availabilityBefore.keySet());
    }

    @Override
    public String name() {
        return "CancelOrder";
    }

    @Override
    public Map<String, Object> params() {
        Map<String, Object> params = super.params();
        params.put("reason", reason);
        outcome().ifPresent(o -> params.put("lateCancellation", o.lateCancellation()));
        return params;
    }
}
