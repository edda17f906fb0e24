package com.ivamare.eventsourcing.testdomain;

import com.ivamare.eventsourcing.aggregate.AggregateType;
import com.ivamare.eventsourcing.aggregate.Command;
import com.ivamare.eventsourcing.aggregate.ConstructorCommand;
import com.ivamare.eventsourcing.aggregate.EventSourcedAggregate;
import com.ivamare.eventsourcing.handler.CommandHandler;
import com.ivamare.eventsourcing.model.Event;
import com.ivamare.eventsourcing.model.ValidationReport;
import com.ivamare.eventsourcing.policy.RetryPolicy;
import com.ivamare.eventsourcing.scheduler.CommandFailed;
import com.ivamare.eventsourcing.snapshot.SnapshotSupport;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Sample aggregate used across the tests.
 */
public class Order extends EventSourcedAggregate {

    public static final AggregateType<Order> TYPE = type(PaymentGateway.accepting());

    private final AggregateType<Order> type;

    private String customerName;
    private final Map<String, Integer> items = new LinkedHashMap<>();
    private boolean cancelled;
    private String cancellationReason;
    private boolean shipped;
    private BigDecimal charged = BigDecimal.ZERO;

    Order(UUID id, AggregateType<Order> type) {
        super(id);
        this.type = type;
    }

    /**
     * Registration of the order aggregate charging cards through {@code gateway}.
     */
    public static AggregateType<Order> type(PaymentGateway gateway) {
        AtomicReference<AggregateType<Order>> self = new AtomicReference<>();
        AggregateType<Order> type = AggregateType.builder(Order.class, id -> new Order(id, self.get()))
            .event(Created.class, (order, e) -> order.customerName = e.customerName)
            .event(ItemAdded.class, (order, e) -> order.items.merge(e.productName, e.quantity, Integer::sum))
            .event(CustomerInfoChanged.class, (order, e) -> order.customerName = e.customerName)
            .event(Cancelled.class, (order, e) -> {
                order.cancelled = true;
                order.cancellationReason = e.reason;
            })
            .event(Shipped.class, (order, e) -> order.shipped = true)
            .event(CreditCardCharged.class, (order, e) -> order.charged = order.charged.add(e.amount))
            .command(CreateOrder.class, (order, cmd) -> order.recordEvent(new Created(cmd.customerName)))
            .command(AddItem.class, (order, cmd) -> order.recordEvent(new ItemAdded(cmd.productName, cmd.quantity)))
            .command(ChangeCustomerInfo.class, (order, cmd) -> order.recordEvent(new CustomerInfoChanged(cmd.customerName)))
            .command(Cancel.class, (order, cmd) -> order.recordEvent(new Cancelled(cmd.reason)))
            .command(Ship.class, (order, cmd) -> order.recordEvent(new Shipped()))
            .command(ScheduleShipment.class, (order, cmd) -> order.scheduleCommand(new Ship(), cmd.shipAt))
            .command(ChargeCreditCard.class, new ChargeCreditCardHandler(gateway), RetryPolicy.of(5, Duration.ofHours(1)))
            .snapshots(SnapshotSupport.of(State.class, Order::captureState, Order::restoreState))
            .build();
        self.set(type);
        return type;
    }

    @Override
    protected AggregateType<Order> aggregateType() {
        return type;
    }

    public String getCustomerName() {
        return customerName;
    }

    public Map<String, Integer> getItems() {
        return Map.copyOf(items);
    }

    public int quantityOf(String productName) {
        return items.getOrDefault(productName, 0);
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public String getCancellationReason() {
        return cancellationReason;
    }

    public boolean isShipped() {
        return shipped;
    }

    public BigDecimal getCharged() {
        return charged;
    }

    void cancelBecause(String reason) {
        recordEvent(new Cancelled(reason));
    }

    private State captureState() {
        return new State(customerName, new LinkedHashMap<>(items), cancelled, shipped);
    }

    private void restoreState(State state) {
        customerName = state.customerName();
        items.clear();
        items.putAll(state.items());
        cancelled = state.cancelled();
        shipped = state.shipped();
    }

    public record State(String customerName, Map<String, Integer> items, boolean cancelled, boolean shipped) {
    }

    // --- Events ---

    public static class Created extends Event {
        public String customerName;

        public Created() {
        }

        public Created(String customerName) {
            this.customerName = customerName;
        }
    }

    public static class ItemAdded extends Event {
        public String productName;
        public int quantity;

        public ItemAdded() {
        }

        public ItemAdded(String productName, int quantity) {
            this.productName = productName;
            this.quantity = quantity;
        }
    }

    public static class CustomerInfoChanged extends Event {
        public String customerName;

        public CustomerInfoChanged() {
        }

        public CustomerInfoChanged(String customerName) {
            this.customerName = customerName;
        }
    }

    public static class Cancelled extends Event {
        public String reason;

        public Cancelled() {
        }

        public Cancelled(String reason) {
            this.reason = reason;
        }
    }

    public static class Shipped extends Event {
    }

    public static class CreditCardCharged extends Event {
        public BigDecimal amount;

        public CreditCardCharged() {
        }

        public CreditCardCharged(BigDecimal amount) {
            this.amount = amount;
        }
    }

    // --- Commands ---

    public static class CreateOrder extends ConstructorCommand<Order> {
        public String customerName;

        public CreateOrder() {
        }

        public CreateOrder(UUID orderId, String customerName) {
            super(orderId);
            this.customerName = customerName;
        }

        @Override
        public ValidationReport validate() {
            return ValidationReport.builder()
                .check(customerName != null && !customerName.isBlank(), "customerName", "Customer name is required")
                .build();
        }
    }

    public static class AddItem extends Command<Order> {
        public String productName;
        public int quantity;

        public AddItem() {
        }

        public AddItem(String productName, int quantity) {
            this.productName = productName;
            this.quantity = quantity;
        }

        @Override
        public ValidationReport validate() {
            return ValidationReport.builder()
                .check(quantity > 0, "quantity", "Quantity must be positive")
                .build();
        }

        @Override
        public ValidationReport validateAgainst(Order order) {
            return ValidationReport.builder()
                .check(!order.isCancelled(), "Order is cancelled")
                .build();
        }
    }

    public static class ChangeCustomerInfo extends Command<Order> {
        public String customerName;

        public ChangeCustomerInfo() {
        }

        public ChangeCustomerInfo(String customerName) {
            this.customerName = customerName;
        }
    }

    public static class Cancel extends Command<Order> {
        public String reason;

        public Cancel() {
        }

        public Cancel(String reason) {
            this.reason = reason;
        }
    }

    public static class Ship extends Command<Order> {

        @Override
        public ValidationReport validateAgainst(Order order) {
            return ValidationReport.builder()
                .check(!order.isCancelled(), "Cancelled orders are not shipped")
                .checkRetryable(!order.getItems().isEmpty(), "Nothing to ship yet")
                .build();
        }
    }

    public static class ScheduleShipment extends Command<Order> {
        public Instant shipAt;

        public ScheduleShipment() {
        }

        public ScheduleShipment(Instant shipAt) {
            this.shipAt = shipAt;
        }
    }

    public static class ChargeCreditCard extends Command<Order> {
        public BigDecimal amount;

        public ChargeCreditCard() {
        }

        public ChargeCreditCard(BigDecimal amount) {
            this.amount = amount;
        }
    }

    /**
     * Charges through the gateway. A declined card is retried daily; the order is cancelled
     * after the third decline.
     */
    static class ChargeCreditCardHandler implements CommandHandler<Order, ChargeCreditCard> {

        static final int MAX_DECLINES = 3;

        private final PaymentGateway gateway;

        ChargeCreditCardHandler(PaymentGateway gateway) {
            this.gateway = gateway;
        }

        @Override
        public void enactCommand(Order order, ChargeCreditCard command) {
            gateway.charge(order.getId(), command.amount);
            order.recordEvent(new CreditCardCharged(command.amount));
        }

        @Override
        public void handleScheduledCommandException(Order order, CommandFailed<ChargeCreditCard> failure) {
            if (failure.getNumberOfPreviousAttempts() < MAX_DECLINES - 1) {
                failure.retry(Duration.ofDays(1));
            } else {
                order.cancelBecause("Payment declined");
                failure.cancel();
            }
        }
    }
}
