package ibkr;

import ibkr.model.ErrorCategory;
import ibkr.model.GatewayError;
import ibkr.model.OrderRecord;
import ibkr.model.OrderSide;
import ibkr.model.OrderStatus;
import ibkr.model.OrderType;
import ibkr.model.TimeInForce;
import ibkr.wire.ContractSpec;
import ibkr.wire.OrderTicket;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class OrderTrackerTest {
    private static final Instant T0 = Instant.parse("2024-01-15T14:30:00Z");

    private MutableClock clock;
    private OrderTracker tracker;
    private OrderStatusListener listener;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        tracker = new OrderTracker(clock);
        listener = mock(OrderStatusListener.class);
    }

    private void placeBuy(int orderId) {
        tracker.registerPending(orderId, "AAPL", OrderSide.BUY, BigDecimal.valueOf(100), OrderType.LIMIT, 150.0, null,
                TimeInForce.DAY, listener);
    }

    @Test
    void registeredOrderStartsPending() {
        placeBuy(10);

        OrderRecord record = tracker.get(10).orElseThrow();
        assertThat(record.getStatus()).isEqualTo(OrderStatus.PENDING);
        assertThat(record.getSubmittedAt()).isEqualTo(T0);
        assertThat(record.getFilledQuantity()).isEqualByComparingTo("0");
        assertThat(tracker.active()).extracting(OrderRecord::getOrderId).containsExactly(10);
    }

    @Test
    void duplicateOrderIdIsRefused() {
        placeBuy(10);

        assertThatThrownBy(() -> placeBuy(10)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void partialThenFullFill() {
        placeBuy(10);
        clock.advance(Duration.ofSeconds(5));

        tracker.onOrderStatus(10, "Submitted", BigDecimal.valueOf(40), BigDecimal.valueOf(60), 149.9);
        assertThat(tracker.get(10).get().getStatus()).isEqualTo(OrderStatus.PARTIALLY_FILLED);
        assertThat(tracker.get(10).get().getUpdatedAt()).isEqualTo(T0.plusSeconds(5));

        tracker.onOrderStatus(10, "Filled", BigDecimal.valueOf(100), BigDecimal.ZERO, 149.95);

        OrderRecord record = tracker.get(10).get();
        assertThat(record.getStatus()).isEqualTo(OrderStatus.FILLED);
        assertThat(record.getFilledQuantity()).isEqualByComparingTo("100");
        assertThat(record.getAvgFillPrice()).isEqualTo(149.95);
        verify(listener, times(2)).onOrderUpdate(any());
        assertThat(tracker.active()).isEmpty();
    }

    @Test
    void terminalStatusAbsorbsLaterUpdates() {
        placeBuy(10);
        tracker.onOrderStatus(10, "Filled", BigDecimal.valueOf(100), BigDecimal.ZERO, 150.0);

        Optional<OrderRecord> late = tracker.onOrderStatus(10, "Submitted", BigDecimal.ZERO, BigDecimal.valueOf(100), 0);

        assertThat(late.get().getStatus()).isEqualTo(OrderStatus.FILLED);
        assertThat(tracker.get(10).get().getStatus()).isEqualTo(OrderStatus.FILLED);
        verify(listener, times(1)).onOrderUpdate(any());
    }

    @Test
    void pendingSubmitDoesNotMoveAcceptedOrderBack() {
        placeBuy(10);
        tracker.onOrderStatus(10, "Submitted", BigDecimal.ZERO, BigDecimal.valueOf(100), 0);

        tracker.onOrderStatus(10, "PendingSubmit", BigDecimal.ZERO, BigDecimal.valueOf(100), 0);

        assertThat(tracker.get(10).get().getStatus()).isEqualTo(OrderStatus.SUBMITTED);
    }

    @Test
    void inactiveIsNotTerminal() {
        placeBuy(10);
        tracker.onOrderStatus(10, "Inactive", BigDecimal.ZERO, BigDecimal.valueOf(100), 0);
        assertThat(tracker.get(10).get().getStatus()).isEqualTo(OrderStatus.INACTIVE);

        tracker.onOrderStatus(10, "Submitted", BigDecimal.ZERO, BigDecimal.valueOf(100), 0);

        assertThat(tracker.get(10).get().getStatus()).isEqualTo(OrderStatus.SUBMITTED);
    }

    @Test
    void statusForUnknownOrderIsIgnored() {
        assertThat(tracker.onOrderStatus(99, "Filled", BigDecimal.ONE, BigDecimal.ZERO, 1.0)).isEmpty();
        assertThat(tracker.all()).isEmpty();
    }

    @Test
    void unknownWireStatusKeepsCurrentStatus() {
        placeBuy(10);

        tracker.onOrderStatus(10, "SomethingNew", BigDecimal.ZERO, BigDecimal.valueOf(100), 0);

        assertThat(tracker.get(10).get().getStatus()).isEqualTo(OrderStatus.PENDING);
    }

    @Test
    void rejectionErrorRejectsWithMessage() {
        placeBuy(10);

        boolean known = tracker.onOrderError(10, GatewayError.of(10, 201, "Order rejected - reason:margin",
                ErrorCategory.ORDER_REJECTED));

        assertThat(known).isTrue();
        assertThat(tracker.get(10).get().getStatus()).isEqualTo(OrderStatus.REJECTED);
        assertThat(tracker.get(10).get().getErrorMessage()).isEqualTo("Order rejected - reason:margin");
        verify(listener).onOrderUpdate(argThat(o -> o.getStatus() == OrderStatus.REJECTED));
    }

    @Test
    void cancelErrorCancels() {
        placeBuy(10);

        tracker.onOrderError(10, GatewayError.of(10, 202, "Order Canceled - reason:", ErrorCategory.ORDER_REJECTED));

        assertThat(tracker.get(10).get().getStatus()).isEqualTo(OrderStatus.CANCELLED);
    }

    @Test
    void failedCancelKeepsOrderAlive() {
        placeBuy(10);
        tracker.onOrderStatus(10, "Submitted", BigDecimal.ZERO, BigDecimal.valueOf(100), 0);

        tracker.onOrderError(10, GatewayError.of(10, 161, "Cancel attempted when order is not in a cancellable state",
                ErrorCategory.ORDER_REJECTED));

        OrderRecord record = tracker.get(10).get();
        assertThat(record.getStatus()).isEqualTo(OrderStatus.SUBMITTED);
        assertThat(record.getErrorMessage()).startsWith("Cancel attempted");
    }

    @Test
    void unclassifiedErrorOnlyRecordsTheMessage() {
        placeBuy(10);
        tracker.onOrderStatus(10, "Submitted", BigDecimal.ZERO, BigDecimal.valueOf(100), 0);

        tracker.onOrderError(10, GatewayError.of(10, 10311, "Order routed to an unusual destination",
                ErrorCategory.UNCLASSIFIED));
        tracker.onOrderStatus(10, "Filled", BigDecimal.valueOf(100), BigDecimal.ZERO, 150.25);

        OrderRecord record = tracker.get(10).get();
        assertThat(record.getStatus()).isEqualTo(OrderStatus.FILLED);
        assertThat(record.getAvgFillPrice()).isEqualTo(150.25);
        assertThat(record.getErrorMessage()).isEqualTo("Order routed to an unusual destination");
    }

    @Test
    void cancelNotFoundKeepsOrderAlive() {
        placeBuy(10);

        tracker.onOrderError(10, GatewayError.of(10, 10147, "OrderId 10 that needs to be cancelled is not found.",
                ErrorCategory.ORDER_REJECTED));

        assertThat(tracker.get(10).get().getStatus()).isEqualTo(OrderStatus.PENDING);
        assertThat(tracker.active()).extracting(OrderRecord::getOrderId).containsExactly(10);
    }

    @Test
    void noSecurityDefinitionRejectsTheOrder() {
        placeBuy(10);

        tracker.onOrderError(10, GatewayError.of(10, 200, "No security definition has been found",
                ErrorCategory.NO_SECURITY_DEFINITION));

        assertThat(tracker.get(10).get().getStatus()).isEqualTo(OrderStatus.REJECTED);
    }

    @Test
    void errorAfterFillLeavesRecordUntouched() {
        placeBuy(10);
        tracker.onOrderStatus(10, "Filled", BigDecimal.valueOf(100), BigDecimal.ZERO, 150.0);

        assertThat(tracker.onOrderError(10, GatewayError.of(10, 202, "Order Canceled", ErrorCategory.ORDER_REJECTED)))
                .isTrue();

        assertThat(tracker.get(10).get().getStatus()).isEqualTo(OrderStatus.FILLED);
        assertThat(tracker.get(10).get().getErrorMessage()).isNull();
    }

    @Test
    void errorForUnknownOrderReturnsFalse() {
        assertThat(tracker.onOrderError(5, GatewayError.of(5, 201, "rejected", ErrorCategory.ORDER_REJECTED)))
                .isFalse();
    }

    @Test
    void openOrderDiscoversForeignOrder() {
        ContractSpec contract = ContractSpec.builder().symbol("MSFT").secType("STK").build();
        OrderTicket ticket = OrderTicket.builder().action("SELL").totalQuantity(BigDecimal.valueOf(20))
                .orderType("STP").auxPrice(380.0).tif("GTC").build();

        OrderRecord record = tracker.onOpenOrder(42, contract, ticket, "Submitted");

        assertThat(record.isDiscovered()).isTrue();
        assertThat(record.getSide()).isEqualTo(OrderSide.SELL);
        assertThat(record.getOrderType()).isEqualTo(OrderType.STOP);
        assertThat(record.getStopPrice()).isEqualTo(380.0);
        assertThat(record.getTimeInForce()).isEqualTo(TimeInForce.GTC);
        assertThat(record.getStatus()).isEqualTo(OrderStatus.SUBMITTED);
        assertThat(tracker.contains(42)).isTrue();
    }

    @Test
    void openOrderUpdatesKnownOrderWithoutTouchingTerminal() {
        placeBuy(10);
        ContractSpec contract = ContractSpec.builder().symbol("AAPL").build();
        OrderTicket ticket = OrderTicket.builder().action("BUY").totalQuantity(BigDecimal.valueOf(100))
                .orderType("LMT").lmtPrice(150.0).build();

        OrderRecord submitted = tracker.onOpenOrder(10, contract, ticket, "PreSubmitted");
        assertThat(submitted.getStatus()).isEqualTo(OrderStatus.SUBMITTED);
        assertThat(submitted.isDiscovered()).isFalse();

        tracker.onOrderStatus(10, "Cancelled", BigDecimal.ZERO, BigDecimal.valueOf(100), 0);
        OrderRecord after = tracker.onOpenOrder(10, contract, ticket, "Submitted");

        assertThat(after.getStatus()).isEqualTo(OrderStatus.CANCELLED);
    }

    @Test
    void markRejectedFailsOrderThatCouldNotBeSent() {
        placeBuy(10);

        tracker.markRejected(10, "Send failed: socket closed");

        assertThat(tracker.get(10).get().getStatus()).isEqualTo(OrderStatus.REJECTED);
    }

    @Test
    void ordersWithoutListenerAreNotNotified() {
        tracker.registerPending(11, "AAPL", OrderSide.SELL, BigDecimal.ONE, OrderType.MARKET, null, null,
                TimeInForce.DAY, null);

        tracker.onOrderStatus(11, "Filled", BigDecimal.ONE, BigDecimal.ZERO, 10.0);

        verify(listener, never()).onOrderUpdate(any());
        assertThat(tracker.all()).extracting(OrderRecord::getStatus).containsExactly(OrderStatus.FILLED);
    }
}
