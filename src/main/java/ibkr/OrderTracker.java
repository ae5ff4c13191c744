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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Authoritative view of every order this session placed or discovered, keyed by gateway order id.
 *
 * <p>Status callbacks merge into the existing record. A record that reached FILLED, CANCELLED or
 * REJECTED is never changed again, so a stale callback arriving out of order can't revive it.
 * Records are immutable snapshots; readers always get a consistent copy.
 */
public class OrderTracker {
    private static final Logger log = LoggerFactory.getLogger(OrderTracker.class);
    private static final Logger orderLog = LoggerFactory.getLogger("ORDER_AUDIT");

    private final Map<Integer, OrderRecord> orders = new HashMap<>();
    private final Map<Integer, OrderStatusListener> listeners = new ConcurrentHashMap<>();
    private final Clock clock;

    public OrderTracker(Clock clock) {
        this.clock = clock;
    }

    /**
     * Inserts the PENDING record before the order goes out, so a fast status callback always finds it.
     */
    public OrderRecord registerPending(int orderId, String symbol, OrderSide side, BigDecimal quantity, OrderType type,
                                       Double limitPrice, Double stopPrice, TimeInForce tif,
                                       OrderStatusListener listener) {
        Instant now = clock.instant();
        OrderRecord record = OrderRecord.builder()
                .orderId(orderId)
                .symbol(symbol)
                .side(side)
                .quantity(quantity)
                .orderType(type)
                .limitPrice(limitPrice)
                .stopPrice(stopPrice)
                .timeInForce(tif)
                .status(OrderStatus.PENDING)
                .submittedAt(now)
                .updatedAt(now)
                .build();
        synchronized (orders) {
            if (orders.containsKey(orderId)) {
                throw new IllegalStateException("Order id " + orderId + " already in use");
            }
            orders.put(orderId, record);
        }
        if (listener != null) {
            listeners.put(orderId, listener);
        }
        return record;
    }

    /**
     * Merges an orderStatus callback. Unknown ids are ignored: orders placed elsewhere are learned
     * from open-order callbacks, which carry the contract.
     */
    public Optional<OrderRecord> onOrderStatus(int orderId, String wireStatus, BigDecimal filled, BigDecimal remaining,
                                               double avgFillPrice) {
        OrderStatus status = OrderStatus.fromWire(wireStatus, filled, remaining);
        if (status == null) {
            log.warn("Unknown order status '{}' for order {}", wireStatus, orderId);
        }
        OrderRecord updated;
        synchronized (orders) {
            OrderRecord current = orders.get(orderId);
            if (current == null) {
                log.debug("Status {} for unknown order {} ignored", wireStatus, orderId);
                return Optional.empty();
            }
            if (current.getStatus().isTerminal()) {
                log.debug("Order {} already {} - ignoring late status {}", orderId, current.getStatus(), wireStatus);
                return Optional.of(current);
            }
            OrderRecord.OrderRecordBuilder builder = current.toBuilder().updatedAt(clock.instant());
            if (status != null && !(status == OrderStatus.PENDING && current.getStatus() != OrderStatus.PENDING)) {
                builder.status(status);
            }
            if (filled != null && filled.compareTo(current.getFilledQuantity()) > 0) {
                builder.filledQuantity(filled);
            }
            if (avgFillPrice > 0) {
                builder.avgFillPrice(avgFillPrice);
            }
            updated = builder.build();
            orders.put(orderId, updated);
        }
        orderLog.info("ORDER_STATUS | orderId={} | status={} | filled={} | remaining={} | avgFillPrice={}",
                orderId, wireStatus, filled, remaining, avgFillPrice);
        notifyListener(updated);
        return Optional.of(updated);
    }

    /**
     * Merges an openOrder callback, inserting orders this session did not place itself.
     */
    public OrderRecord onOpenOrder(int orderId, ContractSpec contract, OrderTicket ticket, String wireStatus) {
        OrderStatus status = OrderStatus.fromWire(wireStatus, null, null);
        OrderRecord result;
        boolean discovered = false;
        synchronized (orders) {
            OrderRecord current = orders.get(orderId);
            if (current == null) {
                Instant now = clock.instant();
                result = OrderRecord.builder()
                        .orderId(orderId)
                        .symbol(contract.getSymbol())
                        .side(OrderSide.fromWire(ticket.getAction()))
                        .quantity(ticket.getTotalQuantity())
                        .orderType(OrderType.fromWire(ticket.getOrderType()))
                        .limitPrice(ticket.getLmtPrice())
                        .stopPrice(ticket.getAuxPrice())
                        .timeInForce(parseTif(ticket.getTif()))
                        .status(status != null ? status : OrderStatus.SUBMITTED)
                        .submittedAt(now)
                        .updatedAt(now)
                        .discovered(true)
                        .build();
                orders.put(orderId, result);
                discovered = true;
            } else if (!current.getStatus().isTerminal() && status != null && status != OrderStatus.PENDING) {
                result = current.toBuilder().status(status).updatedAt(clock.instant()).build();
                orders.put(orderId, result);
            } else {
                result = current;
            }
        }
        if (discovered) {
            orderLog.info("OPEN_ORDER | orderId={} | symbol={} | action={} | qty={} | type={} | status={}",
                    orderId, contract.getSymbol(), ticket.getAction(), ticket.getTotalQuantity(),
                    ticket.getOrderType(), wireStatus);
        }
        return result;
    }

    /**
     * Applies an order-scoped gateway error. Returns false when the id is not a known order.
     *
     * <p>Only rejection, request-terminal and no-security-definition codes end the order. Anything else
     * is kept as the order's error message and later status callbacks still apply.
     */
    public boolean onOrderError(int orderId, GatewayError error) {
        OrderRecord updated;
        synchronized (orders) {
            OrderRecord current = orders.get(orderId);
            if (current == null) {
                return false;
            }
            if (current.getStatus().isTerminal()) {
                log.debug("Order {} already {} - error {} not applied", orderId, current.getStatus(), error.getCode());
                return true;
            }
            OrderRecord.OrderRecordBuilder builder = current.toBuilder()
                    .errorMessage(error.getMessage())
                    .updatedAt(clock.instant());
            if (error.getCode() == ErrorCodes.ORDER_CANCELLED) {
                builder.status(OrderStatus.CANCELLED);
            } else if (endsOrder(error)) {
                builder.status(OrderStatus.REJECTED);
            }
            updated = builder.build();
            orders.put(orderId, updated);
        }
        orderLog.info("ORDER_ERROR | orderId={} | code={} | msg={} | status={}",
                orderId, error.getCode(), error.getMessage(), updated.getStatus());
        notifyListener(updated);
        return true;
    }

    /**
     * Marks an order rejected before it reached the gateway, e.g. when the send itself failed.
     */
    public void markRejected(int orderId, String reason) {
        onOrderError(orderId, GatewayError.of(orderId, ErrorCodes.ORDER_REJECTED, reason,
                ErrorCategory.ORDER_REJECTED));
    }

    private static boolean endsOrder(GatewayError error) {
        switch (error.getCategory()) {
            case ORDER_REJECTED:
                return !ErrorCodes.ORDER_UNAFFECTED.contains(error.getCode());
            case REQUEST_TERMINAL:
            case NO_SECURITY_DEFINITION:
                return true;
            default:
                return false;
        }
    }

    public boolean contains(int orderId) {
        synchronized (orders) {
            return orders.containsKey(orderId);
        }
    }

    public Optional<OrderRecord> get(int orderId) {
        synchronized (orders) {
            return Optional.ofNullable(orders.get(orderId));
        }
    }

    public List<OrderRecord> all() {
        synchronized (orders) {
            return orders.values().stream()
                    .sorted(Comparator.comparingInt(OrderRecord::getOrderId))
                    .collect(Collectors.toList());
        }
    }

    public List<OrderRecord> active() {
        List<OrderRecord> result = new ArrayList<>();
        for (OrderRecord order : all()) {
            if (!order.getStatus().isTerminal()) {
                result.add(order);
            }
        }
        return result;
    }

    private void notifyListener(OrderRecord order) {
        OrderStatusListener listener = listeners.get(order.getOrderId());
        if (listener == null) {
            return;
        }
        try {
            listener.onOrderUpdate(order);
        } catch (RuntimeException e) {
            log.error("Error in order listener for order {}: {}", order.getOrderId(), e.getMessage(), e);
        }
        if (order.getStatus().isTerminal()) {
            listeners.remove(order.getOrderId());
        }
    }

    private static TimeInForce parseTif(String tif) {
        if (tif == null || tif.isBlank()) {
            return TimeInForce.DAY;
        }
        try {
            return TimeInForce.valueOf(tif.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return TimeInForce.DAY;
        }
    }
}
