package ibkr.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder(toBuilder = true)
public class OrderRecord {
    int orderId;
    String symbol;
    OrderSide side;
    BigDecimal quantity;
    OrderType orderType;
    Double limitPrice;
    Double stopPrice;
    TimeInForce timeInForce;
    OrderStatus status;
    @Builder.Default
    BigDecimal filledQuantity = BigDecimal.ZERO;
    double avgFillPrice;
    Instant submittedAt;
    Instant updatedAt;
    String errorMessage;
    /** true when the order was first seen in an open-orders snapshot rather than placed by this session */
    boolean discovered;
}
