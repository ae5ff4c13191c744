package ibkr.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class Execution {
    String execId;
    int orderId;
    String account;
    String symbol;
    String secType;
    OrderSide side;
    BigDecimal shares;
    double price;
    double avgPrice;
    Instant time;

    /** shares signed by direction, positive for buys */
    public BigDecimal signedShares() {
        return side == OrderSide.SELL ? shares.negate() : shares;
    }
}
