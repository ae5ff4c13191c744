package ibkr.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder(toBuilder = true)
public class Position {
    String account;
    String symbol;
    String secType;
    /** signed, negative for short positions */
    BigDecimal quantity;
    double averageCost;
    /** only filled by portfolio updates */
    Double marketPrice;
    Double marketValue;
    Double unrealizedPnl;
    Double realizedPnl;
    /** first time a nonzero quantity was observed, or the opening execution when known */
    Instant entryTime;

    public boolean isLong() {
        return quantity != null && quantity.signum() > 0;
    }

    public boolean isFlat() {
        return quantity == null || quantity.signum() == 0;
    }
}
