package ibkr.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Latest known values of one market data request. Fields stay null until the gateway sends them.
 */
@Value
@Builder(toBuilder = true)
public class Tick {
    int requestId;
    String symbol;
    Double bid;
    Double ask;
    Double last;
    Double high;
    Double low;
    Double close;
    Double open;
    BigDecimal bidSize;
    BigDecimal askSize;
    BigDecimal lastSize;
    BigDecimal volume;
    /** exchange time of the last trade */
    Instant lastTimestamp;
    /** local time the entry last changed */
    Instant updatedAt;
    boolean delayed;

    public boolean hasData() {
        return bid != null || ask != null || last != null || close != null;
    }

    /**
     * Last trade, else bid/ask midpoint, else previous close.
     */
    public Double price() {
        if (last != null && last > 0) {
            return last;
        }
        if (bid != null && ask != null && bid > 0 && ask > 0) {
            return (bid + ask) / 2;
        }
        return close;
    }
}
