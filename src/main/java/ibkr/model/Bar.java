package ibkr.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class Bar {
    Instant timestamp;
    double open;
    double high;
    double low;
    double close;
    BigDecimal volume;
    BigDecimal wap;
    int barCount;
}
