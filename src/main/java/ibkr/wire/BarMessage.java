package ibkr.wire;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class BarMessage {
    /** epoch seconds, "yyyyMMdd HH:mm:ss [zone]" or "yyyyMMdd" depending on bar size and formatDate */
    String time;
    double open;
    double high;
    double low;
    double close;
    BigDecimal volume;
    BigDecimal wap;
    int count;
}
