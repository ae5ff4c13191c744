package ibkr.wire;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class ExecutionMessage {
    String execId;
    int orderId;
    /** "yyyyMMdd  HH:mm:ss zone" */
    String time;
    String acctNumber;
    /** BOT or SLD */
    String side;
    BigDecimal shares;
    double price;
    BigDecimal cumQty;
    double avgPrice;
}
