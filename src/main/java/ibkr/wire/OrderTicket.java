package ibkr.wire;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class OrderTicket {
    /** BUY or SELL */
    String action;
    BigDecimal totalQuantity;
    /** MKT, LMT, STP, STP LMT */
    String orderType;
    Double lmtPrice;
    /** stop trigger price */
    Double auxPrice;
    String tif;
    String orderRef;
    @Builder.Default
    boolean transmit = true;
}
