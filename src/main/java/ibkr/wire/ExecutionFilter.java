package ibkr.wire;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ExecutionFilter {
    int clientId;
    String acctCode;
    /** "yyyyMMdd-HH:mm:ss" in UTC, blank for everything the gateway still holds */
    String time;
    String symbol;
    String secType;
    String side;
}
