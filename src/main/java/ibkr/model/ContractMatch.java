package ibkr.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ContractMatch {
    int conId;
    String symbol;
    String secType;
    String exchange;
    String primaryExchange;
    String currency;
    String name;
}
