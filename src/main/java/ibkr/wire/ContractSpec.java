package ibkr.wire;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class ContractSpec {
    int conId;
    String symbol;
    /** STK, IND, FUT, OPT, CASH ... */
    String secType;
    String exchange;
    String primaryExchange;
    String currency;
}
