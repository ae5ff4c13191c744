package ibkr.wire;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ContractDetailsMessage {
    ContractSpec contract;
    String longName;
    double minTick;
    String tradingHours;
}
