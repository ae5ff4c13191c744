package ibkr.wire;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ContractDescriptionMessage {
    ContractSpec contract;
    @Singular
    List<String> derivativeSecTypes;
}
