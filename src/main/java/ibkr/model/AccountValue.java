package ibkr.model;

import lombok.Builder;
import lombok.Value;

import java.util.OptionalDouble;

@Value
@Builder
public class AccountValue {
    String account;
    String tag;
    String value;
    String currency;

    public AccountValueKey key() {
        return new AccountValueKey(account, tag);
    }

    public OptionalDouble asDouble() {
        if (value == null || value.isBlank()) {
            return OptionalDouble.empty();
        }
        try {
            return OptionalDouble.of(Double.parseDouble(value.trim()));
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }
}
