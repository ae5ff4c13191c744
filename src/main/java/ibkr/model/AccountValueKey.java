package ibkr.model;

import lombok.Value;

@Value
public class AccountValueKey {
    String account;
    String tag;
}
