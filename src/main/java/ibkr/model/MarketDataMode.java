package ibkr.model;

import lombok.Getter;

@Getter
public enum MarketDataMode {
    LIVE(1),
    FROZEN(2),
    DELAYED(3),
    DELAYED_FROZEN(4);

    private final int wireValue;

    MarketDataMode(int wireValue) {
        this.wireValue = wireValue;
    }

    public boolean isDelayed() {
        return this == DELAYED || this == DELAYED_FROZEN;
    }
}
