package ibkr.model;

import lombok.Getter;

@Getter
public enum OrderType {
    MARKET("MKT"),
    LIMIT("LMT"),
    STOP("STP"),
    STOP_LIMIT("STP LMT");

    private final String wireValue;

    OrderType(String wireValue) {
        this.wireValue = wireValue;
    }

    public boolean needsLimitPrice() {
        return this == LIMIT || this == STOP_LIMIT;
    }

    public boolean needsStopPrice() {
        return this == STOP || this == STOP_LIMIT;
    }

    public static OrderType fromWire(String value) {
        for (OrderType type : values()) {
            if (type.wireValue.equalsIgnoreCase(value)) {
                return type;
            }
        }
        // "Limit" and friends show up from orders placed in TWS itself
        if ("LIMIT".equalsIgnoreCase(value)) {
            return LIMIT;
        }
        return MARKET;
    }
}
