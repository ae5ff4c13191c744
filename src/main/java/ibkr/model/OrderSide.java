package ibkr.model;

import java.util.Locale;

public enum OrderSide {
    BUY,
    SELL;

    /**
     * Accepts order actions (BUY/SELL) and execution sides (BOT/SLD).
     */
    public static OrderSide fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Order side is required");
        }
        switch (value.trim().toUpperCase(Locale.ROOT)) {
            case "BUY":
            case "BOT":
                return BUY;
            case "SELL":
            case "SLD":
            case "SSHORT":
                return SELL;
            default:
                throw new IllegalArgumentException("Unknown order side: " + value);
        }
    }
}
