package ibkr.model;

import lombok.Getter;

@Getter
public enum BarSize {
    SECS_1("1 secs"),
    SECS_5("5 secs"),
    SECS_10("10 secs"),
    SECS_15("15 secs"),
    SECS_30("30 secs"),
    MIN_1("1 min"),
    MIN_2("2 mins"),
    MIN_3("3 mins"),
    MIN_5("5 mins"),
    MIN_10("10 mins"),
    MIN_15("15 mins"),
    MIN_20("20 mins"),
    MIN_30("30 mins"),
    HOUR_1("1 hour"),
    HOUR_2("2 hours"),
    HOUR_3("3 hours"),
    HOUR_4("4 hours"),
    HOUR_8("8 hours"),
    DAY_1("1 day"),
    WEEK_1("1 week"),
    MONTH_1("1 month");

    private final String wireValue;

    BarSize(String wireValue) {
        this.wireValue = wireValue;
    }

    public static BarSize fromWire(String value) {
        for (BarSize size : values()) {
            if (size.wireValue.equals(value)) {
                return size;
            }
        }
        throw new IllegalArgumentException("Unsupported bar size: " + value);
    }
}
