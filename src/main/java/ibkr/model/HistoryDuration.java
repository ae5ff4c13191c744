package ibkr.model;

import lombok.Getter;

/**
 * Common lookback windows. Any "number unit" string the gateway accepts can be passed directly as well.
 */
@Getter
public enum HistoryDuration {
    SECONDS_30("30 S"),
    MINUTES_1("60 S"),
    MINUTES_5("300 S"),
    MINUTES_15("900 S"),
    MINUTES_30("1800 S"),
    HOUR_1("3600 S"),
    HOURS_4("14400 S"),
    DAY_1("1 D"),
    DAYS_2("2 D"),
    WEEK_1("1 W"),
    WEEKS_2("2 W"),
    MONTH_1("1 M"),
    MONTHS_3("3 M"),
    MONTHS_6("6 M"),
    YEAR_1("1 Y"),
    YEARS_2("2 Y");

    private final String wireValue;

    HistoryDuration(String wireValue) {
        this.wireValue = wireValue;
    }

    public static boolean isValid(String duration) {
        return duration != null && duration.trim().matches("\\d+ [SDWMY]");
    }
}
