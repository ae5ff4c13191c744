package util;

import java.time.Duration;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Set;

public class Constants {
    // prevent init
    private Constants() {}

    public static final ZoneId EASTERN = ZoneId.of("America/New_York");

    // 7497 TWS paper, 7496 TWS live, 4002 Gateway paper, 4001 Gateway live
    public static final int DEFAULT_GATEWAY_PORT = 4002;

    // Account summary group meaning every managed account
    public static final String ALL_ACCOUNTS_GROUP = "All";

    public static final String DEFAULT_SUMMARY_TAGS = "NetLiquidation,TotalCashValue,GrossPositionValue";

    // Securities quoted as indices rather than equities
    public static final Set<String> DEFAULT_INDEX_SYMBOLS = Set.of("VIX", "VVIX", "VXN", "SPX", "NDX", "RUT", "DJX");

    // Watchlist used when neither positions nor the watchlist file name any symbol
    public static final List<String> DEFAULT_WATCHLIST = List.of(
            "SPY", "QQQ", "IWM", "DIA", "VTI",
            "XLF", "XLE", "XLK", "XLV", "XLI",
            "AAPL", "MSFT", "GOOGL", "AMZN", "NVDA", "META", "TSLA",
            "JPM", "BAC", "GS", "MS",
            "VIX");

    public static final Duration WATCHLIST_POSITIONS_TIMEOUT = Duration.ofSeconds(5);

    // Pause between back-to-back historical requests to stay under the pacing limit
    public static final long HISTORICAL_PACING_MILLIS = 500;

    // How long disconnect waits for the reader thread to exit
    public static final long READER_JOIN_MILLIS = 5000;

    public static final DateTimeFormatter END_DATE_TIME_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd HH:mm:ss");

    // execution filter times are sent in UTC
    public static final DateTimeFormatter EXECUTION_FILTER_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd-HH:mm:ss");
}
