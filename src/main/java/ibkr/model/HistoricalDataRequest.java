package ibkr.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.LocalDateTime;

@Value
@Builder
public class HistoricalDataRequest {
    String symbol;
    /** how far back from endDateTime, e.g. "1 D", "1 M", "3600 S" */
    @Builder.Default
    String duration = HistoryDuration.MONTH_1.getWireValue();
    @Builder.Default
    String barSize = BarSize.MIN_5.getWireValue();
    /** null means now */
    LocalDateTime endDateTime;
    @Builder.Default
    String whatToShow = WhatToShow.TRADES.name();
    /** true = regular trading hours only */
    @Builder.Default
    boolean useRth = true;
    @Builder.Default
    Duration timeout = Duration.ofSeconds(60);
}
