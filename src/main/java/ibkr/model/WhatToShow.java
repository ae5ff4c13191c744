package ibkr.model;

public enum WhatToShow {
    TRADES,
    MIDPOINT,
    BID,
    ASK,
    BID_ASK,
    ADJUSTED_LAST,
    HISTORICAL_VOLATILITY,
    OPTION_IMPLIED_VOLATILITY
}
