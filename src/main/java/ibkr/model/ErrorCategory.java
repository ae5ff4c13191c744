package ibkr.model;

public enum ErrorCategory {
    /** logged, never surfaced to a caller */
    INFORMATIONAL,
    /** the referenced id can never complete */
    REQUEST_TERMINAL,
    NO_SECURITY_DEFINITION,
    /** the symbol is not entitled for live market data */
    MARKET_DATA_PERMISSION,
    ORDER_REJECTED,
    /** the session lost its gateway connection */
    CONNECTION_FATAL,
    UNCLASSIFIED
}
