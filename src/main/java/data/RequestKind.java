package data;

public enum RequestKind {
    HISTORICAL_DATA(false),
    SNAPSHOT(false),
    ACCOUNT_SUMMARY(false),
    EXECUTIONS(false),
    CONTRACT_SEARCH(false),
    SYMBOL_SEARCH(false),
    // the gateway answers these without echoing a request id, so only one may be in flight at a time
    POSITIONS(true),
    PORTFOLIO(true),
    OPEN_ORDERS(true);

    private final boolean exclusive;

    RequestKind(boolean exclusive) {
        this.exclusive = exclusive;
    }

    public boolean isExclusive() {
        return exclusive;
    }
}
