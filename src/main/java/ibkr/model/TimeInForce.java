package ibkr.model;

public enum TimeInForce {
    DAY,
    GTC,
    IOC,
    OPG
}
