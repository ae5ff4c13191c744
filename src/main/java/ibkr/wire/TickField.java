package ibkr.wire;

/**
 * Tick type ids used by tickPrice/tickSize/tickString.
 * https://interactivebrokers.github.io/tws-api/tick_types.html
 */
public final class TickField {
    private TickField() {}

    public static final int BID_SIZE = 0;
    public static final int BID = 1;
    public static final int ASK = 2;
    public static final int ASK_SIZE = 3;
    public static final int LAST = 4;
    public static final int LAST_SIZE = 5;
    public static final int HIGH = 6;
    public static final int LOW = 7;
    public static final int VOLUME = 8;
    public static final int CLOSE = 9;
    public static final int OPEN = 14;
    public static final int LAST_TIMESTAMP = 45;

    // delayed (15-20 min) equivalents
    public static final int DELAYED_BID = 66;
    public static final int DELAYED_ASK = 67;
    public static final int DELAYED_LAST = 68;
    public static final int DELAYED_BID_SIZE = 69;
    public static final int DELAYED_ASK_SIZE = 70;
    public static final int DELAYED_LAST_SIZE = 71;
    public static final int DELAYED_HIGH = 72;
    public static final int DELAYED_LOW = 73;
    public static final int DELAYED_VOLUME = 74;
    public static final int DELAYED_CLOSE = 75;
    public static final int DELAYED_OPEN = 76;
    public static final int DELAYED_LAST_TIMESTAMP = 88;

    public static boolean isDelayed(int field) {
        return field >= DELAYED_BID && field <= DELAYED_LAST_TIMESTAMP;
    }
}
