package ibkr;

import java.util.Set;

/**
 * Gateway error codes the session reacts to.
 * https://interactivebrokers.github.io/tws-api/message_codes.html
 */
public final class ErrorCodes {
    private ErrorCodes() {}

    public static final int ORDER_REJECTED = 201;
    public static final int ORDER_CANCELLED = 202;
    public static final int NO_SECURITY_DEFINITION = 200;
    public static final int CANNOT_CONNECT = 502;
    public static final int NOT_CONNECTED = 504;
    public static final int CONNECTIVITY_LOST = 1100;
    public static final int DELAYED_DATA_DISPLAYED = 10167;

    // farm status and connectivity notices
    static final Set<Integer> INFORMATIONAL = Set.of(
            399,    // order warning, e.g. will be held until market open
            1101,   // connectivity restored, data lost
            1102,   // connectivity restored, data maintained
            2100,   // account data unsubscribed
            2104,   // market data farm connection OK
            2106,   // HMDS data farm connection OK
            2107,   // HMDS data farm inactive
            2108,   // market data farm inactive
            2119,   // market data farm connecting
            2150,   // invalid position trade derived value
            2158,   // sec-def data farm connection OK
            2109,   // order event warning: outside-RTH attribute ignored
            2137,   // order event warning: closing quantity exceeds position
            DELAYED_DATA_DISPLAYED);

    // informational, but worth a warning in the log
    static final Set<Integer> WARNINGS = Set.of(
            CONNECTIVITY_LOST,
            2103,   // market data farm connection broken
            2105,   // HMDS data farm connection broken
            2157);  // sec-def data farm connection broken

    // the referenced request can never complete
    static final Set<Integer> REQUEST_TERMINAL = Set.of(
            162,    // historical market data service error (no data, pacing, cancelled)
            165,    // historical market data service query message
            166,    // HMDS expired contract violation
            203,    // security not available or allowed for this account
            300,    // can't find ticker id
            309,    // max number of market depth requests reached
            321,    // error validating request
            322,    // error processing request (duplicate id, max requests)
            366,    // no historical data query found for ticker id
            386,    // requested market data not supported for this contract
            420);   // invalid real-time query

    static final Set<Integer> MARKET_DATA_PERMISSION = Set.of(
            354,    // requested market data is not subscribed
            10089,  // requested market data requires additional subscription for API
            10090,  // part of requested market data is not subscribed
            10091,  // part of requested market data requires additional subscription
            10168,  // delayed market data is not enabled
            10186,  // requested market data is not subscribed, delayed data not enabled
            10197); // no market data during competing live session

    static final Set<Integer> ORDER_REJECTION = Set.of(
            103,    // duplicate order id
            104,    // can't modify a filled order
            105,    // order being modified does not match original
            106,    // can't transmit order id
            107,    // can't transmit incomplete order
            109,    // price out of percentage range
            110,    // price does not conform to minimum tick
            111,    // tif and order type incompatible
            116,    // not a valid exchange for this contract
            117,    // block order size too small
            118,    // VWAP order must be routed through VWAP exchange
            119,    // only VWAP orders may be placed on VWAP exchange
            133,    // submit new order failed
            135,    // can't find order with id
            136,    // order can't be cancelled
            161,    // cancel attempted when order is not in a cancellable state
            10147,  // order to cancel not found
            10148,  // order to cancel can't be cancelled in its current state
            ORDER_REJECTED,
            ORDER_CANCELLED);

    // refused modify or cancel requests: the order itself lives on
    static final Set<Integer> ORDER_UNAFFECTED = Set.of(104, 105, 135, 136, 161, 10147, 10148);

    static final Set<Integer> CONNECTION_FATAL = Set.of(CANNOT_CONNECT, NOT_CONNECTED);
}
