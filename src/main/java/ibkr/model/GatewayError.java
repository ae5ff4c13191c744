package ibkr.model;

import lombok.Value;

@Value
public class GatewayError {
    public static final int NO_ID = -1;

    /** request, ticker or order id the gateway named, -1 when it names none */
    int id;
    int code;
    String message;
    ErrorCategory category;
    String advancedOrderRejectJson;

    public static GatewayError of(int id, int code, String message, ErrorCategory category) {
        return new GatewayError(id, code, message, category, null);
    }

    public static GatewayError timeout(int id) {
        return of(id, 0, "Timed out waiting for gateway response", ErrorCategory.REQUEST_TERMINAL);
    }

    public static GatewayError notConnected() {
        return of(NO_ID, 504, "Not connected", ErrorCategory.CONNECTION_FATAL);
    }

    public static GatewayError cancelled(int id) {
        return of(id, 0, "Request cancelled", ErrorCategory.REQUEST_TERMINAL);
    }

    @Override
    public String toString() {
        return "[" + code + "] id=" + id + " " + message;
    }
}
