package ibkr;

/**
 * Thrown by calls that must fail fast instead of returning an outcome, such as placing an order
 * while the session has no gateway connection.
 */
public class NotConnectedException extends IllegalStateException {
    public NotConnectedException(String message) {
        super(message);
    }
}
