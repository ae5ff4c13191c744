package ibkr.model;

import lombok.Value;

/**
 * A streaming subscription. Request ids restart with every connection, so the handle also carries the
 * connection generation it was issued in; a handle from an earlier connection no longer resolves.
 */
@Value
public class SubscriptionHandle {
    int requestId;
    String symbol;
    long generation;
}
