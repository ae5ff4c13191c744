package ibkr;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Order ids come from the gateway: the handshake seeds the counter and every order takes the next one.
 * Kept apart from request ids, which the session chooses itself.
 */
public class OrderIdAllocator {
    private static final Logger log = LoggerFactory.getLogger(OrderIdAllocator.class);

    private static final int UNSEEDED = -1;

    private final AtomicInteger currentOrderId = new AtomicInteger(UNSEEDED);

    /**
     * Applies a nextValidId from the gateway. The counter only moves forward so ids handed out
     * earlier in the session are never reissued.
     */
    public synchronized void seed(int validId) {
        int current = currentOrderId.get();
        if (validId > current) {
            currentOrderId.set(validId);
            log.debug("Next order id set to {}", validId);
        } else {
            log.debug("Ignoring nextValidId {} - counter already at {}", validId, current);
        }
    }

    public synchronized int next() {
        if (currentOrderId.get() == UNSEEDED) {
            throw new NotConnectedException("Order ids not initialized - no handshake with the gateway yet");
        }
        return currentOrderId.getAndIncrement();
    }

    /**
     * Atomically reserves sequential ids, e.g. for a parent order and its children.
     * @return the first id in the sequence
     */
    public synchronized int reserve(int count) {
        if (count <= 0) {
            throw new IllegalArgumentException("count must be positive");
        }
        int firstId = next();
        currentOrderId.addAndGet(count - 1);
        return firstId;
    }

    public boolean isSeeded() {
        return currentOrderId.get() != UNSEEDED;
    }

    public int peek() {
        return currentOrderId.get();
    }

    public synchronized void reset() {
        currentOrderId.set(UNSEEDED);
    }
}
