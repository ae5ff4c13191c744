package ibkr;

import ibkr.model.OrderRecord;

@FunctionalInterface
public interface OrderStatusListener {
    /** Called on the gateway reader thread; must not block. */
    void onOrderUpdate(OrderRecord order);
}
