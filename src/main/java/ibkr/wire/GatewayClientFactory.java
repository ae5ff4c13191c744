package ibkr.wire;

import java.util.Iterator;
import java.util.ServiceLoader;

/**
 * Binds the session to a concrete gateway client implementation.
 * The vendor adapter registers itself under META-INF/services/ibkr.wire.GatewayClientFactory.
 */
public interface GatewayClientFactory {

    GatewayClient create(GatewayListener listener);

    static GatewayClientFactory load() {
        Iterator<GatewayClientFactory> factories = ServiceLoader.load(GatewayClientFactory.class).iterator();
        if (!factories.hasNext()) {
            throw new IllegalStateException("No GatewayClientFactory registered - add the TWS API adapter to the classpath");
        }
        return factories.next();
    }
}
