package ibkr.model;

import lombok.Value;

import java.util.Optional;

/**
 * Either the tick of a finished snapshot or the handle of a standing subscription.
 */
@Value
public class MarketDataResult {
    Tick tick;
    SubscriptionHandle handle;

    public static MarketDataResult ofTick(Tick tick) {
        return new MarketDataResult(tick, null);
    }

    public static MarketDataResult ofHandle(SubscriptionHandle handle) {
        return new MarketDataResult(null, handle);
    }

    public Optional<Tick> tick() {
        return Optional.ofNullable(tick);
    }

    public Optional<SubscriptionHandle> handle() {
        return Optional.ofNullable(handle);
    }
}
