package ibkr;

import ibkr.model.GatewayError;
import ibkr.model.Tick;
import ibkr.wire.TickField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Latest tick values per market data request, for snapshots and standing subscriptions alike,
 * plus the sticky set of symbols the account is not entitled to stream live.
 */
public class MarketDataCache {
    private static final Logger log = LoggerFactory.getLogger(MarketDataCache.class);

    private final Map<Integer, Entry> entries = new HashMap<>();
    private final Set<String> permissionDenied = ConcurrentHashMap.newKeySet();
    private final Clock clock;

    public MarketDataCache(Clock clock) {
        this.clock = clock;
    }

    public void open(int reqId, String symbol, boolean streaming) {
        synchronized (entries) {
            entries.put(reqId, new Entry(reqId, symbol, streaming));
        }
    }

    /** @return false when no request is open under this id */
    public boolean onTickPrice(int reqId, int field, double price) {
        synchronized (entries) {
            Entry entry = entries.get(reqId);
            if (entry == null) {
                return false;
            }
            // -1 means "no value" for this field
            if (price < 0) {
                return true;
            }
            switch (field) {
                case TickField.BID:
                case TickField.DELAYED_BID:
                    entry.bid = price;
                    break;
                case TickField.ASK:
                case TickField.DELAYED_ASK:
                    entry.ask = price;
                    break;
                case TickField.LAST:
                case TickField.DELAYED_LAST:
                    entry.last = price;
                    break;
                case TickField.HIGH:
                case TickField.DELAYED_HIGH:
                    entry.high = price;
                    break;
                case TickField.LOW:
                case TickField.DELAYED_LOW:
                    entry.low = price;
                    break;
                case TickField.CLOSE:
                case TickField.DELAYED_CLOSE:
                    entry.close = price;
                    break;
                case TickField.OPEN:
                case TickField.DELAYED_OPEN:
                    entry.open = price;
                    break;
                default:
                    log.trace("Ignoring price field {} for reqId={}", field, reqId);
                    return true;
            }
            entry.touch(field);
            return true;
        }
    }

    public boolean onTickSize(int reqId, int field, BigDecimal size) {
        synchronized (entries) {
            Entry entry = entries.get(reqId);
            if (entry == null) {
                return false;
            }
            switch (field) {
                case TickField.BID_SIZE:
                case TickField.DELAYED_BID_SIZE:
                    entry.bidSize = size;
                    break;
                case TickField.ASK_SIZE:
                case TickField.DELAYED_ASK_SIZE:
                    entry.askSize = size;
                    break;
                case TickField.LAST_SIZE:
                case TickField.DELAYED_LAST_SIZE:
                    entry.lastSize = size;
                    break;
                case TickField.VOLUME:
                case TickField.DELAYED_VOLUME:
                    entry.volume = size;
                    break;
                default:
                    return true;
            }
            entry.touch(field);
            return true;
        }
    }

    public boolean onTickString(int reqId, int field, String value) {
        if (field != TickField.LAST_TIMESTAMP && field != TickField.DELAYED_LAST_TIMESTAMP) {
            return isOpen(reqId);
        }
        synchronized (entries) {
            Entry entry = entries.get(reqId);
            if (entry == null) {
                return false;
            }
            try {
                entry.lastTimestamp = Instant.ofEpochSecond(Long.parseLong(value.trim()));
                entry.touch(field);
            } catch (NumberFormatException | NullPointerException e) {
                log.debug("Unparseable last timestamp '{}' for reqId={}", value, reqId);
            }
            return true;
        }
    }

    public boolean isOpen(int reqId) {
        synchronized (entries) {
            return entries.containsKey(reqId);
        }
    }

    public Optional<Tick> latest(int reqId) {
        synchronized (entries) {
            Entry entry = entries.get(reqId);
            return entry == null ? Optional.empty() : Optional.of(entry.toTick());
        }
    }

    public Optional<Tick> remove(int reqId) {
        synchronized (entries) {
            Entry entry = entries.remove(reqId);
            return entry == null ? Optional.empty() : Optional.of(entry.toTick());
        }
    }

    /** Ids of standing subscriptions that must be cancelled on disconnect. */
    public List<Integer> activeSubscriptions() {
        synchronized (entries) {
            List<Integer> ids = new ArrayList<>();
            for (Entry entry : entries.values()) {
                if (entry.streaming) {
                    ids.add(entry.reqId);
                }
            }
            return ids;
        }
    }

    public Optional<String> symbolFor(int reqId) {
        synchronized (entries) {
            Entry entry = entries.get(reqId);
            return entry == null ? Optional.empty() : Optional.of(entry.symbol);
        }
    }

    /**
     * Remembers that the symbol behind this request has no live entitlement.
     */
    public boolean recordPermissionError(int reqId, GatewayError error) {
        Optional<String> symbol = symbolFor(reqId);
        symbol.ifPresent(s -> {
            if (permissionDenied.add(normalize(s))) {
                log.warn("No live market data permission for {}: [{}] {}", s, error.getCode(), error.getMessage());
            }
        });
        return symbol.isPresent();
    }

    /**
     * Stores an error against a standing subscription. Snapshot waiters are woken through the registry.
     */
    public boolean recordStreamError(int reqId, GatewayError error) {
        synchronized (entries) {
            Entry entry = entries.get(reqId);
            if (entry == null || !entry.streaming) {
                return false;
            }
            entry.lastError = error;
            return true;
        }
    }

    public Optional<GatewayError> lastError(int reqId) {
        synchronized (entries) {
            Entry entry = entries.get(reqId);
            return entry == null ? Optional.empty() : Optional.ofNullable(entry.lastError);
        }
    }

    public boolean isPermissionDenied(String symbol) {
        return permissionDenied.contains(normalize(symbol));
    }

    public Set<String> permissionDeniedSymbols() {
        return Set.copyOf(permissionDenied);
    }

    public void clearPermissionDenied(String symbol) {
        permissionDenied.remove(normalize(symbol));
    }

    public void clear() {
        synchronized (entries) {
            entries.clear();
        }
    }

    private static String normalize(String symbol) {
        return symbol.trim().toUpperCase(Locale.ROOT);
    }

    private final class Entry {
        final int reqId;
        final String symbol;
        final boolean streaming;
        Double bid;
        Double ask;
        Double last;
        Double high;
        Double low;
        Double close;
        Double open;
        BigDecimal bidSize;
        BigDecimal askSize;
        BigDecimal lastSize;
        BigDecimal volume;
        Instant lastTimestamp;
        Instant updatedAt;
        boolean delayed;
        GatewayError lastError;

        Entry(int reqId, String symbol, boolean streaming) {
            this.reqId = reqId;
            this.symbol = symbol;
            this.streaming = streaming;
        }

        void touch(int field) {
            updatedAt = clock.instant();
            delayed |= TickField.isDelayed(field);
        }

        Tick toTick() {
            return Tick.builder()
                    .requestId(reqId)
                    .symbol(symbol)
                    .bid(bid)
                    .ask(ask)
                    .last(last)
                    .high(high)
                    .low(low)
                    .close(close)
                    .open(open)
                    .bidSize(bidSize)
                    .askSize(askSize)
                    .lastSize(lastSize)
                    .volume(volume)
                    .lastTimestamp(lastTimestamp)
                    .updatedAt(updatedAt)
                    .delayed(delayed)
                    .build();
        }
    }
}
