package ibkr;

import config.GatewayConfig;
import config.Watchlist;
import data.OutcomeStatus;
import data.PendingRequest;
import data.RequestKind;
import data.RequestOutcome;
import data.RequestRegistry;
import ibkr.model.AccountValue;
import ibkr.model.AccountValueKey;
import ibkr.model.Bar;
import ibkr.model.BarSize;
import ibkr.model.ContractMatch;
import ibkr.model.ErrorCategory;
import ibkr.model.Execution;
import ibkr.model.GatewayError;
import ibkr.model.HistoricalDataRequest;
import ibkr.model.HistoryDuration;
import ibkr.model.MarketDataMode;
import ibkr.model.MarketDataResult;
import ibkr.model.OrderRecord;
import ibkr.model.OrderSide;
import ibkr.model.OrderType;
import ibkr.model.Position;
import ibkr.model.SubscriptionHandle;
import ibkr.model.Tick;
import ibkr.model.TimeInForce;
import ibkr.wire.ContractSpec;
import ibkr.wire.ExecutionFilter;
import ibkr.wire.GatewayClient;
import ibkr.wire.GatewayClientFactory;
import ibkr.wire.OrderTicket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import util.Constants;
import util.TimestampParser;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Synchronous API over one gateway connection. Every data call sends a request, blocks the calling
 * thread until the answer completes, fails or times out, and returns a {@link RequestOutcome}.
 * Orders are fire-and-forget: {@link #placeOrder} returns the gateway order id and the result is
 * observed through {@link #getOrder} or a listener.
 *
 * <p>Any number of caller threads may use one session concurrently. Construct one per connection and
 * pass it to whatever needs it.
 */
public class GatewaySession implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(GatewaySession.class);
    private static final Logger orderLog = LoggerFactory.getLogger("ORDER_AUDIT");

    private final GatewayConfig config;
    private final GatewayClient client;
    private final RequestRegistry registry = new RequestRegistry();
    private final OrderIdAllocator orderIds = new OrderIdAllocator();
    private final OrderTracker orders;
    private final AccountTracker accounts;
    private final MarketDataCache marketData;
    private final ConnectionManager connection;
    private final ContractFactory contracts;
    private final AccountBalanceExtractor balanceExtractor = new AccountBalanceExtractor();
    private final Map<RequestKind, ReentrantLock> exclusiveLocks = new EnumMap<>(RequestKind.class);

    // what the gateway currently streams; it falls back to LIVE on every new connection
    private volatile MarketDataMode activeMode = MarketDataMode.LIVE;

    public GatewaySession(GatewayConfig config, GatewayClientFactory clientFactory) {
        this(config, clientFactory, Clock.systemUTC());
    }

    public GatewaySession(GatewayConfig config, GatewayClientFactory clientFactory, Clock clock) {
        this.config = config;
        TimestampParser timestampParser = new TimestampParser(config.getTimeZone());
        this.orders = new OrderTracker(clock);
        this.accounts = new AccountTracker(registry, clock, timestampParser);
        this.marketData = new MarketDataCache(clock);
        this.contracts = new ContractFactory(config.getIndexSymbols());
        this.connection = new ConnectionManager(registry, orderIds, marketData);
        GatewayCallbackHandler handler = new GatewayCallbackHandler(connection, registry, orders, accounts,
                marketData, new ErrorClassifier(), timestampParser);
        this.client = clientFactory.create(handler);
        connection.attach(client);
        connection.addConnectListener(() -> activeMode = MarketDataMode.LIVE);
        for (RequestKind kind : RequestKind.values()) {
            if (kind.isExclusive()) {
                exclusiveLocks.put(kind, new ReentrantLock(true));
            }
        }
    }

    // ---- connection ----

    public boolean connect() {
        return connect(config.getHost(), config.getPort(), config.getClientId(), config.getConnectTimeout());
    }

    public boolean connect(String host, int port, int clientId, Duration timeout) {
        return connection.connect(host, port, clientId, timeout);
    }

    public void disconnect() {
        connection.disconnect();
    }

    public boolean reconnect(Duration timeout) {
        return connection.reconnect(timeout);
    }

    public boolean isConnected() {
        return connection.isConnected();
    }

    public ConnectionState getState() {
        return connection.getState();
    }

    public void startSupervisor() {
        connection.startSupervisor(config.getSupervisorInterval());
    }

    public void stopSupervisor() {
        connection.stopSupervisor();
    }

    @Override
    public void close() {
        connection.stopSupervisor();
        connection.disconnect();
    }

    ConnectionManager connectionManager() {
        return connection;
    }

    public List<String> getManagedAccounts() {
        return accounts.getManagedAccounts();
    }

    // ---- historical data ----

    public RequestOutcome<List<Bar>> getHistoricalData(String symbol, String duration, String barSize,
                                                       LocalDateTime endDateTime, String whatToShow, boolean useRth,
                                                       Duration timeout) {
        return getHistoricalData(HistoricalDataRequest.builder()
                .symbol(symbol)
                .duration(duration)
                .barSize(barSize)
                .endDateTime(endDateTime)
                .whatToShow(whatToShow)
                .useRth(useRth)
                .timeout(timeout)
                .build());
    }

    /**
     * Bars come back in the order the gateway sent them, which is oldest first. Bars with an unreadable
     * timestamp are left out.
     *
     * @throws IllegalArgumentException for a malformed duration or an unsupported bar size
     */
    public RequestOutcome<List<Bar>> getHistoricalData(HistoricalDataRequest request) {
        if (!HistoryDuration.isValid(request.getDuration())) {
            throw new IllegalArgumentException("Invalid duration '" + request.getDuration() + "', expected e.g. \"1 D\"");
        }
        BarSize barSize = BarSize.fromWire(request.getBarSize());
        if (!isConnected()) {
            return RequestOutcome.notConnected();
        }
        ContractSpec contract = contracts.forSymbol(request.getSymbol());
        String endDateTime = request.getEndDateTime() == null ? ""
                : request.getEndDateTime().format(Constants.END_DATE_TIME_FORMAT) + " " + config.getTimeZone().getId();

        PendingRequest<Bar> pending = registry.issue(RequestKind.HISTORICAL_DATA, Bar.class);
        int reqId = pending.getRequestId();
        log.debug("Requesting {} of {} bars for {} (reqId={})", request.getDuration(), barSize.getWireValue(),
                contract.getSymbol(), reqId);
        client.reqHistoricalData(reqId, contract, endDateTime, request.getDuration().trim(), barSize.getWireValue(),
                request.getWhatToShow(), request.isUseRth(), 1);

        RequestOutcome<List<Bar>> outcome = registry.await(pending, request.getTimeout());
        if (outcome.getStatus() == OutcomeStatus.TIMED_OUT && client.isConnected()) {
            client.cancelHistoricalData(reqId);
        }
        if (outcome.isOk()) {
            log.info("Received {} bars for {}", outcome.getValue().size(), contract.getSymbol());
        }
        return outcome;
    }

    /**
     * Fetches symbols one after another with a pause in between to respect pacing limits. Symbols that
     * fail or return no bars are left out of the result.
     */
    public Map<String, List<Bar>> getMultipleHistoricalData(Collection<String> symbols, String duration, String barSize,
                                                            Duration timeoutPerSymbol) {
        Map<String, List<Bar>> result = new LinkedHashMap<>();
        boolean first = true;
        for (String symbol : symbols) {
            if (!first) {
                try {
                    Thread.sleep(Constants.HISTORICAL_PACING_MILLIS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Interrupted - returning {} of {} symbols", result.size(), symbols.size());
                    return result;
                }
            }
            first = false;
            RequestOutcome<List<Bar>> outcome = getHistoricalData(HistoricalDataRequest.builder()
                    .symbol(symbol)
                    .duration(duration)
                    .barSize(barSize)
                    .timeout(timeoutPerSymbol)
                    .build());
            if (outcome.isOk() && !outcome.getValue().isEmpty()) {
                result.put(symbol, outcome.getValue());
            } else {
                log.warn("No historical data for {}: {}", symbol, outcome);
            }
        }
        return result;
    }

    // ---- market data ----

    /**
     * Snapshot mode blocks for one full tick set; streaming mode returns a handle to poll with
     * {@link #latest(SubscriptionHandle)}.
     */
    public RequestOutcome<MarketDataResult> subscribeMarketData(String symbol, boolean snapshot, Duration timeout) {
        if (snapshot) {
            return snapshot(symbol, config.getMarketDataMode(), timeout).map(MarketDataResult::ofTick);
        }
        return subscribe(symbol, config.getMarketDataMode()).map(MarketDataResult::ofHandle);
    }

    public RequestOutcome<Tick> snapshot(String symbol, Duration timeout) {
        return snapshot(symbol, config.getMarketDataMode(), timeout);
    }

    /**
     * One-shot quote. A symbol that already failed for lack of live permission fails again immediately
     * in LIVE mode; ask for {@link MarketDataMode#DELAYED} instead.
     */
    public RequestOutcome<Tick> snapshot(String symbol, MarketDataMode mode, Duration timeout) {
        if (!isConnected()) {
            return RequestOutcome.notConnected();
        }
        if (mode == MarketDataMode.LIVE && marketData.isPermissionDenied(symbol)) {
            log.debug("Skipping live snapshot for {} - no market data permission", symbol);
            return RequestOutcome.failed(GatewayError.of(GatewayError.NO_ID, 354,
                    "No live market data permission for " + symbol, ErrorCategory.MARKET_DATA_PERMISSION));
        }
        ContractSpec contract = contracts.forSymbol(symbol);
        PendingRequest<Tick> pending = registry.issue(RequestKind.SNAPSHOT, Tick.class);
        int reqId = pending.getRequestId();
        marketData.open(reqId, symbol, false);
        try {
            ensureMarketDataMode(mode);
            client.reqMktData(reqId, contract, "", true);
            RequestOutcome<List<Tick>> outcome = registry.await(pending, timeout, config.getSnapshotQuietPeriod());
            Optional<Tick> tick = marketData.remove(reqId);
            if (!outcome.isOk()) {
                return outcome.map(ticks -> null);
            }
            if (tick.isEmpty() || !tick.get().hasData()) {
                return RequestOutcome.failed(GatewayError.of(reqId, 0, "No market data received for " + symbol,
                        ErrorCategory.REQUEST_TERMINAL));
            }
            return RequestOutcome.ok(tick.get());
        } finally {
            marketData.remove(reqId);
            if (client.isConnected()) {
                client.cancelMktData(reqId);
            }
        }
    }

    public RequestOutcome<SubscriptionHandle> subscribe(String symbol, MarketDataMode mode) {
        if (!isConnected()) {
            return RequestOutcome.notConnected();
        }
        ContractSpec contract = contracts.forSymbol(symbol);
        long generation = connection.getGeneration();
        int reqId = registry.nextReqId();
        marketData.open(reqId, symbol, true);
        ensureMarketDataMode(mode);
        client.reqMktData(reqId, contract, "", false);
        log.info("Subscribed to market data for {} (reqId={})", symbol, reqId);
        return RequestOutcome.ok(new SubscriptionHandle(reqId, symbol, generation));
    }

    /** Empty once the handle's connection is gone, even if its request id was handed out again. */
    public Optional<Tick> latest(SubscriptionHandle handle) {
        if (!isCurrent(handle)) {
            return Optional.empty();
        }
        return marketData.latest(handle.getRequestId());
    }

    public Optional<GatewayError> subscriptionError(SubscriptionHandle handle) {
        if (!isCurrent(handle)) {
            return Optional.empty();
        }
        return marketData.lastError(handle.getRequestId());
    }

    public boolean unsubscribe(SubscriptionHandle handle) {
        if (!isCurrent(handle)) {
            log.debug("Subscription {} for {} is no longer active", handle.getRequestId(), handle.getSymbol());
            return false;
        }
        if (marketData.remove(handle.getRequestId()).isEmpty()) {
            return false;
        }
        if (client.isConnected()) {
            client.cancelMktData(handle.getRequestId());
        }
        log.info("Unsubscribed market data for {} (reqId={})", handle.getSymbol(), handle.getRequestId());
        return true;
    }

    private boolean isCurrent(SubscriptionHandle handle) {
        return handle.getGeneration() == connection.getGeneration()
                && marketData.symbolFor(handle.getRequestId()).map(handle.getSymbol()::equals).orElse(false);
    }

    public boolean isPermissionDenied(String symbol) {
        return marketData.isPermissionDenied(symbol);
    }

    private synchronized void ensureMarketDataMode(MarketDataMode mode) {
        if (activeMode != mode) {
            client.reqMarketDataType(mode.getWireValue());
            activeMode = mode;
            log.info("Market data type set to {}", mode);
        }
    }

    // ---- account ----

    public RequestOutcome<List<Position>> getPositions(Duration timeout) {
        if (!isConnected()) {
            return RequestOutcome.notConnected();
        }
        return exclusively(RequestKind.POSITIONS, timeout, remaining -> {
            PendingRequest<Position> pending = registry.issueExclusive(RequestKind.POSITIONS, Position.class);
            client.reqPositions();
            try {
                return registry.await(pending, remaining);
            } finally {
                if (client.isConnected()) {
                    client.cancelPositions();
                }
            }
        });
    }

    public RequestOutcome<List<Position>> getPortfolioPositions(Duration timeout) {
        return getPortfolioPositions(timeout, true);
    }

    /**
     * Positions with market price and P&L from the account update stream. Entry times are the first
     * time each position was seen, moved back to the opening execution when {@code useExecutions} is set
     * and the execution history reaches that far.
     */
    public RequestOutcome<List<Position>> getPortfolioPositions(Duration timeout, boolean useExecutions) {
        if (!isConnected()) {
            return RequestOutcome.notConnected();
        }
        long deadline = System.nanoTime() + timeout.toNanos();
        String account = accountForUpdates();
        RequestOutcome<List<Position>> outcome = exclusively(RequestKind.PORTFOLIO, timeout, remaining -> {
            PendingRequest<Position> pending = registry.issueExclusive(RequestKind.PORTFOLIO, Position.class);
            client.reqAccountUpdates(true, account);
            try {
                return registry.await(pending, remaining).map(ignored -> accounts.portfolio());
            } finally {
                if (client.isConnected()) {
                    client.reqAccountUpdates(false, account);
                }
            }
        });
        if (!outcome.isOk() || !useExecutions || outcome.getValue().isEmpty()) {
            return outcome;
        }
        // executions share the caller's budget with the portfolio download
        Duration left = Duration.ofNanos(deadline - System.nanoTime());
        if (left.isNegative() || left.isZero()) {
            log.debug("No time left for execution history, keeping observed entry times");
            return outcome;
        }
        RequestOutcome<List<Execution>> executions = getExecutions(null, left);
        if (!executions.isOk()) {
            log.debug("Execution history unavailable, keeping observed entry times: {}", executions);
            return outcome;
        }
        return RequestOutcome.ok(accounts.applyExecutionEntryTimes(outcome.getValue(), executions.getValue()));
    }

    private String accountForUpdates() {
        if (!config.getAccount().isBlank()) {
            return config.getAccount();
        }
        List<String> managed = accounts.getManagedAccounts();
        return managed.isEmpty() ? "" : managed.get(0);
    }

    public RequestOutcome<Map<AccountValueKey, AccountValue>> getAccountSummary(Duration timeout) {
        return getAccountSummary(List.of(Constants.DEFAULT_SUMMARY_TAGS.split(",")), timeout);
    }

    public RequestOutcome<Map<AccountValueKey, AccountValue>> getAccountSummary(Collection<String> tags,
                                                                               Duration timeout) {
        if (tags == null || tags.isEmpty()) {
            throw new IllegalArgumentException("At least one account summary tag is required");
        }
        if (!isConnected()) {
            return RequestOutcome.notConnected();
        }
        PendingRequest<AccountValue> pending = registry.issue(RequestKind.ACCOUNT_SUMMARY, AccountValue.class);
        int reqId = pending.getRequestId();
        client.reqAccountSummary(reqId, Constants.ALL_ACCOUNTS_GROUP, String.join(",", tags));
        try {
            return registry.await(pending, timeout).map(accounts::storeSummary);
        } finally {
            if (client.isConnected()) {
                client.cancelAccountSummary(reqId);
            }
        }
    }

    /**
     * The account's balance, from the first summary tag that has a value.
     */
    public RequestOutcome<AccountBalanceExtractor.Balance> getAccountBalance(Duration timeout) {
        RequestOutcome<Map<AccountValueKey, AccountValue>> summary = getAccountSummary(balanceExtractor.tags(), timeout);
        if (!summary.isOk()) {
            return summary.map(values -> null);
        }
        return balanceExtractor.extract(summary.getValue().values(), config.getAccount())
                .map(RequestOutcome::ok)
                .orElseGet(() -> RequestOutcome.failed(GatewayError.of(GatewayError.NO_ID, 0,
                        "No balance tag in account summary", ErrorCategory.REQUEST_TERMINAL)));
    }

    /**
     * @param since only executions at or after this time, null for everything the gateway still holds
     */
    public RequestOutcome<List<Execution>> getExecutions(Instant since, Duration timeout) {
        if (!isConnected()) {
            return RequestOutcome.notConnected();
        }
        ExecutionFilter filter = ExecutionFilter.builder()
                .acctCode(config.getAccount())
                .time(since == null ? "" : Constants.EXECUTION_FILTER_FORMAT.format(since.atOffset(ZoneOffset.UTC)))
                .build();
        PendingRequest<Execution> pending = registry.issue(RequestKind.EXECUTIONS, Execution.class);
        client.reqExecutions(pending.getRequestId(), filter);
        return registry.await(pending, timeout);
    }

    // ---- orders ----

    /**
     * Every open order of the account, including ones placed by other clients, which become tracked
     * from here on.
     */
    public RequestOutcome<List<OrderRecord>> getOpenOrders(Duration timeout) {
        if (!isConnected()) {
            return RequestOutcome.notConnected();
        }
        return exclusively(RequestKind.OPEN_ORDERS, timeout, remaining -> {
            PendingRequest<OrderRecord> pending = registry.issueExclusive(RequestKind.OPEN_ORDERS, OrderRecord.class);
            client.reqAllOpenOrders();
            return registry.await(pending, remaining).map(this::latestRecords);
        });
    }

    // the gateway may report one order several times; keep the freshest record per id
    private List<OrderRecord> latestRecords(List<OrderRecord> reported) {
        Set<Integer> ids = new LinkedHashSet<>();
        for (OrderRecord record : reported) {
            ids.add(record.getOrderId());
        }
        List<OrderRecord> result = new ArrayList<>(ids.size());
        for (Integer id : ids) {
            orders.get(id).ifPresent(result::add);
        }
        return result;
    }

    public int placeOrder(String symbol, OrderSide side, BigDecimal quantity, OrderType type, Double limitPrice,
                          Double stopPrice, TimeInForce tif) {
        return placeOrder(symbol, side, quantity, type, limitPrice, stopPrice, tif, null);
    }

    /**
     * Sends an order and returns its gateway-assigned id at once. The PENDING record exists before the
     * order leaves, so the first status callback always finds it.
     *
     * @throws NotConnectedException when the session is not connected
     * @throws IllegalArgumentException when a price the order type needs is missing or not positive
     */
    public int placeOrder(String symbol, OrderSide side, BigDecimal quantity, OrderType type, Double limitPrice,
                          Double stopPrice, TimeInForce tif, OrderStatusListener listener) {
        validateOrder(symbol, side, quantity, type, limitPrice, stopPrice);
        if (!isConnected()) {
            throw new NotConnectedException("Cannot place order for " + symbol + " - not connected to the gateway");
        }
        TimeInForce timeInForce = tif == null ? TimeInForce.DAY : tif;
        ContractSpec contract = contracts.forSymbol(symbol);
        OrderTicket ticket = OrderTicket.builder()
                .action(side.name())
                .totalQuantity(quantity)
                .orderType(type.getWireValue())
                .lmtPrice(type.needsLimitPrice() ? limitPrice : null)
                .auxPrice(type.needsStopPrice() ? stopPrice : null)
                .tif(timeInForce.name())
                .build();

        int orderId = orderIds.next();
        orders.registerPending(orderId, contract.getSymbol(), side, quantity, type, ticket.getLmtPrice(),
                ticket.getAuxPrice(), timeInForce, listener);
        orderLog.info("PLACE_ORDER | orderId={} | symbol={} | action={} | qty={} | type={} | lmt={} | stop={} | tif={}",
                orderId, contract.getSymbol(), side, quantity, type.getWireValue(), ticket.getLmtPrice(),
                ticket.getAuxPrice(), timeInForce);
        try {
            client.placeOrder(orderId, contract, ticket);
        } catch (RuntimeException e) {
            log.error("Failed to send order {}: {}", orderId, e.getMessage(), e);
            orders.markRejected(orderId, "Send failed: " + e.getMessage());
        }
        return orderId;
    }

    private static void validateOrder(String symbol, OrderSide side, BigDecimal quantity, OrderType type,
                                      Double limitPrice, Double stopPrice) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol is required");
        }
        if (side == null || type == null) {
            throw new IllegalArgumentException("side and order type are required");
        }
        if (quantity == null || quantity.signum() <= 0) {
            throw new IllegalArgumentException("quantity must be positive, got " + quantity);
        }
        if (type.needsLimitPrice() && (limitPrice == null || limitPrice <= 0)) {
            throw new IllegalArgumentException(type + " order needs a positive limit price");
        }
        if (type.needsStopPrice() && (stopPrice == null || stopPrice <= 0)) {
            throw new IllegalArgumentException(type + " order needs a positive stop price");
        }
    }

    /**
     * Asks the gateway to cancel. Returns false without sending anything when the order is unknown,
     * already finished, or the session is down. The cancellation itself shows up as a status change.
     */
    public boolean cancelOrder(int orderId) {
        Optional<OrderRecord> order = orders.get(orderId);
        if (order.isEmpty()) {
            log.warn("Cannot cancel unknown order {}", orderId);
            return false;
        }
        if (order.get().getStatus().isTerminal()) {
            log.info("Order {} is already {} - not cancelling", orderId, order.get().getStatus());
            return false;
        }
        if (!isConnected()) {
            log.warn("Cannot cancel order {} - not connected", orderId);
            return false;
        }
        orderLog.info("CANCEL_REQUEST | orderId={} | symbol={}", orderId, order.get().getSymbol());
        client.cancelOrder(orderId);
        return true;
    }

    public Optional<OrderRecord> getOrder(int orderId) {
        return orders.get(orderId);
    }

    public List<OrderRecord> getAllOrders() {
        return orders.all();
    }

    public List<OrderRecord> getActiveOrders() {
        return orders.active();
    }

    // ---- contract search ----

    /**
     * Contracts the gateway knows for a symbol, exact symbol matches first.
     *
     * @param secType STK, IND, ... or null for any
     */
    public RequestOutcome<List<ContractMatch>> searchContracts(String pattern, String secType, Duration timeout) {
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("search pattern is required");
        }
        if (!isConnected()) {
            return RequestOutcome.notConnected();
        }
        PendingRequest<ContractMatch> pending = registry.issue(RequestKind.CONTRACT_SEARCH, ContractMatch.class);
        client.reqContractDetails(pending.getRequestId(), contracts.searchTemplate(pattern, secType));
        String wanted = pattern.trim().toUpperCase(Locale.ROOT);
        return registry.await(pending, timeout).map(matches -> exactFirst(matches, wanted));
    }

    private static List<ContractMatch> exactFirst(List<ContractMatch> matches, String symbol) {
        List<ContractMatch> sorted = new ArrayList<>(matches.size());
        List<ContractMatch> partial = new ArrayList<>();
        for (ContractMatch match : matches) {
            if (symbol.equalsIgnoreCase(match.getSymbol())) {
                sorted.add(match);
            } else {
                partial.add(match);
            }
        }
        sorted.addAll(partial);
        return sorted;
    }

    /**
     * Fuzzy symbol lookup. The gateway sometimes never answers; a timeout yields an empty list.
     */
    public RequestOutcome<List<ContractMatch>> searchSymbols(String pattern, Duration timeout) {
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("search pattern is required");
        }
        if (!isConnected()) {
            return RequestOutcome.notConnected();
        }
        PendingRequest<ContractMatch> pending = registry.issue(RequestKind.SYMBOL_SEARCH, ContractMatch.class);
        client.reqMatchingSymbols(pending.getRequestId(), pattern.trim());
        RequestOutcome<List<ContractMatch>> outcome = registry.await(pending, timeout);
        if (outcome.getStatus() == OutcomeStatus.TIMED_OUT) {
            log.warn("Symbol search for '{}' timed out - returning no matches", pattern);
            return RequestOutcome.ok(List.of());
        }
        return outcome;
    }

    /**
     * Checks each symbol for an exact contract match, sharing the timeout between them.
     */
    public Map<String, Boolean> validateSymbols(Collection<String> symbols, Duration timeout) {
        Map<String, Boolean> result = new LinkedHashMap<>();
        if (symbols.isEmpty()) {
            return result;
        }
        Duration perSymbol = timeout.dividedBy(symbols.size());
        for (String symbol : symbols) {
            String secType = contracts.forSymbol(symbol).getSecType();
            String bare = symbol.trim().startsWith(ContractFactory.INDEX_PREFIX) ? symbol.trim().substring(1) : symbol;
            RequestOutcome<List<ContractMatch>> matches = searchContracts(bare, secType, perSymbol);
            boolean exists = matches.isOk() && matches.getValue().stream()
                    .anyMatch(m -> bare.trim().equalsIgnoreCase(m.getSymbol()));
            result.put(symbol, exists);
        }
        return result;
    }

    /**
     * Symbols worth watching: every open position, plus the local watchlist file. Falls back to a
     * default list when both are empty. Sorted and upper case.
     */
    public List<String> getWatchlistSymbols() {
        Set<String> symbols = new TreeSet<>();
        if (isConnected()) {
            RequestOutcome<List<Position>> positions = getPositions(Constants.WATCHLIST_POSITIONS_TIMEOUT);
            if (positions.isOk()) {
                for (Position position : positions.getValue()) {
                    if (position.getSymbol() != null) {
                        symbols.add(position.getSymbol().toUpperCase(Locale.ROOT));
                    }
                }
                log.debug("Got {} symbols from positions", symbols.size());
            } else {
                log.debug("Could not fetch positions for the watchlist: {}", positions);
            }
        }
        symbols.addAll(Watchlist.load(config));
        if (symbols.isEmpty()) {
            symbols.addAll(Constants.DEFAULT_WATCHLIST);
        }
        return new ArrayList<>(symbols);
    }

    // ---- helpers ----

    /**
     * Runs a request of a kind the gateway answers without a request id, one at a time per kind.
     * Time spent waiting for the previous request counts against the timeout.
     */
    private <T> RequestOutcome<T> exclusively(RequestKind kind, Duration timeout,
                                              Function<Duration, RequestOutcome<T>> call) {
        ReentrantLock lock = exclusiveLocks.get(kind);
        long start = System.nanoTime();
        try {
            if (!lock.tryLock(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
                log.warn("Another {} request still running after {}ms", kind, timeout.toMillis());
                return RequestOutcome.timedOut(GatewayError.NO_ID);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return RequestOutcome.failed(GatewayError.cancelled(GatewayError.NO_ID));
        }
        try {
            Duration remaining = timeout.minusNanos(System.nanoTime() - start);
            return call.apply(remaining.isNegative() ? Duration.ZERO : remaining);
        } finally {
            lock.unlock();
        }
    }
}
