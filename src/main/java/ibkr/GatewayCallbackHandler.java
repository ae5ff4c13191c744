package ibkr;

import data.RequestKind;
import data.RequestRegistry;
import ibkr.model.Bar;
import ibkr.model.ContractMatch;
import ibkr.model.ErrorCategory;
import ibkr.model.GatewayError;
import ibkr.model.OrderRecord;
import ibkr.wire.BarMessage;
import ibkr.wire.ContractDescriptionMessage;
import ibkr.wire.ContractDetailsMessage;
import ibkr.wire.ContractSpec;
import ibkr.wire.ExecutionMessage;
import ibkr.wire.GatewayListener;
import ibkr.wire.OrderTicket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import util.TimestampParser;

import java.math.BigDecimal;
import java.util.List;

/*
GatewayCallbackHandler - This is the "incoming" side. Everything TWS sends back (bars, ticks, positions,
order confirmations, errors) lands here on the reader thread and is handed to the tracker that owns it.
Nothing in here blocks: callbacks only update maps and wake waiting callers through the registry.
*/
public class GatewayCallbackHandler implements GatewayListener {
    private static final Logger log = LoggerFactory.getLogger(GatewayCallbackHandler.class);
    private static final Logger orderLog = LoggerFactory.getLogger("ORDER_AUDIT");

    private final ConnectionManager connection;
    private final RequestRegistry registry;
    private final OrderTracker orders;
    private final AccountTracker accounts;
    private final MarketDataCache marketData;
    private final ErrorClassifier classifier;
    private final TimestampParser timestampParser;

    public GatewayCallbackHandler(ConnectionManager connection, RequestRegistry registry, OrderTracker orders,
                                  AccountTracker accounts, MarketDataCache marketData, ErrorClassifier classifier,
                                  TimestampParser timestampParser) {
        this.connection = connection;
        this.registry = registry;
        this.orders = orders;
        this.accounts = accounts;
        this.marketData = marketData;
        this.classifier = classifier;
        this.timestampParser = timestampParser;
    }

    // ---- session ----

    @Override
    public void nextValidId(int orderId) {
        log.info("Received next valid order ID from TWS: {}", orderId);
        connection.onNextValidId(orderId);
    }

    @Override
    public void managedAccounts(String accountsList) {
        accounts.onManagedAccounts(accountsList);
    }

    @Override
    public void connectionClosed() {
        log.warn("TWS connection closed");
        connection.onConnectionClosed();
    }

    @Override
    public void error(Exception e) {
        log.error("TWS Exception: {}", e.getMessage(), e);
    }

    @Override
    public void error(int id, int errorCode, String errorMsg, String advancedOrderRejectJson) {
        ErrorCategory category = classifier.classify(errorCode);
        GatewayError error = new GatewayError(id, errorCode, errorMsg, category, advancedOrderRejectJson);

        switch (category) {
            case INFORMATIONAL:
                if (classifier.isWarning(errorCode)) {
                    log.warn("TWS Warning - id={}, code={}, msg={}", id, errorCode, errorMsg);
                } else {
                    log.debug("TWS Info - id={}, code={}, msg={}", id, errorCode, errorMsg);
                }
                if (errorCode == ErrorCodes.DELAYED_DATA_DISPLAYED) {
                    marketData.recordPermissionError(id, error);
                }
                return;
            case CONNECTION_FATAL:
                log.error("TWS Error - id={}, code={}, msg={}", id, errorCode, errorMsg);
                connection.onFatalError(error);
                if (id != GatewayError.NO_ID) {
                    registry.fail(id, error);
                }
                return;
            case ORDER_REJECTED:
                if (advancedOrderRejectJson != null) {
                    log.error("TWS Error - id={}, code={}, msg={}, orderReject={}",
                            id, errorCode, errorMsg, advancedOrderRejectJson);
                } else {
                    log.error("TWS Error - id={}, code={}, msg={}", id, errorCode, errorMsg);
                }
                if (!orders.onOrderError(id, error)) {
                    // some rejection codes also answer plain requests
                    failRequest(id, error);
                }
                return;
            case MARKET_DATA_PERMISSION:
                log.warn("TWS Error - id={}, code={}, msg={}", id, errorCode, errorMsg);
                marketData.recordPermissionError(id, error);
                failRequest(id, error);
                return;
            default:
                log.error("TWS Error - id={}, code={}, msg={} ({})", id, errorCode, errorMsg, category);
                if (!failRequest(id, error) && orders.contains(id)) {
                    orders.onOrderError(id, error);
                }
        }
    }

    private boolean failRequest(int id, GatewayError error) {
        if (id == GatewayError.NO_ID) {
            return false;
        }
        if (registry.fail(id, error)) {
            return true;
        }
        return marketData.recordStreamError(id, error);
    }

    // ---- historical data ----

    /**
     * Adds one bar to the waiting request. A bar whose time matches none of the known wire formats is
     * logged and dropped, so the result can hold fewer bars than the gateway sent.
     */
    @Override
    public void historicalData(int reqId, BarMessage message) {
        log.trace("HistoricalData reqId={}: time={}, O={}, H={}, L={}, C={}, V={}", reqId, message.getTime(),
                message.getOpen(), message.getHigh(), message.getLow(), message.getClose(), message.getVolume());
        Bar bar;
        try {
            bar = Bar.builder()
                    .timestamp(timestampParser.parse(message.getTime()))
                    .open(message.getOpen())
                    .high(message.getHigh())
                    .low(message.getLow())
                    .close(message.getClose())
                    .volume(message.getVolume())
                    .wap(message.getWap())
                    .barCount(message.getCount())
                    .build();
        } catch (IllegalArgumentException e) {
            log.warn("Skipping bar with unparseable time '{}' for reqId={}", message.getTime(), reqId);
            registry.touch(reqId);
            return;
        }
        registry.addFragment(reqId, Bar.class, bar);
    }

    @Override
    public void historicalDataEnd(int reqId, String startDateStr, String endDateStr) {
        log.debug("HistoricalData complete: reqId={}, range={} to {}", reqId, startDateStr, endDateStr);
        registry.complete(reqId);
    }

    // ---- market data ----

    @Override
    public void tickPrice(int tickerId, int field, double price) {
        if (marketData.onTickPrice(tickerId, field, price)) {
            registry.touch(tickerId);
        } else {
            log.trace("Tick price for unknown tickerId={} field={}", tickerId, field);
        }
    }

    @Override
    public void tickSize(int tickerId, int field, BigDecimal size) {
        if (marketData.onTickSize(tickerId, field, size)) {
            registry.touch(tickerId);
        }
    }

    @Override
    public void tickString(int tickerId, int field, String value) {
        log.trace("Tick String: tickerId={}, tickType={}, value={}", tickerId, field, value);
        if (marketData.onTickString(tickerId, field, value)) {
            registry.touch(tickerId);
        }
    }

    @Override
    public void tickSnapshotEnd(int reqId) {
        log.debug("Snapshot end: reqId={}", reqId);
        registry.complete(reqId);
    }

    @Override
    public void marketDataType(int reqId, int marketDataType) {
        log.debug("Market data type: reqId={}, type={}", reqId, marketDataType);
    }

    // ---- account ----

    @Override
    public void accountSummary(int reqId, String account, String tag, String value, String currency) {
        accounts.onAccountSummary(reqId, account, tag, value, currency);
    }

    @Override
    public void accountSummaryEnd(int reqId) {
        accounts.onAccountSummaryEnd(reqId);
    }

    @Override
    public void position(String account, ContractSpec contract, BigDecimal pos, double avgCost) {
        log.trace("Position: account={}, symbol={}, pos={}, avgCost={}", account, contract.getSymbol(), pos, avgCost);
        accounts.onPosition(account, contract, pos, avgCost);
    }

    @Override
    public void positionEnd() {
        accounts.onPositionEnd();
    }

    @Override
    public void updatePortfolio(ContractSpec contract, BigDecimal position, double marketPrice, double marketValue,
                                double averageCost, double unrealizedPNL, double realizedPNL, String accountName) {
        log.debug("Portfolio update: symbol={}, position={}, marketValue={}, unrealizedPNL={}",
                contract.getSymbol(), position, marketValue, unrealizedPNL);
        accounts.onPortfolioUpdate(contract, position, marketPrice, marketValue, averageCost, unrealizedPNL,
                realizedPNL, accountName);
    }

    @Override
    public void updateAccountValue(String key, String value, String currency, String accountName) {
        log.trace("Account value update: key={}, value={}, currency={}, account={}", key, value, currency, accountName);
        accounts.onAccountValue(key, value, currency, accountName);
    }

    @Override
    public void updateAccountTime(String timeStamp) {
        log.trace("Account time update: {}", timeStamp);
        accounts.onAccountTime(timeStamp);
    }

    @Override
    public void accountDownloadEnd(String accountName) {
        accounts.onAccountDownloadEnd(accountName);
    }

    // ---- executions ----

    @Override
    public void execDetails(int reqId, ContractSpec contract, ExecutionMessage execution) {
        accounts.onExecution(reqId, contract, execution);
    }

    @Override
    public void execDetailsEnd(int reqId) {
        log.debug("Execution details end: reqId={}", reqId);
        accounts.onExecutionEnd(reqId);
    }

    // ---- orders ----

    @Override
    public void openOrder(int orderId, ContractSpec contract, OrderTicket order, String status) {
        OrderRecord record = orders.onOpenOrder(orderId, contract, order, status);
        registry.addExclusiveFragment(RequestKind.OPEN_ORDERS, OrderRecord.class, record);
    }

    @Override
    public void openOrderEnd() {
        log.debug("Open order end");
        registry.completeExclusive(RequestKind.OPEN_ORDERS);
    }

    @Override
    public void orderStatus(int orderId, String status, BigDecimal filled, BigDecimal remaining, double avgFillPrice,
                            double lastFillPrice, String whyHeld) {
        if (orders.onOrderStatus(orderId, status, filled, remaining, avgFillPrice).isEmpty()) {
            orderLog.info("ORDER_STATUS | orderId={} | status={} | filled={} | remaining={} | avgFillPrice={} | untracked",
                    orderId, status, filled, remaining, avgFillPrice);
        }
        if (whyHeld != null && !whyHeld.isBlank()) {
            log.info("Order {} held: {}", orderId, whyHeld);
        }
    }

    // ---- contract search ----

    @Override
    public void contractDetails(int reqId, ContractDetailsMessage details) {
        ContractSpec contract = details.getContract();
        registry.addFragment(reqId, ContractMatch.class, toMatch(contract, details.getLongName()));
    }

    @Override
    public void contractDetailsEnd(int reqId) {
        registry.complete(reqId);
    }

    @Override
    public void symbolSamples(int reqId, List<ContractDescriptionMessage> contractDescriptions) {
        for (ContractDescriptionMessage description : contractDescriptions) {
            registry.addFragment(reqId, ContractMatch.class, toMatch(description.getContract(), null));
        }
        // matching symbols arrive in one message
        registry.complete(reqId);
    }

    private static ContractMatch toMatch(ContractSpec contract, String name) {
        return ContractMatch.builder()
                .conId(contract.getConId())
                .symbol(contract.getSymbol())
                .secType(contract.getSecType())
                .exchange(contract.getExchange())
                .primaryExchange(contract.getPrimaryExchange())
                .currency(contract.getCurrency())
                .name(name)
                .build();
    }
}
