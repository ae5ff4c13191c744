package ibkr;

import data.RequestKind;
import data.RequestRegistry;
import ibkr.model.AccountValue;
import ibkr.model.AccountValueKey;
import ibkr.model.Execution;
import ibkr.model.OrderSide;
import ibkr.model.Position;
import ibkr.wire.ContractSpec;
import ibkr.wire.ExecutionMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import util.TimestampParser;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Account side of the session: position and summary rows on their way to a waiting caller, the
 * streaming portfolio cache with its synthesized entry times, account values and the managed accounts.
 * Callback methods run on the reader thread and only touch maps and the registry.
 */
public class AccountTracker {
    private static final Logger log = LoggerFactory.getLogger(AccountTracker.class);
    private static final Logger orderLog = LoggerFactory.getLogger("ORDER_AUDIT");

    private final RequestRegistry registry;
    private final Clock clock;
    private final TimestampParser timestampParser;

    private final Map<String, Position> portfolio = new LinkedHashMap<>();
    private final Map<String, Instant> firstSeen = new HashMap<>();
    private final Map<AccountValueKey, AccountValue> accountValues = new LinkedHashMap<>();
    private volatile List<String> managedAccounts = List.of();
    private volatile String lastAccountTime;

    public AccountTracker(RequestRegistry registry, Clock clock, TimestampParser timestampParser) {
        this.registry = registry;
        this.clock = clock;
        this.timestampParser = timestampParser;
    }

    // ---- positions ----

    public void onPosition(String account, ContractSpec contract, BigDecimal quantity, double averageCost) {
        if (quantity == null || quantity.signum() == 0) {
            log.trace("Skipping flat position {} in {}", contract.getSymbol(), account);
            return;
        }
        Position position = Position.builder()
                .account(account)
                .symbol(contract.getSymbol())
                .secType(contract.getSecType())
                .quantity(quantity)
                .averageCost(averageCost)
                .entryTime(firstSeenOf(contract.getSymbol()))
                .build();
        if (!registry.addExclusiveFragment(RequestKind.POSITIONS, Position.class, position)) {
            log.debug("Position {} {} arrived with no request waiting", contract.getSymbol(), quantity);
        }
    }

    public void onPositionEnd() {
        registry.completeExclusive(RequestKind.POSITIONS);
    }

    // ---- portfolio ----

    public void onPortfolioUpdate(ContractSpec contract, BigDecimal quantity, double marketPrice, double marketValue,
                                  double averageCost, double unrealizedPnl, double realizedPnl, String account) {
        String symbol = contract.getSymbol();
        synchronized (portfolio) {
            if (quantity == null || quantity.signum() == 0) {
                if (portfolio.remove(symbol) != null) {
                    log.info("Position in {} closed", symbol);
                }
                firstSeen.remove(symbol);
            } else {
                Instant entry = firstSeen.computeIfAbsent(symbol, s -> clock.instant());
                portfolio.put(symbol, Position.builder()
                        .account(account)
                        .symbol(symbol)
                        .secType(contract.getSecType())
                        .quantity(quantity)
                        .averageCost(averageCost)
                        .marketPrice(marketPrice)
                        .marketValue(marketValue)
                        .unrealizedPnl(unrealizedPnl)
                        .realizedPnl(realizedPnl)
                        .entryTime(entry)
                        .build());
            }
        }
        registry.exclusiveOwner(RequestKind.PORTFOLIO).ifPresent(registry::touch);
    }

    public void onAccountDownloadEnd(String account) {
        log.debug("Account download end for {}", account);
        registry.completeExclusive(RequestKind.PORTFOLIO);
    }

    public List<Position> portfolio() {
        synchronized (portfolio) {
            return new ArrayList<>(portfolio.values());
        }
    }

    private Instant firstSeenOf(String symbol) {
        synchronized (portfolio) {
            return firstSeen.get(symbol);
        }
    }

    /**
     * Moves each position's entry time back to the execution that opened it, when the executions show
     * an earlier opening than the first observation. The earlier time is remembered, so repeated
     * calls keep returning it.
     */
    public List<Position> applyExecutionEntryTimes(List<Position> positions, Collection<Execution> executions) {
        Map<String, List<Execution>> bySymbol = executions.stream()
                .filter(e -> e.getTime() != null && e.getSymbol() != null && e.getSide() != null && e.getShares() != null)
                .collect(Collectors.groupingBy(Execution::getSymbol));
        List<Position> result = new ArrayList<>(positions.size());
        for (Position position : positions) {
            Optional<Instant> opened = openingTime(position.getQuantity(),
                    bySymbol.getOrDefault(position.getSymbol(), List.of()));
            if (opened.isPresent()
                    && (position.getEntryTime() == null || opened.get().isBefore(position.getEntryTime()))) {
                synchronized (portfolio) {
                    if (portfolio.containsKey(position.getSymbol())) {
                        firstSeen.put(position.getSymbol(), opened.get());
                    }
                }
                result.add(position.toBuilder().entryTime(opened.get()).build());
            } else {
                result.add(position);
            }
        }
        return result;
    }

    /**
     * Walks executions newest first, undoing their share deltas, until the running quantity reaches zero.
     * The execution at that point opened the current position.
     */
    static Optional<Instant> openingTime(BigDecimal quantity, List<Execution> executions) {
        if (quantity == null || quantity.signum() == 0 || executions.isEmpty()) {
            return Optional.empty();
        }
        List<Execution> newestFirst = new ArrayList<>(executions);
        newestFirst.sort(Comparator.comparing(Execution::getTime).reversed());
        BigDecimal remaining = quantity;
        for (Execution execution : newestFirst) {
            remaining = remaining.subtract(execution.signedShares());
            if (remaining.signum() == 0) {
                return Optional.of(execution.getTime());
            }
            if (remaining.signum() != quantity.signum()) {
                // position flipped sides inside this fill
                return Optional.of(execution.getTime());
            }
        }
        return Optional.empty();
    }

    // ---- account values ----

    public void onAccountSummary(int reqId, String account, String tag, String value, String currency) {
        AccountValue accountValue = AccountValue.builder()
                .account(account)
                .tag(tag)
                .value(value)
                .currency(currency)
                .build();
        registry.addFragment(reqId, AccountValue.class, accountValue);
    }

    public void onAccountSummaryEnd(int reqId) {
        registry.complete(reqId);
    }

    /**
     * Replaces the cached summary values with the rows of one finished summary request.
     */
    public Map<AccountValueKey, AccountValue> storeSummary(List<AccountValue> rows) {
        Map<AccountValueKey, AccountValue> summary = new LinkedHashMap<>();
        for (AccountValue row : rows) {
            summary.put(row.key(), row);
        }
        synchronized (accountValues) {
            accountValues.clear();
            accountValues.putAll(summary);
        }
        return summary;
    }

    public void onAccountValue(String key, String value, String currency, String account) {
        AccountValue accountValue = AccountValue.builder()
                .account(account)
                .tag(key)
                .value(value)
                .currency(currency)
                .build();
        synchronized (accountValues) {
            accountValues.put(accountValue.key(), accountValue);
        }
    }

    public void onAccountTime(String timeStamp) {
        lastAccountTime = timeStamp;
    }

    public Map<AccountValueKey, AccountValue> accountValues() {
        synchronized (accountValues) {
            return new LinkedHashMap<>(accountValues);
        }
    }

    public String getLastAccountTime() {
        return lastAccountTime;
    }

    public void onManagedAccounts(String accountsList) {
        List<String> accounts = accountsList == null ? List.of() : Arrays.stream(accountsList.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
        managedAccounts = accounts;
        log.info("Managed accounts: {}", accounts);
    }

    public List<String> getManagedAccounts() {
        return managedAccounts;
    }

    // ---- executions ----

    public void onExecution(int reqId, ContractSpec contract, ExecutionMessage message) {
        Execution execution = toExecution(contract, message);
        if (reqId == -1 || !registry.addFragment(reqId, Execution.class, execution)) {
            orderLog.info("EXECUTION | orderId={} | execId={} | symbol={} | side={} | shares={} | price={}",
                    message.getOrderId(), message.getExecId(), contract.getSymbol(), message.getSide(),
                    message.getShares(), message.getPrice());
        }
    }

    public void onExecutionEnd(int reqId) {
        registry.complete(reqId);
    }

    Execution toExecution(ContractSpec contract, ExecutionMessage message) {
        Instant time = null;
        if (message.getTime() != null && !message.getTime().isBlank()) {
            try {
                time = timestampParser.parse(message.getTime());
            } catch (IllegalArgumentException e) {
                log.warn("Execution {} has unparseable time '{}'", message.getExecId(), message.getTime());
            }
        }
        OrderSide side;
        try {
            side = OrderSide.fromWire(message.getSide());
        } catch (IllegalArgumentException e) {
            log.warn("Execution {} has unknown side '{}'", message.getExecId(), message.getSide());
            side = null;
        }
        return Execution.builder()
                .execId(message.getExecId())
                .orderId(message.getOrderId())
                .account(message.getAcctNumber())
                .symbol(contract.getSymbol())
                .secType(contract.getSecType())
                .side(side)
                .shares(message.getShares())
                .price(message.getPrice())
                .avgPrice(message.getAvgPrice())
                .time(time)
                .build();
    }
}
