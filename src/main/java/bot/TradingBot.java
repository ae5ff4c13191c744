package bot;

import config.GatewayConfig;
import data.RequestOutcome;
import ibkr.GatewaySession;
import ibkr.model.AccountValue;
import ibkr.model.AccountValueKey;
import ibkr.model.Position;
import ibkr.wire.GatewayClientFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;

public class TradingBot {
    private static final Logger log = LoggerFactory.getLogger(TradingBot.class);

    public static void main(String[] args) throws InterruptedException {
        GatewayConfig config = GatewayConfig.load();
        GatewaySession session = new GatewaySession(config, GatewayClientFactory.load());
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down - disconnecting from gateway");
            session.close();
            stopped.countDown();
        }, "shutdown"));

        if (!session.connect()) {
            log.error("Could not connect to {}:{} - the supervisor will keep retrying", config.getHost(), config.getPort());
        }
        session.startSupervisor();
        if (session.isConnected()) {
            report(session, config);
        }
        // keep the session (and its supervisor) alive until the process is stopped
        stopped.await();
    }

    private static void report(GatewaySession session, GatewayConfig config) {
        RequestOutcome<Map<AccountValueKey, AccountValue>> summary = session.getAccountSummary(config.getRequestTimeout());
        if (summary.isOk()) {
            for (AccountValue value : summary.getValue().values()) {
                log.info("{} {} = {} {}", value.getAccount(), value.getTag(), value.getValue(),
                        value.getCurrency() == null ? "" : value.getCurrency());
            }
        } else {
            log.warn("Account summary unavailable: {}", summary);
        }

        session.getAccountBalance(config.getRequestTimeout()).toOptional()
                .ifPresent(balance -> log.info("Balance ({}): {} {}", balance.getTag(), balance.getAmount(),
                        balance.getCurrency()));

        RequestOutcome<List<Position>> positions = session.getPortfolioPositions(config.getRequestTimeout());
        if (positions.isOk()) {
            if (positions.getValue().isEmpty()) {
                log.info("No open positions");
            }
            for (Position position : positions.getValue()) {
                log.info("{} {} @ {} | mkt {} | uPnL {} | since {}", position.getSymbol(), position.getQuantity(),
                        position.getAverageCost(), position.getMarketPrice(), position.getUnrealizedPnl(),
                        position.getEntryTime());
            }
        } else {
            log.warn("Positions unavailable: {}", positions);
        }
    }
}
