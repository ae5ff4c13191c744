package ibkr;

import ibkr.model.AccountValue;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Picks a single balance figure out of an account summary. Each strategy names one summary tag;
 * they are tried in order and the first one with a parseable value wins.
 */
public class AccountBalanceExtractor {
    private static final Logger log = LoggerFactory.getLogger(AccountBalanceExtractor.class);

    public static final List<Strategy> DEFAULT_STRATEGIES = List.of(
            new Strategy("net liquidation", "NetLiquidation"),
            new Strategy("total cash", "TotalCashValue"),
            new Strategy("available funds", "AvailableFunds"),
            new Strategy("buying power", "BuyingPower"),
            new Strategy("equity with loan", "EquityWithLoanValue"));

    private final List<Strategy> strategies;

    public AccountBalanceExtractor() {
        this(DEFAULT_STRATEGIES);
    }

    public AccountBalanceExtractor(List<Strategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    /**
     * @param account only values of this account are considered, null or blank for any account
     */
    public Optional<Balance> extract(Collection<AccountValue> values, String account) {
        for (Strategy strategy : strategies) {
            for (AccountValue value : values) {
                if (!strategy.getTag().equals(value.getTag())) {
                    continue;
                }
                if (account != null && !account.isBlank() && !account.equals(value.getAccount())) {
                    continue;
                }
                OptionalDouble amount = value.asDouble();
                if (amount.isPresent()) {
                    log.debug("Account balance from {} ({}): {}", strategy.getName(), value.getAccount(),
                            amount.getAsDouble());
                    return Optional.of(new Balance(strategy.getTag(), value.getAccount(), amount.getAsDouble(),
                            value.getCurrency()));
                }
            }
        }
        log.warn("No balance tag found among {} account values", values.size());
        return Optional.empty();
    }

    public List<String> tags() {
        return strategies.stream().map(Strategy::getTag).toList();
    }

    public List<Strategy> getStrategies() {
        return strategies;
    }

    @Value
    public static class Strategy {
        String name;
        String tag;
    }

    @Value
    public static class Balance {
        String tag;
        String account;
        double amount;
        String currency;
    }
}
