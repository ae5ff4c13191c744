package ibkr;

import ibkr.wire.ContractSpec;

import java.util.Locale;
import java.util.Set;

/**
 * Builds wire contracts from plain symbols. Volatility and equity indices are quoted as IND on CBOE,
 * everything else as a SMART-routed US stock. A leading '^' forces the index form, e.g. "^VIX".
 */
public class ContractFactory {
    public static final String INDEX_PREFIX = "^";

    private final Set<String> indexSymbols;

    public ContractFactory(Set<String> indexSymbols) {
        this.indexSymbols = indexSymbols;
    }

    public ContractSpec forSymbol(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol must not be blank");
        }
        String normalized = symbol.trim().toUpperCase(Locale.ROOT);
        if (normalized.startsWith(INDEX_PREFIX)) {
            return index(normalized.substring(INDEX_PREFIX.length()));
        }
        if (indexSymbols.contains(normalized)) {
            return index(normalized);
        }
        return stock(normalized);
    }

    public boolean isIndex(String symbol) {
        String normalized = symbol.trim().toUpperCase(Locale.ROOT);
        return normalized.startsWith(INDEX_PREFIX) || indexSymbols.contains(normalized);
    }

    public ContractSpec stock(String symbol) {
        return ContractSpec.builder()
                .symbol(symbol)
                .secType("STK")
                .exchange("SMART")
                .currency("USD")
                .build();
    }

    public ContractSpec index(String symbol) {
        return ContractSpec.builder()
                .symbol(symbol)
                .secType("IND")
                .exchange("CBOE")
                .currency("USD")
                .build();
    }

    /** Search template: a symbol plus an optional security type, no routing. */
    public ContractSpec searchTemplate(String pattern, String secType) {
        ContractSpec.ContractSpecBuilder builder = ContractSpec.builder()
                .symbol(pattern.trim().toUpperCase(Locale.ROOT))
                .currency("USD");
        if (secType != null && !secType.isBlank()) {
            builder.secType(secType.trim().toUpperCase(Locale.ROOT));
        }
        return builder.build();
    }
}
