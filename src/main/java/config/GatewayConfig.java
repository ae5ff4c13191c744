package config;

import ibkr.model.MarketDataMode;
import lombok.Builder;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import util.Constants;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Gateway connection settings.
 * Loaded from traderbot.properties on the classpath, then the file named by TRADERBOT_CONFIG,
 * then environment variables (IB_HOST, IB_PORT, IB_CLIENT_ID, IB_TIMEOUT, IB_ACCOUNT, IB_MARKET_DATA_TYPE,
 * IB_WATCHLIST_FILE).
 */
@Value
@Builder(toBuilder = true)
public class GatewayConfig {
    private static final Logger log = LoggerFactory.getLogger(GatewayConfig.class);

    public static final String CONFIG_RESOURCE = "traderbot.properties";
    public static final String CONFIG_FILE_ENV = "TRADERBOT_CONFIG";

    @Builder.Default
    String host = "127.0.0.1";
    @Builder.Default
    int port = Constants.DEFAULT_GATEWAY_PORT;
    @Builder.Default
    int clientId = 1;
    @Builder.Default
    Duration connectTimeout = Duration.ofSeconds(10);
    @Builder.Default
    Duration requestTimeout = Duration.ofSeconds(30);
    @Builder.Default
    Duration supervisorInterval = Duration.ofSeconds(5);
    @Builder.Default
    Duration snapshotQuietPeriod = Duration.ofMillis(1500);
    @Builder.Default
    MarketDataMode marketDataMode = MarketDataMode.LIVE;
    /** blank means every managed account */
    @Builder.Default
    String account = "";
    @Builder.Default
    Set<String> indexSymbols = Constants.DEFAULT_INDEX_SYMBOLS;
    @Builder.Default
    ZoneId timeZone = Constants.EASTERN;
    /** blank means watchlist.txt on the classpath */
    @Builder.Default
    String watchlistFile = "";

    public static GatewayConfig load() {
        Properties properties = new Properties();
        try (InputStream in = GatewayConfig.class.getClassLoader().getResourceAsStream(CONFIG_RESOURCE)) {
            if (in != null) {
                properties.load(in);
                log.debug("Loaded {} from classpath", CONFIG_RESOURCE);
            }
        } catch (IOException e) {
            log.warn("Could not read {} from classpath: {}", CONFIG_RESOURCE, e.getMessage());
        }

        String file = System.getenv(CONFIG_FILE_ENV);
        if (file != null && !file.isBlank()) {
            try (InputStream in = new FileInputStream(file)) {
                properties.load(in);
                log.info("Loaded configuration overrides from {}", file);
            } catch (IOException e) {
                throw new IllegalArgumentException("Cannot read " + CONFIG_FILE_ENV + "=" + file, e);
            }
        }
        return fromProperties(properties, System.getenv());
    }

    public static GatewayConfig fromProperties(Properties properties, Map<String, String> env) {
        GatewayConfigBuilder builder = GatewayConfig.builder();

        String host = pick(properties, env, "ib.host", "IB_HOST");
        if (host != null) {
            builder.host(host);
        }
        String port = pick(properties, env, "ib.port", "IB_PORT");
        if (port != null) {
            builder.port(parsePositiveInt("ib.port", port));
        }
        String clientId = pick(properties, env, "ib.clientId", "IB_CLIENT_ID");
        if (clientId != null) {
            builder.clientId(parseInt("ib.clientId", clientId));
        }
        String connectTimeout = pick(properties, env, "ib.timeout", "IB_TIMEOUT");
        if (connectTimeout != null) {
            builder.connectTimeout(Duration.ofSeconds(parsePositiveInt("ib.timeout", connectTimeout)));
        }
        String requestTimeout = pick(properties, env, "ib.requestTimeout", null);
        if (requestTimeout != null) {
            builder.requestTimeout(Duration.ofSeconds(parsePositiveInt("ib.requestTimeout", requestTimeout)));
        }
        String interval = pick(properties, env, "ib.supervisorInterval", null);
        if (interval != null) {
            builder.supervisorInterval(Duration.ofSeconds(parsePositiveInt("ib.supervisorInterval", interval)));
        }
        String quiet = pick(properties, env, "ib.snapshotQuietPeriodMillis", null);
        if (quiet != null) {
            builder.snapshotQuietPeriod(Duration.ofMillis(parsePositiveInt("ib.snapshotQuietPeriodMillis", quiet)));
        }
        String mode = pick(properties, env, "ib.marketDataType", "IB_MARKET_DATA_TYPE");
        if (mode != null) {
            builder.marketDataMode(parseMode(mode));
        }
        String account = pick(properties, env, "ib.account", "IB_ACCOUNT");
        if (account != null) {
            builder.account(account);
        }
        String indexSymbols = pick(properties, env, "ib.indexSymbols", null);
        if (indexSymbols != null) {
            builder.indexSymbols(Arrays.stream(indexSymbols.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .map(s -> s.toUpperCase(Locale.ROOT))
                    .collect(Collectors.toUnmodifiableSet()));
        }
        String zone = pick(properties, env, "ib.timeZone", null);
        if (zone != null) {
            try {
                builder.timeZone(ZoneId.of(zone));
            } catch (RuntimeException e) {
                throw new IllegalArgumentException("Invalid ib.timeZone: " + zone, e);
            }
        }

        String watchlistFile = pick(properties, env, "ib.watchlistFile", "IB_WATCHLIST_FILE");
        if (watchlistFile != null) {
            builder.watchlistFile(watchlistFile);
        }

        GatewayConfig config = builder.build();
        log.info("Gateway config: host={}, port={}, clientId={}, marketData={}",
                config.getHost(), config.getPort(), config.getClientId(), config.getMarketDataMode());
        return config;
    }

    // environment wins over the properties file
    private static String pick(Properties properties, Map<String, String> env, String key, String envKey) {
        if (envKey != null) {
            String value = env.get(envKey);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        String value = properties.getProperty(key);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + key + ": " + value, e);
        }
    }

    private static int parsePositiveInt(String key, String value) {
        int parsed = parseInt(key, value);
        if (parsed <= 0) {
            throw new IllegalArgumentException("Invalid " + key + ": must be positive, got " + value);
        }
        return parsed;
    }

    private static MarketDataMode parseMode(String value) {
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (MarketDataMode mode : MarketDataMode.values()) {
            if (mode.name().equals(normalized) || String.valueOf(mode.getWireValue()).equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Invalid ib.marketDataType: " + value);
    }
}
