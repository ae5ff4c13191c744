package config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Local watchlist: one symbol per line, blank lines and lines starting with # ignored.
 * The gateway API does not expose TWS watchlists, so this file stands in for them.
 */
public final class Watchlist {
    private static final Logger log = LoggerFactory.getLogger(Watchlist.class);

    public static final String WATCHLIST_RESOURCE = "watchlist.txt";

    private Watchlist() {}

    /**
     * Reads the configured file, or watchlist.txt on the classpath when none is configured. A missing or
     * unreadable watchlist yields an empty set.
     */
    public static Set<String> load(GatewayConfig config) {
        String file = config.getWatchlistFile();
        if (file == null || file.isBlank()) {
            try (InputStream in = Watchlist.class.getClassLoader().getResourceAsStream(WATCHLIST_RESOURCE)) {
                if (in == null) {
                    return Set.of();
                }
                return parse(new InputStreamReader(in, StandardCharsets.UTF_8));
            } catch (IOException e) {
                log.warn("Could not read {} from classpath: {}", WATCHLIST_RESOURCE, e.getMessage());
                return Set.of();
            }
        }

        Path path = Path.of(file);
        if (!Files.exists(path)) {
            log.debug("Watchlist file {} does not exist", path);
            return Set.of();
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            Set<String> symbols = parse(reader);
            log.debug("Loaded {} symbols from {}", symbols.size(), path);
            return symbols;
        } catch (IOException e) {
            log.warn("Error loading watchlist file {}: {}", path, e.getMessage());
            return Set.of();
        }
    }

    public static Set<String> parse(Reader source) throws IOException {
        Set<String> symbols = new LinkedHashSet<>();
        BufferedReader reader = source instanceof BufferedReader ? (BufferedReader) source : new BufferedReader(source);
        String line;
        while ((line = reader.readLine()) != null) {
            String symbol = line.trim();
            if (!symbol.isEmpty() && !symbol.startsWith("#")) {
                symbols.add(symbol.toUpperCase(Locale.ROOT));
            }
        }
        return symbols;
    }
}
