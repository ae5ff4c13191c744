package config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class WatchlistTest {

    @TempDir
    Path dir;

    @Test
    void commentsAndBlankLinesAreSkipped() throws Exception {
        assertThat(Watchlist.parse(new StringReader("# majors\nspy\n\n  qqq \n#iwm\nSPY\n")))
                .containsExactly("SPY", "QQQ");
    }

    @Test
    void configuredFileIsRead() throws Exception {
        Path file = dir.resolve("mine.txt");
        Files.writeString(file, "aapl\nmsft\n");

        assertThat(Watchlist.load(GatewayConfig.builder().watchlistFile(file.toString()).build()))
                .containsExactly("AAPL", "MSFT");
    }

    @Test
    void missingFileIsEmpty() {
        assertThat(Watchlist.load(GatewayConfig.builder().watchlistFile(dir.resolve("none.txt").toString()).build()))
                .isEmpty();
    }

    @Test
    void bundledWatchlistHasOnlyComments() {
        assertThat(Watchlist.load(GatewayConfig.builder().build())).isEmpty();
    }
}
