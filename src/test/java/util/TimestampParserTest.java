package util;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimestampParserTest {

    private final TimestampParser parser = new TimestampParser();

    @Test
    void epochSeconds() {
        assertThat(parser.parse("1705329000")).isEqualTo(Instant.parse("2024-01-15T14:30:00Z"));
    }

    @Test
    void epochMillis() {
        assertThat(parser.parse("1705329000000")).isEqualTo(Instant.parse("2024-01-15T14:30:00Z"));
    }

    @Test
    void dateTimeWithZone() {
        assertThat(parser.parse("20240115 09:30:00 US/Eastern")).isEqualTo(Instant.parse("2024-01-15T14:30:00Z"));
    }

    @Test
    void executionTimeWithDoubleSpace() {
        assertThat(parser.parse("20240115  09:30:00 US/Eastern")).isEqualTo(Instant.parse("2024-01-15T14:30:00Z"));
    }

    @Test
    void dateTimeWithoutZoneUsesDefaultZone() {
        assertThat(parser.parse("20240115 09:30:00")).isEqualTo(Instant.parse("2024-01-15T14:30:00Z"));
        assertThat(new TimestampParser(ZoneOffset.UTC).parse("20240115 09:30:00"))
                .isEqualTo(Instant.parse("2024-01-15T09:30:00Z"));
    }

    @Test
    void dailyBarDateIsMidnightInDefaultZone() {
        assertThat(parser.parse("20240115")).isEqualTo(Instant.parse("2024-01-15T05:00:00Z"));
    }

    @Test
    void dashedFormIsUtc() {
        assertThat(parser.parse("20240115-14:30:00")).isEqualTo(Instant.parse("2024-01-15T14:30:00Z"));
    }

    @Test
    void garbageIsRejected() {
        assertThatThrownBy(() -> parser.parse("")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> parser.parse("yesterday")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> parser.parse("20241315 09:30:00")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> parser.parse("20240115 09:30:00 Mars/Olympus"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
