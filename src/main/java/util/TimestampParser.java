package util;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Parses the timestamp formats the gateway uses in bars and executions:
 * <ul>
 *   <li>epoch seconds, e.g. {@code 1705329000} (formatDate=2 and intraday bars)</li>
 *   <li>{@code yyyyMMdd HH:mm:ss} with an optional zone, e.g. {@code 20240115 09:30:00 US/Eastern};
 *       executions pad with two spaces</li>
 *   <li>bare {@code yyyyMMdd} for daily and larger bars</li>
 *   <li>{@code yyyyMMdd-HH:mm:ss}, always UTC</li>
 * </ul>
 * Values without a zone are read in the default zone given at construction.
 */
public class TimestampParser {
    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyyMMdd HH:mm:ss");
    private static final DateTimeFormatter DASHED_DATE_TIME = DateTimeFormatter.ofPattern("yyyyMMdd-HH:mm:ss");

    private final ZoneId defaultZone;

    public TimestampParser(ZoneId defaultZone) {
        this.defaultZone = defaultZone;
    }

    public TimestampParser() {
        this(Constants.EASTERN);
    }

    public Instant parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Empty timestamp");
        }
        String value = raw.trim().replaceAll("\\s+", " ");

        if (value.chars().allMatch(Character::isDigit)) {
            if (value.length() == 8) {
                return LocalDate.parse(value, DATE).atStartOfDay(defaultZone).toInstant();
            }
            long epoch = Long.parseLong(value);
            // 13 digits are milliseconds
            return value.length() >= 13 ? Instant.ofEpochMilli(epoch) : Instant.ofEpochSecond(epoch);
        }

        try {
            if (value.length() == 17 && value.charAt(8) == '-') {
                return LocalDateTime.parse(value, DASHED_DATE_TIME).toInstant(ZoneOffset.UTC);
            }
            if (value.length() >= 17 && value.charAt(8) == ' ') {
                LocalDateTime local = LocalDateTime.parse(value.substring(0, 17), DATE_TIME);
                String zone = value.substring(17).trim();
                return local.atZone(zone.isEmpty() ? defaultZone : ZoneId.of(zone)).toInstant();
            }
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Unparseable timestamp: " + raw, e);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Unknown zone in timestamp: " + raw, e);
        }
        throw new IllegalArgumentException("Unrecognized timestamp format: " + raw);
    }
}
