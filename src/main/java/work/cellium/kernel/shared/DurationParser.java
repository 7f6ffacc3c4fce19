package work.cellium.kernel.shared;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses user-facing durations: {@code 250ms}, {@code 30s}, {@code 2m}, {@code 1h}, a bare number
 * of milliseconds, or an ISO-8601 duration such as {@code PT1M30S}.
 */
public final class DurationParser {
    private static final Pattern SHORT_FORM = Pattern.compile("(\\d+)\\s*(ms|s|m|h)?");

    private DurationParser() {}

    /**
     * @return empty for a null or blank input
     * @throws IllegalArgumentException when the text is not a recognised duration
     */
    public static Optional<Duration> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        var trimmed = raw.trim().toLowerCase(Locale.ROOT);
        if (trimmed.startsWith("p")) {
            try {
                return Optional.of(Duration.parse(trimmed.toUpperCase(Locale.ROOT)));
            } catch (DateTimeParseException ex) {
                throw new IllegalArgumentException("Invalid ISO-8601 duration: " + raw, ex);
            }
        }
        var matcher = SHORT_FORM.matcher(trimmed);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid duration: '" + raw + "' (expected e.g. 250ms, 30s, 2m, 1h)");
        }
        long amount;
        try {
            amount = Long.parseLong(matcher.group(1));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Duration out of range: " + raw, ex);
        }
        var unit = matcher.group(2) == null ? "ms" : matcher.group(2);
        switch (unit) {
            case "s":
                return Optional.of(Duration.ofSeconds(amount));
            case "m":
                return Optional.of(Duration.ofMinutes(amount));
            case "h":
                return Optional.of(Duration.ofHours(amount));
            default:
                return Optional.of(Duration.ofMillis(amount));
        }
    }

    /**
     * Like {@link #parse} but also accepts numbers (milliseconds), as produced by TOML and YAML
     * readers.
     */
    public static Optional<Duration> fromValue(Object value) {
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Number number) {
            return Optional.of(Duration.ofMillis(number.longValue()));
        }
        if (value instanceof Duration duration) {
            return Optional.of(duration);
        }
        return parse(String.valueOf(value));
    }
}
