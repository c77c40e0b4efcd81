package io.rollcron.utils;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Objects;

/**
 * Parses duration strings used in the config file.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>Numeric seconds: "30"</li>
 *   <li>Compact: "500ms", "10s", "5m", "2h", "1d", "1w"</li>
 *   <li>Human-readable pairs: "5 minutes", "1 hour 30 minutes"</li>
 * </ul>
 */
public final class DurationParser {
    private DurationParser() {
    }

    public static Duration parse(String input) {
        Objects.requireNonNull(input, "input must not be null");
        String s = input.trim().toLowerCase(Locale.ROOT);
        if (s.isEmpty()) {
            throw new IllegalArgumentException("Duration string must not be empty");
        }

        if (s.matches("^\\d+$")) {
            try {
                return Duration.ofSeconds(Long.parseLong(s));
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Duration seconds out of range: " + input);
            }
        }

        if (s.matches("^\\d+\\s*ms$")) {
            return Duration.ofMillis(Long.parseLong(s.replaceAll("[^0-9]", "")));
        }

        if (s.matches("^\\d+\\s*[smhdw]$")) {
            String digits = s.replaceAll("[^0-9]", "");
            char u = s.replaceAll("[0-9\\s]", "").charAt(0);
            long n = Long.parseLong(digits);
            return switch (u) {
                case 's' -> Duration.ofSeconds(n);
                case 'm' -> Duration.ofMinutes(n);
                case 'h' -> Duration.ofHours(n);
                case 'd' -> Duration.ofDays(n);
                case 'w' -> Duration.ofDays(7L * n);
                default -> throw new IllegalArgumentException("Unsupported compact unit: " + u);
            };
        }

        String[] parts = s.split("\\s+");
        if (parts.length % 2 != 0) {
            throw new IllegalArgumentException("Invalid duration format. Expected pairs like '3 minutes': " + input);
        }

        boolean seenWeek = false, seenDay = false, seenHour = false, seenMinute = false, seenSecond = false;
        long totalSeconds = 0;

        for (int i = 0; i < parts.length; i += 2) {
            long n;
            try {
                n = Long.parseLong(parts[i]);
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Invalid number in duration: " + parts[i]);
            }
            if (n < 0) {
                throw new IllegalArgumentException("Duration values must be non-negative");
            }

            String unit = parts[i + 1];
            if (unit.endsWith("s")) {
                unit = unit.substring(0, unit.length() - 1);
            }

            switch (unit) {
                case "week" -> {
                    if (seenWeek) throw new IllegalArgumentException("Duplicate unit: week");
                    seenWeek = true;
                    totalSeconds += ChronoUnit.DAYS.getDuration().toSeconds() * 7L * n;
                }
                case "day" -> {
                    if (seenDay) throw new IllegalArgumentException("Duplicate unit: day");
                    seenDay = true;
                    totalSeconds += ChronoUnit.DAYS.getDuration().toSeconds() * n;
                }
                case "hour" -> {
                    if (seenHour) throw new IllegalArgumentException("Duplicate unit: hour");
                    seenHour = true;
                    totalSeconds += ChronoUnit.HOURS.getDuration().toSeconds() * n;
                }
                case "minute" -> {
                    if (seenMinute) throw new IllegalArgumentException("Duplicate unit: minute");
                    seenMinute = true;
                    totalSeconds += ChronoUnit.MINUTES.getDuration().toSeconds() * n;
                }
                case "second" -> {
                    if (seenSecond) throw new IllegalArgumentException("Duplicate unit: second");
                    seenSecond = true;
                    totalSeconds += n;
                }
                default -> throw new IllegalArgumentException("Unsupported duration unit: " + parts[i + 1]);
            }
        }

        return Duration.ofSeconds(totalSeconds);
    }
}
