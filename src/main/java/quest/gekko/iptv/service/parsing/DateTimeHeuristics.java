package quest.gekko.iptv.service.parsing;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort reader for the date and time fragments playlist providers put in event names.
 * Needs a date and a time; the zone is optional and falls back to UTC.
 */
final class DateTimeHeuristics {

    private static final List<String> MONTHS =
            List.of("jan", "feb", "mar", "apr", "may", "jun", "jul", "aug", "sep", "oct", "nov", "dec");
    private static final String MONTH_NAME = "(Jan(?:uary)?|Feb(?:ruary)?|Mar(?:ch)?|Apr(?:il)?|May|June?|July?|Aug(?:ust)?"
            + "|Sep(?:t(?:ember)?)?|Oct(?:ober)?|Nov(?:ember)?|Dec(?:ember)?)\\b\\.?";

    private static final Pattern ISO_DATE = Pattern.compile("(?<!\\d)(\\d{4})-(\\d{1,2})-(\\d{1,2})(?!\\d)");
    private static final Pattern NUMERIC_DATE = Pattern.compile("(?<!\\d)(\\d{1,2})[/-](\\d{1,2})[/-](\\d{2,4})(?!\\d)");
    private static final Pattern MONTH_FIRST = Pattern.compile(
            "\\b" + MONTH_NAME + "\\s+(\\d{1,2})(?:st|nd|rd|th)?(?:\\s+(\\d{4}))?(?!\\d)", Pattern.CASE_INSENSITIVE);
    private static final Pattern DAY_FIRST = Pattern.compile(
            "(?<!\\d)(\\d{1,2})(?:st|nd|rd|th)?\\s+" + MONTH_NAME + "(?:\\s+(\\d{4}))?(?!\\d)", Pattern.CASE_INSENSITIVE);

    private static final Pattern CLOCK_TIME = Pattern.compile(
            "(?<![\\d:])(\\d{1,2}):(\\d{2})(?::(\\d{2}))?(?:\\s*([AP]M)(?![A-Za-z]))?", Pattern.CASE_INSENSITIVE);
    private static final Pattern HOUR_ONLY = Pattern.compile(
            "(?<![\\d:])(\\d{1,2})\\s*([AP]M)(?![A-Za-z])", Pattern.CASE_INSENSITIVE);

    private DateTimeHeuristics() {
    }

    static Optional<Instant> parse(final String text, final ZonePreference zones, final int referenceYear) {
        final Optional<LocalDate> date = date(text, referenceYear);
        final Optional<LocalTime> time = time(text);
        if (date.isEmpty() || time.isEmpty()) return Optional.empty();

        final ZoneId zone = zones.resolveIn(text).map(ZonePreference::zoneOf).orElse(ZoneOffset.UTC);
        return Optional.of(LocalDateTime.of(date.get(), time.get()).atZone(zone).toInstant());
    }

    static Optional<LocalDate> date(final String text, final int referenceYear) {
        Matcher m = ISO_DATE.matcher(text);
        if (m.find()) {
            return Optional.of(LocalDate.of(num(m, 1), num(m, 2), num(m, 3)));
        }
        m = NUMERIC_DATE.matcher(text);
        if (m.find()) {
            final int first = num(m, 1);
            final int second = num(m, 2);
            final int year = fullYear(num(m, 3));
            // month-first unless the first number cannot be a month
            return Optional.of(first > 12 ? LocalDate.of(year, second, first) : LocalDate.of(year, first, second));
        }
        m = MONTH_FIRST.matcher(text);
        if (m.find()) {
            final int year = m.group(3) == null ? referenceYear : num(m, 3);
            return Optional.of(LocalDate.of(year, month(m.group(1)), num(m, 2)));
        }
        m = DAY_FIRST.matcher(text);
        if (m.find()) {
            final int year = m.group(3) == null ? referenceYear : num(m, 3);
            return Optional.of(LocalDate.of(year, month(m.group(2)), num(m, 1)));
        }
        return Optional.empty();
    }

    static Optional<LocalTime> time(final String text) {
        Matcher m = CLOCK_TIME.matcher(text);
        if (m.find()) {
            final int hour = num(m, 1);
            final int minute = num(m, 2);
            final int second = m.group(3) == null ? 0 : num(m, 3);
            return Optional.of(LocalTime.of(toTwentyFour(hour, m.group(4)), minute, second));
        }
        m = HOUR_ONLY.matcher(text);
        if (m.find()) {
            return Optional.of(LocalTime.of(toTwentyFour(num(m, 1), m.group(2)), 0));
        }
        return Optional.empty();
    }

    private static int toTwentyFour(final int hour, final String meridiem) {
        if (meridiem == null) return hour;
        if (hour < 1 || hour > 12) {
            throw new IllegalArgumentException("Hour " + hour + " with " + meridiem);
        }
        final boolean pm = meridiem.equalsIgnoreCase("PM");
        if (hour == 12) return pm ? 12 : 0;
        return pm ? hour + 12 : hour;
    }

    private static int fullYear(final int year) {
        return year < 100 ? 2000 + year : year;
    }

    private static int month(final String name) {
        return MONTHS.indexOf(name.substring(0, 3).toLowerCase(Locale.ROOT)) + 1;
    }

    private static int num(final Matcher m, final int group) {
        return Integer.parseInt(m.group(group));
    }
}
