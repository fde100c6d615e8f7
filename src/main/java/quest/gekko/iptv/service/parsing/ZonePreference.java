package quest.gekko.iptv.service.parsing;

import quest.gekko.iptv.exception.ConfigInvalidException;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Ordered zone abbreviations used to pick the relevant time when a title lists several, and to
 * resolve the zone of a time that carries none of its own.
 */
public record ZonePreference(List<String> order) {

    public static final List<String> DEFAULT_ORDER =
            List.of("EST", "EDT", "CST", "CDT", "MST", "MDT", "PST", "PDT", "UK", "UTC");

    /** Recognized but never preferred over the configured order. */
    private static final List<String> FALLBACK = List.of("ET", "GMT", "BST");

    private static final Map<String, ZoneId> ZONES = new LinkedHashMap<>();

    static {
        ZONES.put("EST", ZoneOffset.ofHours(-5));
        ZONES.put("EDT", ZoneOffset.ofHours(-4));
        ZONES.put("CST", ZoneOffset.ofHours(-6));
        ZONES.put("CDT", ZoneOffset.ofHours(-5));
        ZONES.put("MST", ZoneOffset.ofHours(-7));
        ZONES.put("MDT", ZoneOffset.ofHours(-6));
        ZONES.put("PST", ZoneOffset.ofHours(-8));
        ZONES.put("PDT", ZoneOffset.ofHours(-7));
        ZONES.put("UK", ZoneOffset.UTC);
        ZONES.put("UTC", ZoneOffset.UTC);
        ZONES.put("GMT", ZoneOffset.UTC);
        ZONES.put("BST", ZoneOffset.ofHours(1));
        ZONES.put("ET", ZoneId.of("America/New_York"));
    }

    public ZonePreference {
        if (order == null || order.isEmpty()) {
            order = DEFAULT_ORDER;
        }
        final List<String> normalized = new ArrayList<>();
        for (String zone : order) {
            final String upper = zone.strip().toUpperCase(Locale.ROOT);
            if (!ZONES.containsKey(upper)) {
                throw new ConfigInvalidException("Unknown zone abbreviation in preference: " + zone);
            }
            normalized.add(upper);
        }
        order = List.copyOf(normalized);
    }

    public static ZonePreference defaults() {
        return new ZonePreference(DEFAULT_ORDER);
    }

    /** Most preferred abbreviation occurring in {@code text} as a whole word. */
    public Optional<String> firstIn(final String text) {
        return order.stream().filter(zone -> contains(text, zone)).findFirst();
    }

    /** Like {@link #firstIn} but also considers ET, GMT and BST. */
    public Optional<String> resolveIn(final String text) {
        return firstIn(text).or(() -> FALLBACK.stream().filter(zone -> contains(text, zone)).findFirst());
    }

    public static ZoneId zoneOf(final String abbreviation) {
        return ZONES.getOrDefault(abbreviation.toUpperCase(Locale.ROOT), ZoneOffset.UTC);
    }

    static boolean contains(final String text, final String zone) {
        return Pattern.compile("(?<![A-Za-z])" + zone + "(?![A-Za-z])").matcher(text).find();
    }
}
