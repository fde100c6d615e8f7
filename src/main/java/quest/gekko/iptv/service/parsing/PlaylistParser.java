package quest.gekko.iptv.service.parsing;

import lombok.extern.slf4j.Slf4j;
import quest.gekko.iptv.domain.ChannelRecord;
import quest.gekko.iptv.exception.ParseFailureException;
import quest.gekko.iptv.repository.TtlPolicy;
import quest.gekko.iptv.util.Hashing;
import quest.gekko.iptv.util.Slug;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses M3U playlists into channel records, recognizing dated event entries.
 */
@Slf4j
public class PlaylistParser {

    public static final String NO_LOGO = "https://via.placeholder.com/240x135.png?text=No+Logo";

    static final String DEFAULT_EXTGRP = "Uncategorized";
    static final String DEFAULT_GROUP = "Other";
    static final String UNKNOWN_CHANNEL = "Unknown Channel";

    private static final String HEADER = "#EXTM3U";
    private static final Pattern ATTRIBUTE = Pattern.compile("(\\w[\\w-]*)\\s*=\\s*\"([^\"]*)\"");
    private static final DateTimeFormatter ID_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter DISPLAY_TIME = DateTimeFormatter.ofPattern("MMM d h:mma", Locale.US);

    private final EventTimeExtractor extractor;
    private final TtlPolicy ttlPolicy;
    private final Clock clock;
    private final Path staticDir;
    private final ZoneId displayZone;

    public PlaylistParser(final EventTimeExtractor extractor, final TtlPolicy ttlPolicy, final Clock clock,
                          final Path staticDir, final ZoneId displayZone) {
        this.extractor = extractor;
        this.ttlPolicy = ttlPolicy;
        this.clock = clock;
        this.staticDir = staticDir;
        this.displayZone = displayZone;
    }

    /**
     * @param content raw playlist text
     * @param baseUrl external base URL used for static group logos
     * @throws ParseFailureException when the content has no {@code #EXTM3U} header
     */
    public ParsedPlaylist parse(final String content, final String baseUrl) {
        if (content == null) throw new ParseFailureException("Playlist is empty");
        final int header = content.indexOf(HEADER);
        if (header < 0) throw new ParseFailureException("Playlist has no " + HEADER + " header");

        final String[] lines = content.substring(header).split("\\R");
        final List<String> epgUrls = headerEpgUrls(lines[0]);
        final Instant now = clock.instant();

        final List<ChannelRecord> channels = new ArrayList<>();
        String currentGroup = DEFAULT_EXTGRP;
        Entry pending = null;
        int dropped = 0;
        for (int i = 1; i < lines.length; i++) {
            final String line = lines[i].strip();
            if (line.isEmpty()) continue;

            if (line.startsWith("#EXTGRP:")) {
                currentGroup = line.substring("#EXTGRP:".length()).strip();
            } else if (line.startsWith("#EXTINF")) {
                pending = Entry.of(line, currentGroup);
            } else if (line.startsWith("#EXTVLCOPT:")) {
                if (pending != null) pending.addVlcOption(line.substring("#EXTVLCOPT:".length()));
            } else if (!line.startsWith("#") && pending != null) {
                final Optional<ChannelRecord> record = toRecord(pending, line, baseUrl, now);
                if (record.isPresent()) channels.add(record.get());
                else dropped++;
                pending = null;
            }
        }
        log.debug("Parsed {} channels ({} past events dropped), {} header guide URLs", channels.size(), dropped, epgUrls.size());
        return new ParsedPlaylist(channels, epgUrls);
    }

    private Optional<ChannelRecord> toRecord(final Entry entry, final String streamUrl, final String baseUrl, final Instant now) {
        final String name = firstNonBlank(entry.attr("tvg-name"), entry.displayName, UNKNOWN_CHANNEL);
        final String group = firstNonBlank(entry.attr("group-title"), DEFAULT_GROUP);
        final ChannelRecord.ChannelRecordBuilder record = ChannelRecord.builder()
                .name(name)
                .group(group)
                .logo(firstNonBlank(entry.attr("tvg-logo"), fallbackLogo(group, baseUrl)))
                .streamUrl(streamUrl)
                .streamHeaders(entry.headers)
                .guideUrl(blankToNull(entry.attr("url-tvg")));

        Instant start = null;
        String eventTitle = null;
        if (EventPatterns.isEvent(name)) {
            start = extractor.extract(name).orElse(null);
            if (start != null && ttlPolicy.eventExpired(start, now)) {
                log.debug("Dropping past event '{}' ({})", name, start);
                return Optional.empty();
            }
            final String cleaned = EventPatterns.cleanTitle(name);
            final Optional<EventPatterns.Matchup> matchup = EventPatterns.matchup(cleaned);
            final String headline = matchup.map(m -> m.team1() + " @ " + m.team2()).orElse(cleaned);
            eventTitle = start == null ? cleaned : headline + "\n" + displayTime(start);
            record.event(true)
                    .eventSport(group)
                    .eventTitle(eventTitle)
                    .eventStart(start)
                    .eventTeam1(matchup.map(EventPatterns.Matchup::team1).orElse(null))
                    .eventTeam2(matchup.map(EventPatterns.Matchup::team2).orElse(null));
        }

        return Optional.of(record.channelId(channelId(entry, name, eventTitle, start)).build());
    }

    /** tvg-id, else a hash of the event title and start, else a hash of the channel name. */
    static String channelId(final Entry entry, final String name, final String eventTitle, final Instant start) {
        final String tvgId = entry.attr("tvg-id");
        if (tvgId != null && !tvgId.isBlank()) return tvgId.strip();
        if (eventTitle != null && start != null) {
            return Hashing.sha256Hex(eventTitle + "_" + ID_TIME.format(start));
        }
        return Hashing.sha256Hex(firstNonBlank(entry.displayName, name));
    }

    String displayTime(final Instant start) {
        return DISPLAY_TIME.format(start.atZone(displayZone)).replace(":00", "");
    }

    private String fallbackLogo(final String group, final String baseUrl) {
        final String file = Slug.of(group) + ".png";
        if (staticDir != null && Files.isRegularFile(staticDir.resolve(file))) {
            final String base = baseUrl == null ? "" : baseUrl.replaceAll("/+$", "");
            return base + "/static/" + file;
        }
        return NO_LOGO;
    }

    private static List<String> headerEpgUrls(final String headerLine) {
        final Set<String> urls = new LinkedHashSet<>();
        final Map<String, String> attrs = attributes(headerLine);
        for (String key : List.of("url-tvg", "x-tvg-url")) {
            final String value = attrs.get(key);
            if (value == null) continue;
            for (String url : value.split(",")) {
                if (!url.isBlank()) urls.add(url.strip());
            }
        }
        return new ArrayList<>(urls);
    }

    static Map<String, String> attributes(final String text) {
        final Map<String, String> attrs = new LinkedHashMap<>();
        final Matcher m = ATTRIBUTE.matcher(text);
        while (m.find()) {
            attrs.putIfAbsent(m.group(1).toLowerCase(Locale.ROOT), m.group(2));
        }
        return attrs;
    }

    private static String firstNonBlank(final String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) return value.strip();
        }
        return null;
    }

    private static String blankToNull(final String value) {
        return value == null || value.isBlank() ? null : value.strip();
    }

    /** One {@code #EXTINF} line and the options that follow it. */
    static final class Entry {
        private final Map<String, String> attributes;
        private final String displayName;
        private final Map<String, String> headers = new LinkedHashMap<>();

        private Entry(final Map<String, String> attributes, final String displayName) {
            this.attributes = attributes;
            this.displayName = displayName;
        }

        static Entry of(final String line, final String currentGroup) {
            final int comma = lastTopLevelComma(line);
            final String attributePart = comma < 0 ? line : line.substring(0, comma);
            final String displayName = comma < 0 ? "" : line.substring(comma + 1).strip();
            final Map<String, String> attrs = attributes(attributePart);
            attrs.putIfAbsent("group-title", currentGroup.isBlank() ? DEFAULT_EXTGRP : currentGroup);
            return new Entry(attrs, displayName);
        }

        String attr(final String key) {
            return attributes.get(key);
        }

        void addVlcOption(final String option) {
            final int eq = option.indexOf('=');
            if (eq < 0) return;
            final String key = option.substring(0, eq).strip().toLowerCase(Locale.ROOT);
            final String value = option.substring(eq + 1).strip();
            switch (key) {
                case "http-referrer" -> headers.put("Referer", value);
                case "http-user-agent" -> headers.put("User-Agent", value);
                default -> { }
            }
        }

        private static int lastTopLevelComma(final String line) {
            boolean quoted = false;
            int last = -1;
            for (int i = 0; i < line.length(); i++) {
                final char c = line.charAt(i);
                if (c == '"') quoted = !quoted;
                else if (c == ',' && !quoted) last = i;
            }
            return last;
        }
    }
}
