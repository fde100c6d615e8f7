package quest.gekko.iptv.service.parsing;

import lombok.extern.slf4j.Slf4j;
import org.xml.sax.Attributes;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;
import quest.gekko.iptv.domain.ProgramEntry;

import javax.xml.XMLConstants;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.parsers.SAXParser;
import javax.xml.parsers.SAXParserFactory;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.GZIPInputStream;

/**
 * Reads XMLTV guides (plain or gzip) into programs per guide channel id, keeping programs that start
 * between two hours ago and thirty days ahead.
 */
@Slf4j
public class EpgParser {

    static final Duration LOOKBACK = Duration.ofHours(2);
    static final Duration LOOKAHEAD = Duration.ofDays(30);

    private static final DateTimeFormatter XMLTV_TIME = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    private final Clock clock;

    public EpgParser(final Clock clock) {
        this.clock = clock;
    }

    /**
     * @return programs keyed by guide channel id, each list sorted by start; empty when the document
     *         cannot be read
     */
    public Map<String, List<ProgramEntry>> parse(final byte[] content) {
        if (content == null || content.length == 0) return Map.of();
        final Instant now = clock.instant();
        final ProgrammeHandler handler = new ProgrammeHandler(now.minus(LOOKBACK), now.plus(LOOKAHEAD));
        try (InputStream in = open(content)) {
            newParser().parse(in, handler);
        } catch (SAXException | IOException | ParserConfigurationException e) {
            log.warn("Unreadable guide document: {}", e.getMessage());
            return Map.of();
        }
        final Map<String, List<ProgramEntry>> programs = handler.programs;
        programs.values().forEach(list -> list.sort(Comparator.comparing(ProgramEntry::start)));
        log.debug("Parsed {} programs for {} guide channels ({} outside window, {} unusable)",
                programs.values().stream().mapToInt(List::size).sum(), programs.size(), handler.outsideWindow, handler.skipped);
        return programs;
    }

    /** {@code yyyyMMddHHmmss} with an optional {@code ±HHMM} offset; no offset means UTC. */
    static Instant parseTime(final String value) {
        if (value == null || value.isBlank()) return null;
        final String trimmed = value.strip();
        if (trimmed.length() < 14) return null;
        try {
            final LocalDateTime local = LocalDateTime.parse(trimmed.substring(0, 14), XMLTV_TIME);
            final String rest = trimmed.substring(14).strip();
            final ZoneOffset offset = rest.isEmpty() ? ZoneOffset.UTC : ZoneOffset.of(rest);
            return local.toInstant(offset);
        } catch (DateTimeException e) {
            log.debug("Unreadable guide time '{}': {}", value, e.getMessage());
            return null;
        }
    }

    private static InputStream open(final byte[] content) throws IOException {
        final boolean gzip = content.length > 1 && (content[0] & 0xff) == 0x1f && (content[1] & 0xff) == 0x8b;
        final InputStream raw = new ByteArrayInputStream(content);
        return gzip ? new GZIPInputStream(raw) : raw;
    }

    private static SAXParser newParser() throws ParserConfigurationException, SAXException {
        final SAXParserFactory factory = SAXParserFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
        factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
        factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        return factory.newSAXParser();
    }

    private static final class ProgrammeHandler extends DefaultHandler {
        private final Instant from;
        private final Instant until;
        private final Map<String, List<ProgramEntry>> programs = new LinkedHashMap<>();
        private final StringBuilder text = new StringBuilder();

        // elements are matched in the root element's namespace, or in none
        private String namespace;
        private boolean inProgramme;
        private String channel;
        private Instant start;
        private Instant stop;
        private String title;
        private String desc;
        private String category;
        private int outsideWindow;
        private int skipped;

        ProgrammeHandler(final Instant from, final Instant until) {
            this.from = from;
            this.until = until;
        }

        @Override
        public InputSource resolveEntity(final String publicId, final String systemId) {
            return new InputSource(new StringReader(""));
        }

        @Override
        public void startElement(final String uri, final String localName, final String qName, final Attributes attrs) {
            if (namespace == null) {
                namespace = uri == null ? "" : uri;
            }
            text.setLength(0);
            if (!ours(uri)) return;

            if ("programme".equals(localName)) {
                inProgramme = true;
                channel = attrs.getValue("channel");
                start = parseTime(attrs.getValue("start"));
                stop = parseTime(attrs.getValue("stop"));
                title = null;
                desc = null;
                category = null;
            }
        }

        @Override
        public void characters(final char[] ch, final int start, final int length) {
            if (inProgramme) text.append(ch, start, length);
        }

        @Override
        public void endElement(final String uri, final String localName, final String qName) {
            if (!inProgramme || !ours(uri)) return;
            switch (localName) {
                case "title" -> title = firstOf(title, text);
                case "desc" -> desc = firstOf(desc, text);
                case "category" -> category = firstOf(category, text);
                case "programme" -> {
                    inProgramme = false;
                    addProgramme();
                }
                default -> { }
            }
            text.setLength(0);
        }

        private boolean ours(final String uri) {
            return uri == null || uri.isEmpty() || namespace.equals(uri);
        }

        private void addProgramme() {
            if (channel == null || channel.isBlank() || start == null) {
                skipped++;
                return;
            }
            if (start.isBefore(from) || start.isAfter(until)) {
                outsideWindow++;
                return;
            }
            final String programTitle = title == null || title.isBlank() ? "Unknown" : title;
            programs.computeIfAbsent(channel.strip(), k -> new ArrayList<>())
                    .add(new ProgramEntry(programTitle, desc, category, start, stop));
        }

        private static String firstOf(final String current, final StringBuilder text) {
            if (current != null) return current;
            final String value = text.toString().strip();
            return value.isEmpty() ? null : value;
        }
    }
}
