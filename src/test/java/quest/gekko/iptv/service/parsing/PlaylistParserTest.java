package quest.gekko.iptv.service.parsing;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import quest.gekko.iptv.domain.ChannelRecord;
import quest.gekko.iptv.exception.ParseFailureException;
import quest.gekko.iptv.support.MutableClock;
import quest.gekko.iptv.support.TestStores;
import quest.gekko.iptv.util.Hashing;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PlaylistParserTest {

    private static final String PLAYLIST = """
            some provider banner
            #EXTM3U url-tvg="http://epg.example/guide.xml,http://epg.example/second.xml.gz"
            #EXTINF:-1 tvg-id="ESPN" tvg-name="ESPN" tvg-logo="http://logos/espn.png" group-title="Sports",ESPN
            #EXTVLCOPT:http-referrer=http://ref.example/
            #EXTVLCOPT:http-user-agent=TestAgent/1.0
            http://stream.example/espn.m3u8
            #EXTINF:-1 tvg-id="Event1" tvg-name="11/08/2025 08:10:00 PM EST = Portland Trail Blazers @ Miami Heat" group-title="Basketball",Event 1
            http://stream.example/event1
            """;

    @TempDir
    Path staticDir;

    private final MutableClock clock = MutableClock.at("2025-11-08T12:00:00Z");
    private PlaylistParser parser;

    @BeforeEach
    void setUp() {
        final EventTimeExtractor extractor = new EventTimeExtractor(ZonePreference.defaults(), clock);
        parser = new PlaylistParser(extractor, TestStores.ttlPolicy(), clock, staticDir, ZoneId.of("America/New_York"));
    }

    @Test
    void parsesChannelsHeadersAndAdvertisedGuides() {
        final ParsedPlaylist playlist = parser.parse(PLAYLIST, "http://host/");

        assertThat(playlist.epgUrls()).containsExactly("http://epg.example/guide.xml", "http://epg.example/second.xml.gz");
        assertThat(playlist.channels()).extracting(ChannelRecord::channelId).containsExactly("ESPN", "Event1");

        final ChannelRecord espn = playlist.channels().get(0);
        assertThat(espn.event()).isFalse();
        assertThat(espn.group()).isEqualTo("Sports");
        assertThat(espn.logo()).isEqualTo("http://logos/espn.png");
        assertThat(espn.streamUrl()).isEqualTo("http://stream.example/espn.m3u8");
        assertThat(espn.streamHeaders()).containsExactlyInAnyOrderEntriesOf(
                Map.of("Referer", "http://ref.example/", "User-Agent", "TestAgent/1.0"));
    }

    @Test
    void eventEntryIsNormalizedToUtcWithTeams() {
        final ChannelRecord event = parser.parse(PLAYLIST, "http://host").channels().get(1);

        assertThat(event.event()).isTrue();
        assertThat(event.eventStart()).isEqualTo(Instant.parse("2025-11-09T01:10:00Z"));
        assertThat(event.eventTeam1()).isEqualTo("Portland Trail Blazers");
        assertThat(event.eventTeam2()).isEqualTo("Miami Heat");
        assertThat(event.eventTitle()).isEqualTo("Portland Trail Blazers @ Miami Heat\nNov 8 8:10PM");
        assertThat(event.eventSport()).isEqualTo("Basketball");
        assertThat(event.streamHeaders()).isNull();
    }

    @Test
    void wholeHourDisplayTimeDropsMinutes() {
        final String content = """
                #EXTM3U
                #EXTINF:-1 group-title="Hockey",11/08/2025 09:00 PM EST = Rangers vs Devils
                http://s/1
                """;

        final ChannelRecord event = parser.parse(content, "http://host").channels().get(0);

        assertThat(event.eventTitle()).isEqualTo("Rangers @ Devils\nNov 8 9PM");
        assertThat(event.name()).isEqualTo("11/08/2025 09:00 PM EST = Rangers vs Devils");
    }

    @Test
    void idsWithoutTvgIdAreDeterministic() {
        final String content = """
                #EXTM3U
                #EXTINF:-1 tvg-name="11/08/2025 08:10:00 PM EST = Portland Trail Blazers @ Miami Heat" group-title="NBA",Game
                http://s/game
                #EXTINF:-1 group-title="News",CNN International
                http://s/cnn
                """;

        final List<ChannelRecord> first = parser.parse(content, "http://host").channels();
        final List<ChannelRecord> second = parser.parse(content, "http://host").channels();

        assertThat(first).extracting(ChannelRecord::channelId)
                .containsExactlyElementsOf(second.stream().map(ChannelRecord::channelId).toList());
        assertThat(first.get(0).channelId()).isEqualTo(
                Hashing.sha256Hex("Portland Trail Blazers @ Miami Heat\nNov 8 8:10PM_2025-11-09 01:10:00"));
        assertThat(first.get(1).channelId()).isEqualTo(Hashing.sha256Hex("CNN International"));
    }

    @Test
    void pastEventsAreDropped() {
        final String content = """
                #EXTM3U
                #EXTINF:-1 group-title="NBA",11/07/2025 08:00 AM EST = Old @ Game
                http://s/old
                #EXTINF:-1 group-title="NBA",11/08/2025 06:00 AM EST = Started @ Recently
                http://s/recent
                """;

        final List<ChannelRecord> channels = parser.parse(content, "http://host").channels();

        // 11:00Z start is within the four hour grace window at 12:00Z
        assertThat(channels).extracting(ChannelRecord::eventTeam1).containsExactly("Started");
    }

    @Test
    void eventWithUnreadableTimeKeepsCleanedTitle() {
        final String content = """
                #EXTM3U
                #EXTINF:-1 tvg-name="Nov 8 2025 25:99 Mystery" group-title="Misc",Mystery Feed
                http://s/m
                """;

        final ChannelRecord event = parser.parse(content, "http://host").channels().get(0);

        assertThat(event.event()).isTrue();
        assertThat(event.eventStart()).isNull();
        assertThat(event.eventTitle()).isEqualTo("Mystery");
    }

    @Test
    void extgrpFillsMissingGroupTitles() {
        final String content = """
                #EXTM3U
                #EXTINF:-1,First
                http://s/first
                #EXTGRP:News
                #EXTINF:-1,CNN
                http://s/cnn
                #EXTINF:-1 group-title="Movies",HBO
                http://s/hbo
                #EXTINF:-1,BBC
                http://s/bbc
                """;

        assertThat(parser.parse(content, "http://host").channels())
                .extracting(ChannelRecord::group)
                .containsExactly("Uncategorized", "News", "Movies", "News");
    }

    @Test
    void missingNamesAndGroupsFallBack() {
        final String content = """
                #EXTM3U
                #EXTINF:-1 tvg-id="x1" group-title="",
                http://s/x1
                #EXTINF:-1 tvg-id="x2" url-tvg="http://guides/x2.xml",Named
                http://s/x2
                """;

        final List<ChannelRecord> channels = parser.parse(content, "http://host").channels();

        assertThat(channels.get(0).name()).isEqualTo("Unknown Channel");
        assertThat(channels.get(0).group()).isEqualTo("Other");
        assertThat(channels.get(1).name()).isEqualTo("Named");
        assertThat(channels.get(1).guideUrl()).isEqualTo("http://guides/x2.xml");
    }

    @Test
    void missingLogoUsesStaticGroupImageWhenPresent() throws IOException {
        Files.createFile(staticDir.resolve("live-sports.png"));
        final String content = """
                #EXTM3U
                #EXTINF:-1 tvg-id="a" group-title="Live Sports",A
                http://s/a
                #EXTINF:-1 tvg-id="b" group-title="Kids",B
                http://s/b
                """;

        final List<ChannelRecord> channels = parser.parse(content, "http://host/").channels();

        assertThat(channels.get(0).logo()).isEqualTo("http://host/static/live-sports.png");
        assertThat(channels.get(1).logo()).isEqualTo(PlaylistParser.NO_LOGO);
    }

    @Test
    void contentWithoutHeaderFails() {
        assertThatThrownBy(() -> parser.parse("#EXTINF:-1,CNN\nhttp://s/cnn\n", "http://host"))
                .isInstanceOf(ParseFailureException.class);
    }
}
