package quest.gekko.iptv.service.scheduling;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.util.unit.DataSize;
import quest.gekko.iptv.config.IptvProperties;
import quest.gekko.iptv.domain.CatalogManifest;
import quest.gekko.iptv.domain.IngestionOutcome;
import quest.gekko.iptv.domain.IngestionReport;
import quest.gekko.iptv.domain.ProgramEntry;
import quest.gekko.iptv.domain.TenantConfig;
import quest.gekko.iptv.repository.TenantStore;
import quest.gekko.iptv.service.integration.connector.FileSourceFetcher;
import quest.gekko.iptv.service.integration.connector.SourceResolver;
import quest.gekko.iptv.service.parsing.ChannelMatcher;
import quest.gekko.iptv.service.parsing.EpgParser;
import quest.gekko.iptv.service.parsing.EventTimeExtractor;
import quest.gekko.iptv.service.parsing.PlaylistParser;
import quest.gekko.iptv.service.parsing.ZonePreference;
import quest.gekko.iptv.support.MutableClock;
import quest.gekko.iptv.support.TestStores;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static quest.gekko.iptv.support.TestStores.TENANT;

class IngestionRunnerTest {

    private static final String GUIDE = """
            <?xml version="1.0" encoding="UTF-8"?>
            <tv>
              <programme channel="espn.us" start="20251108130000 +0000" stop="20251108140000 +0000">
                <title>SportsCenter</title>
              </programme>
              <programme channel="nobody" start="20251108130000 +0000"><title>Lost</title></programme>
            </tv>
            """;

    @TempDir
    Path dir;

    private final MutableClock clock = MutableClock.at("2025-11-08T12:00:00Z");
    private final TenantStore tenantStore = TestStores.inMemory(clock);
    private IngestionRunner runner;

    @BeforeEach
    void setUp() {
        final PlaylistParser playlistParser = new PlaylistParser(
                new EventTimeExtractor(ZonePreference.defaults(), clock), TestStores.ttlPolicy(), clock,
                dir.resolve("static"), ZoneId.of("America/New_York"));
        final IptvProperties.Ingestion ingestion = new IptvProperties.Ingestion(
                Duration.ofSeconds(1), Duration.ofSeconds(1), 2, "static", DataSize.ofMegabytes(1));
        runner = new IngestionRunner(new SourceResolver(Map.of("file", new FileSourceFetcher())), playlistParser,
                new EpgParser(clock), new ChannelMatcher(), tenantStore, ingestion, clock);
    }

    @Test
    void ingestsPlaylistsAndMatchedGuidePrograms() throws IOException {
        final Path guide = Files.writeString(dir.resolve("guide.xml"), GUIDE);
        final Path first = playlist("first.m3u", "#EXTM3U url-tvg=\"" + guide + "\"\n"
                + "#EXTINF:-1 tvg-id=\"espn.us\" group-title=\"Sports\",ESPN\nhttp://s/espn\n"
                + "#EXTINF:-1 tvg-id=\"cnn\" group-title=\"News\",CNN\nhttp://s/cnn-old\n");
        final Path second = playlist("second.m3u", "#EXTM3U\n"
                + "#EXTINF:-1 tvg-id=\"cnn\" group-title=\"News\",CNN\nhttp://s/cnn-new\n");

        final IngestionReport report = runner.run(TENANT, config(first.toString(), second.toString()));

        assertThat(report.outcome()).isEqualTo(IngestionOutcome.SUCCESS);
        assertThat(report.channelCount()).isEqualTo(2);
        assertThat(report.programCount()).isEqualTo(1);
        assertThat(tenantStore.getChannel(TENANT, "cnn")).get()
                .satisfies(cnn -> assertThat(cnn.streamUrl()).isEqualTo("http://s/cnn-new"));
        assertThat(tenantStore.getChannelPrograms(TENANT, "espn.us").orElseThrow())
                .extracting(ProgramEntry::title).containsExactly("SportsCenter");
        assertThat(tenantStore.getEpg(TENANT)).containsOnlyKeys("espn.us");
        assertThat(tenantStore.getParseHistory(TENANT, 10)).containsExactly(report);
    }

    @Test
    void failingSourceIsSkippedAndReported() throws IOException {
        final Path good = playlist("good.m3u", "#EXTM3U\n#EXTINF:-1 tvg-id=\"a\",A\nhttp://s/a\n");
        final Path notPlaylist = playlist("bad.m3u", "<html>login required</html>");

        final IngestionReport report = runner.run(TENANT,
                config(dir.resolve("missing.m3u").toString(), notPlaylist.toString(), good.toString()));

        assertThat(report.outcome()).isEqualTo(IngestionOutcome.PARTIAL_FAILURE);
        assertThat(report.errors()).hasSize(2);
        assertThat(tenantStore.getAllChannels(TENANT)).containsOnlyKeys("a");
    }

    @Test
    void runWithoutChannelsKeepsStoredCatalog() throws IOException {
        final Path good = playlist("good.m3u", "#EXTM3U\n#EXTINF:-1 tvg-id=\"a\",A\nhttp://s/a\n");
        runner.run(TENANT, config(good.toString()));

        final IngestionReport report = runner.run(TENANT, config(dir.resolve("gone.m3u").toString()));

        assertThat(report.outcome()).isEqualTo(IngestionOutcome.FATAL);
        assertThat(report.successful()).isFalse();
        assertThat(tenantStore.getAllChannels(TENANT)).containsOnlyKeys("a");
        assertThat(tenantStore.getParseHistory(TENANT, 10)).extracting(IngestionReport::outcome)
                .containsExactly(IngestionOutcome.FATAL, IngestionOutcome.SUCCESS);
    }

    @Test
    void unreadableGuideIsNotAnError() throws IOException {
        final Path guide = Files.writeString(dir.resolve("guide.xml"), "this is not xml");
        final Path list = playlist("list.m3u", "#EXTM3U\n"
                + "#EXTINF:-1 tvg-id=\"a\" url-tvg=\"" + guide + "\",A\nhttp://s/a\n");

        final IngestionReport report = runner.run(TENANT, config(list.toString()));

        assertThat(report.outcome()).isEqualTo(IngestionOutcome.SUCCESS);
        assertThat(report.programCount()).isZero();
        assertThat(tenantStore.getEpg(TENANT)).isEmpty();
    }

    @Test
    void missingGuideIsPartialFailure() throws IOException {
        final Path list = playlist("list.m3u", "#EXTM3U url-tvg=\"" + dir.resolve("no-guide.xml") + "\"\n"
                + "#EXTINF:-1 tvg-id=\"a\",A\nhttp://s/a\n");

        final IngestionReport report = runner.run(TENANT, config(list.toString()));

        assertThat(report.outcome()).isEqualTo(IngestionOutcome.PARTIAL_FAILURE);
        assertThat(report.channelCount()).isEqualTo(1);
        assertThat(report.errors()).singleElement().asString().startsWith("epg ");
    }

    @Test
    void ingestionDropsCachedManifest() throws IOException {
        tenantStore.storeManifest(TENANT, new CatalogManifest(List.of("Old"), List.of()));
        final Path list = playlist("list.m3u", "#EXTM3U\n#EXTINF:-1 tvg-id=\"a\" group-title=\"News\",A\nhttp://s/a\n");

        runner.run(TENANT, config(list.toString()));

        assertThat(tenantStore.getManifest(TENANT)).isEmpty();
    }

    private Path playlist(final String name, final String content) throws IOException {
        return Files.writeString(dir.resolve(name), content);
    }

    private static TenantConfig config(final String... sources) {
        return TenantConfig.of(List.of(sources), "http://host");
    }
}
