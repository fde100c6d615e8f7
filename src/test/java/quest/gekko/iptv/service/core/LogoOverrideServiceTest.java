package quest.gekko.iptv.service.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import quest.gekko.iptv.domain.AuditEntry;
import quest.gekko.iptv.domain.ChannelRecord;
import quest.gekko.iptv.domain.ImageCacheKey;
import quest.gekko.iptv.domain.ImageKind;
import quest.gekko.iptv.domain.LogoOverride;
import quest.gekko.iptv.exception.ConfigInvalidException;
import quest.gekko.iptv.repository.TenantStore;
import quest.gekko.iptv.support.MutableClock;
import quest.gekko.iptv.support.TestStores;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static quest.gekko.iptv.support.TestStores.TENANT;

class LogoOverrideServiceTest {

    private static final byte[] PNG = {1, 2, 3};

    private final MutableClock clock = MutableClock.at("2025-11-08T12:00:00Z");
    private final TenantStore tenantStore = TestStores.inMemory(clock);
    private final LogoOverrideService service = new LogoOverrideService(tenantStore, clock);

    @BeforeEach
    void setUp() {
        tenantStore.storeChannels(TENANT, List.of(channel("espn.us"), channel("espn2.us"), channel("cnn")));
        for (String id : List.of("espn.us", "espn2.us", "cnn")) {
            tenantStore.storeProcessedImage(ImageCacheKey.of(id, ImageKind.LOGO), PNG);
            tenantStore.storeProcessedImage(ImageCacheKey.placeholder(id, ImageKind.POSTER, 2), PNG);
        }
    }

    @Test
    void exactOverrideBeatsRegex() {
        service.create(TENANT, "espn.*", "http://logos/espn-all.png", true, "admin");
        service.create(TENANT, "espn2.us", "http://logos/espn2.png", false, "admin");

        assertThat(service.resolveLogo(TENANT, "espn2.us", "fallback")).isEqualTo("http://logos/espn2.png");
        assertThat(service.resolveLogo(TENANT, "espn.us", "fallback")).isEqualTo("http://logos/espn-all.png");
        assertThat(service.resolveLogo(TENANT, "cnn", "fallback")).isEqualTo("fallback");
        assertThat(service.resolveLogo(TENANT, channel("cnn"))).isEqualTo("http://logo/cnn");
    }

    @Test
    void regexIsAnchoredAtStartOfId() {
        service.create(TENANT, "us", "http://logos/us.png", true, "admin");

        assertThat(service.resolveLogo(TENANT, "espn.us", "fallback")).isEqualTo("fallback");
    }

    @Test
    void createDropsCachedImagesOfMatchedChannels() {
        service.create(TENANT, "espn", "http://logos/espn.png", true, "admin");

        assertThat(tenantStore.getProcessedImage(ImageCacheKey.of("espn.us", ImageKind.LOGO))).isEmpty();
        assertThat(tenantStore.getProcessedImage(ImageCacheKey.placeholder("espn2.us", ImageKind.POSTER, 2))).isEmpty();
        assertThat(tenantStore.getProcessedImage(ImageCacheKey.of("cnn", ImageKind.LOGO))).isPresent();
    }

    @Test
    void deleteRemovesOverrideAndItsCachedImages() {
        service.create(TENANT, "cnn", "http://logos/cnn.png", false, "admin");
        tenantStore.storeProcessedImage(ImageCacheKey.of("cnn", ImageKind.LOGO), PNG);

        assertThat(service.delete(TENANT, "cnn", "admin")).isTrue();
        assertThat(service.list(TENANT)).isEmpty();
        assertThat(tenantStore.getProcessedImage(ImageCacheKey.of("cnn", ImageKind.LOGO))).isEmpty();
        assertThat(service.delete(TENANT, "cnn", "admin")).isFalse();
    }

    @Test
    void changesAreAudited() {
        service.create(TENANT, "cnn", "http://logos/cnn.png", false, "alice");
        clock.advance(Duration.ofSeconds(1));
        service.delete(TENANT, "cnn", "bob");

        assertThat(tenantStore.getAuditEntries())
                .extracting(AuditEntry::actor, AuditEntry::action)
                .containsExactly(
                        tuple("alice", "logo-override.create"),
                        tuple("bob", "logo-override.delete"));
    }

    @Test
    void rejectsInvalidOverrides() {
        assertThatThrownBy(() -> service.create(TENANT, "espn(", "http://logos/x.png", true, "admin"))
                .isInstanceOf(ConfigInvalidException.class);
        assertThatThrownBy(() -> service.create(TENANT, "espn", "ftp://logos/x.png", false, "admin"))
                .isInstanceOf(ConfigInvalidException.class);
        assertThatThrownBy(() -> service.create(TENANT, " ", "http://logos/x.png", false, "admin"))
                .isInstanceOf(ConfigInvalidException.class);
        assertThat(service.list(TENANT)).extracting(LogoOverride::pattern).isEmpty();
    }

    private static ChannelRecord channel(final String id) {
        return ChannelRecord.builder().channelId(id).name(id).group("Sports").logo("http://logo/" + id)
                .streamUrl("http://s/" + id).build();
    }
}
