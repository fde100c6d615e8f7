package quest.gekko.iptv.util;

import org.junit.jupiter.api.Test;
import quest.gekko.iptv.config.IptvProperties;
import quest.gekko.iptv.exception.StoreUnavailableException;
import quest.gekko.iptv.repository.KeyValueStore;
import quest.gekko.iptv.support.MutableClock;
import quest.gekko.iptv.support.TestStores;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RateLimiterTest {

    private final MutableClock clock = MutableClock.at("2025-11-08T12:00:00Z");
    private final IptvProperties.RateLimit limits = new IptvProperties.RateLimit(3, Duration.ofHours(1));

    @Test
    void allowsRequestsUpToLimitWithinWindow() {
        final RateLimiter limiter = new RateLimiter(TestStores.inMemory(clock), limits);

        assertThat(limiter.tryAcquire("203.0.113.7")).isTrue();
        assertThat(limiter.tryAcquire("203.0.113.7")).isTrue();
        assertThat(limiter.tryAcquire("203.0.113.7")).isTrue();
        assertThat(limiter.tryAcquire("203.0.113.7")).isFalse();
        assertThat(limiter.tryAcquire("198.51.100.1")).isTrue();
    }

    @Test
    void windowStartsAtFirstRequest() {
        final RateLimiter limiter = new RateLimiter(TestStores.inMemory(clock), limits);
        limiter.tryAcquire("client");
        clock.advance(Duration.ofMinutes(20));
        limiter.tryAcquire("client");
        limiter.tryAcquire("client");

        assertThat(limiter.resetIn("client")).contains(Duration.ofMinutes(40));

        clock.advance(Duration.ofMinutes(40));
        assertThat(limiter.tryAcquire("client")).isTrue();
    }

    @Test
    void storeOutageLetsRequestsThrough() {
        final KeyValueStore broken = mock(KeyValueStore.class);
        when(broken.tryIncrement(anyString(), anyLong(), any())).thenThrow(new StoreUnavailableException("down", null));
        final RateLimiter limiter = new RateLimiter(TestStores.tenantStore(broken, clock), limits);

        assertThat(limiter.tryAcquire("client")).isTrue();
    }
}
