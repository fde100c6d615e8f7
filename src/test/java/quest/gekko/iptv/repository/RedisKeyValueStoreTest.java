package quest.gekko.iptv.repository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.script.RedisScript;
import quest.gekko.iptv.exception.StoreUnavailableException;

import java.time.Duration;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RedisKeyValueStoreTest {

    private StringRedisTemplate redis;
    private ValueOperations<String, String> values;
    private RedisKeyValueStore store;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redis = mock(StringRedisTemplate.class);
        values = mock(ValueOperations.class);
        when(redis.opsForValue()).thenReturn(values);
        store = new RedisKeyValueStore(redis);
    }

    @Test
    void putWithTtlUsesExpiringSet() {
        store.put("k", "v", Duration.ofMinutes(5));
        store.put("p", "v", null);

        verify(values).set("k", "v", Duration.ofMinutes(5));
        verify(values).set("p", "v");
    }

    @Test
    void connectionFailureBecomesStoreUnavailable() {
        when(values.get("k")).thenThrow(new RedisConnectionFailureException("connection refused"));

        assertThatThrownBy(() -> store.get("k"))
                .isInstanceOf(StoreUnavailableException.class)
                .hasMessageContaining("GET k");
    }

    @Test
    @SuppressWarnings("unchecked")
    void conditionalIncrementMapsRejectionToEmpty() {
        when(redis.execute(any(RedisScript.class), eq(List.of("rate-limit:c")), any(), any()))
                .thenReturn(-1L)
                .thenReturn(3L);

        assertThat(store.tryIncrement("rate-limit:c", 10, Duration.ofHours(1))).isEmpty();
        assertThat(store.tryIncrement("rate-limit:c", 10, Duration.ofHours(1))).isEqualTo(OptionalLong.of(3));
    }

    @Test
    void missingOrPersistentKeysHaveNoTtl() {
        when(redis.getExpire("missing", TimeUnit.MILLISECONDS)).thenReturn(-2L);
        when(redis.getExpire("persistent", TimeUnit.MILLISECONDS)).thenReturn(-1L);
        when(redis.getExpire("expiring", TimeUnit.MILLISECONDS)).thenReturn(1500L);

        assertThat(store.ttl("missing")).isEmpty();
        assertThat(store.ttl("persistent")).isEmpty();
        assertThat(store.ttl("expiring")).contains(Duration.ofMillis(1500));
    }

    @Test
    void scanPatternEscapesGlobCharacters() {
        assertThat(RedisKeyValueStore.escapeGlob("logo-override:t:[a-z]*?")).isEqualTo("logo-override:t:\\[a-z\\]\\*\\?");
        assertThat(RedisKeyValueStore.escapeGlob("channel:t:")).isEqualTo("channel:t:");
    }
}
