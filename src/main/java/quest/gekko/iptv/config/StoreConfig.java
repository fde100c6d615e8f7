package quest.gekko.iptv.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.retry.support.RetryTemplate;
import quest.gekko.iptv.exception.StoreUnavailableException;
import quest.gekko.iptv.repository.InMemoryKeyValueStore;
import quest.gekko.iptv.repository.KeyValueStore;
import quest.gekko.iptv.repository.RedisKeyValueStore;
import quest.gekko.iptv.repository.TtlPolicy;

import java.time.Clock;

@Slf4j
@Configuration
public class StoreConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(name = "iptv.store.backend", havingValue = "redis", matchIfMissing = true)
    public KeyValueStore redisKeyValueStore(final StringRedisTemplate redisTemplate) {
        log.info("Using Redis key-value store");
        return new RedisKeyValueStore(redisTemplate);
    }

    @Bean
    @ConditionalOnProperty(name = "iptv.store.backend", havingValue = "memory")
    public KeyValueStore inMemoryKeyValueStore(final Clock clock) {
        log.info("Using in-memory key-value store; data does not survive a restart");
        return new InMemoryKeyValueStore(clock);
    }

    @Bean
    public TtlPolicy ttlPolicy(final IptvProperties.Events events, final IptvProperties.Store store) {
        return new TtlPolicy(events.graceWindow(), store.epgTtl(), store.imageTtl(), store.manifestTtl(), store.auditTtl());
    }

    @Bean
    public RetryTemplate storeRetryTemplate(final IptvProperties.Store store) {
        return RetryTemplate.builder()
                .maxAttempts(store.retryAttempts())
                .exponentialBackoff(store.retryBackoff().toMillis(), 2.0, store.retryMaxBackoff().toMillis())
                .retryOn(StoreUnavailableException.class)
                .build();
    }
}
