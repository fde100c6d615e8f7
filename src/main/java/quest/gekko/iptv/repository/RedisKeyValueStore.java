package quest.gekko.iptv.repository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import quest.gekko.iptv.exception.StoreUnavailableException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

@Slf4j
@RequiredArgsConstructor
public class RedisKeyValueStore implements KeyValueStore {

    /** Increments KEYS[1] unless it reached ARGV[1]; sets ARGV[2] ms of expiry on the first increment only. */
    static final RedisScript<Long> CONDITIONAL_INCREMENT = new DefaultRedisScript<>("""
            local current = tonumber(redis.call('GET', KEYS[1]) or '0')
            if current >= tonumber(ARGV[1]) then
              return -1
            end
            local count = redis.call('INCR', KEYS[1])
            if count == 1 then
              redis.call('PEXPIRE', KEYS[1], ARGV[2])
            end
            return count
            """, Long.class);

    private static final int SCAN_BATCH = 500;

    private final StringRedisTemplate redis;

    @Override
    public Optional<String> get(final String key) {
        return call("GET " + key, () -> Optional.ofNullable(redis.opsForValue().get(key)));
    }

    @Override
    public Map<String, String> getAllWithPrefix(final String prefix) {
        final List<String> keys = new ArrayList<>(keysWithPrefix(prefix));
        if (keys.isEmpty()) return Map.of();
        return call("MGET " + prefix + "*", () -> {
            final List<String> values = redis.opsForValue().multiGet(keys);
            final Map<String, String> result = new LinkedHashMap<>();
            for (int i = 0; values != null && i < keys.size(); i++) {
                // keys can expire between SCAN and MGET
                if (values.get(i) != null) result.put(keys.get(i), values.get(i));
            }
            return result;
        });
    }

    @Override
    public Set<String> keysWithPrefix(final String prefix) {
        final ScanOptions options = ScanOptions.scanOptions().match(escapeGlob(prefix) + "*").count(SCAN_BATCH).build();
        return call("SCAN " + prefix + "*", () -> {
            final Set<String> keys = new TreeSet<>();
            try (Cursor<String> cursor = redis.scan(options)) {
                while (cursor.hasNext()) keys.add(cursor.next());
            }
            return keys;
        });
    }

    @Override
    public void put(final String key, final String value, final Duration ttl) {
        call("SET " + key, () -> {
            if (ttl == null) redis.opsForValue().set(key, value);
            else redis.opsForValue().set(key, value, ttl);
            return null;
        });
    }

    @Override
    public boolean delete(final String key) {
        return call("DEL " + key, () -> Boolean.TRUE.equals(redis.delete(key)));
    }

    @Override
    public long delete(final Collection<String> keys) {
        if (keys.isEmpty()) return 0;
        return call("DEL " + keys.size() + " keys", () -> {
            final Long removed = redis.delete(keys);
            return removed == null ? 0L : removed;
        });
    }

    @Override
    public Optional<Duration> ttl(final String key) {
        return call("PTTL " + key, () -> {
            final Long millis = redis.getExpire(key, TimeUnit.MILLISECONDS);
            // -2: no such key, -1: no expiry
            if (millis == null || millis < 0) return Optional.<Duration>empty();
            return Optional.of(Duration.ofMillis(millis));
        });
    }

    @Override
    public OptionalLong tryIncrement(final String key, final long ceiling, final Duration window) {
        return call("INCR " + key, () -> {
            final Long count = redis.execute(CONDITIONAL_INCREMENT, List.of(key),
                    Long.toString(ceiling), Long.toString(window.toMillis()));
            return count == null || count < 0 ? OptionalLong.empty() : OptionalLong.of(count);
        });
    }

    @Override
    public void apply(final List<Mutation> mutations) {
        if (mutations.isEmpty()) return;
        call("MULTI " + mutations.size() + " ops", () -> redis.execute(new SessionCallback<List<Object>>() {
            @Override
            @SuppressWarnings("unchecked")
            public <K, V> List<Object> execute(final RedisOperations<K, V> operations) {
                final RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
                ops.multi();
                for (Mutation mutation : mutations) {
                    if (mutation instanceof Put put) {
                        if (put.ttl() == null) ops.opsForValue().set(put.key(), put.value());
                        else ops.opsForValue().set(put.key(), put.value(), put.ttl());
                    } else if (mutation instanceof Delete delete) {
                        ops.delete(delete.key());
                    }
                }
                return ops.exec();
            }
        }));
    }

    @Override
    public void pushBounded(final String key, final String value, final int maxLength, final Duration ttl) {
        call("LPUSH " + key, () -> redis.execute(new SessionCallback<List<Object>>() {
            @Override
            @SuppressWarnings("unchecked")
            public <K, V> List<Object> execute(final RedisOperations<K, V> operations) {
                final RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
                ops.multi();
                ops.opsForList().leftPush(key, value);
                ops.opsForList().trim(key, 0, maxLength - 1);
                ops.expire(key, ttl);
                return ops.exec();
            }
        }));
    }

    @Override
    public List<String> range(final String key, final int limit) {
        if (limit <= 0) return List.of();
        return call("LRANGE " + key, () -> {
            final List<String> items = redis.opsForList().range(key, 0, limit - 1L);
            return items == null ? List.<String>of() : items;
        });
    }

    @Override
    public boolean isAvailable() {
        try {
            return "PONG".equalsIgnoreCase(redis.execute((RedisCallback<String>) connection -> connection.ping()));
        } catch (DataAccessException e) {
            log.warn("Redis ping failed: {}", e.getMessage());
            return false;
        }
    }

    static String escapeGlob(final String prefix) {
        return prefix.replaceAll("([\\\\*?\\[\\]^])", "\\\\$1");
    }

    private <T> T call(final String operation, final Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Redis " + operation + " failed: " + e.getMessage(), e);
        }
    }
}
