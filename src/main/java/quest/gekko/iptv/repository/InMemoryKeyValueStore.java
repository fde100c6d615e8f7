package quest.gekko.iptv.repository;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Single-node store on a Caffeine cache with per-entry expiry. Time comes from the injected
 * {@link Clock}, so expiry follows the clock rather than the wall.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private static final long NO_EXPIRY = Long.MAX_VALUE;

    private final Clock clock;
    private final Cache<String, Entry> cache;
    // batches take the write lock so readers never observe half of one
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public InMemoryKeyValueStore(final Clock clock) {
        this.clock = clock;
        this.cache = Caffeine.newBuilder()
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .expireAfter(new EntryExpiry())
                .build();
    }

    @Override
    public Optional<String> get(final String key) {
        return read(() -> live(key).map(Entry::value));
    }

    @Override
    public Map<String, String> getAllWithPrefix(final String prefix) {
        return read(() -> {
            final long now = clock.millis();
            final Map<String, String> result = new TreeMap<>();
            cache.asMap().forEach((key, entry) -> {
                if (key.startsWith(prefix) && entry.value() != null && entry.aliveAt(now)) {
                    result.put(key, entry.value());
                }
            });
            return result;
        });
    }

    @Override
    public Set<String> keysWithPrefix(final String prefix) {
        return read(() -> {
            final long now = clock.millis();
            final Set<String> result = new TreeSet<>();
            cache.asMap().forEach((key, entry) -> {
                if (key.startsWith(prefix) && entry.aliveAt(now)) result.add(key);
            });
            return result;
        });
    }

    @Override
    public void put(final String key, final String value, final Duration ttl) {
        read(() -> {
            cache.put(key, Entry.value(value, expiresAt(ttl)));
            return null;
        });
    }

    @Override
    public boolean delete(final String key) {
        return read(() -> cache.asMap().remove(key) != null);
    }

    @Override
    public long delete(final Collection<String> keys) {
        return read(() -> keys.stream().filter(k -> cache.asMap().remove(k) != null).count());
    }

    @Override
    public Optional<Duration> ttl(final String key) {
        return read(() -> live(key)
                .filter(e -> e.expiresAt() != NO_EXPIRY)
                .map(e -> Duration.ofMillis(e.expiresAt() - clock.millis())));
    }

    @Override
    public OptionalLong tryIncrement(final String key, final long ceiling, final Duration window) {
        if (ceiling < 1) return OptionalLong.empty();
        final AtomicLong result = new AtomicLong(-1);
        read(() -> cache.asMap().compute(key, (k, current) -> {
            final long now = clock.millis();
            if (current == null || !current.aliveAt(now)) {
                result.set(1);
                return Entry.value("1", now + window.toMillis());
            }
            final long count = Long.parseLong(current.value());
            if (count >= ceiling) return current;
            result.set(count + 1);
            return Entry.value(Long.toString(count + 1), current.expiresAt());
        }));
        return result.get() < 0 ? OptionalLong.empty() : OptionalLong.of(result.get());
    }

    @Override
    public void apply(final List<Mutation> mutations) {
        final Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            for (Mutation mutation : mutations) {
                if (mutation instanceof Put put) {
                    cache.put(put.key(), Entry.value(put.value(), expiresAt(put.ttl())));
                } else if (mutation instanceof Delete delete) {
                    cache.invalidate(delete.key());
                }
            }
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void pushBounded(final String key, final String value, final int maxLength, final Duration ttl) {
        read(() -> cache.asMap().compute(key, (k, current) -> {
            final List<String> items = new ArrayList<>();
            items.add(value);
            if (current != null && current.items() != null && current.aliveAt(clock.millis())) {
                items.addAll(current.items());
            }
            final List<String> bounded = items.size() > maxLength ? items.subList(0, maxLength) : items;
            return Entry.list(bounded, expiresAt(ttl));
        }));
    }

    @Override
    public List<String> range(final String key, final int limit) {
        return read(() -> live(key)
                .map(Entry::items)
                .map(items -> items.subList(0, Math.min(limit, items.size())))
                .map(List::copyOf)
                .orElse(List.of()));
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    private Optional<Entry> live(final String key) {
        final Entry entry = cache.getIfPresent(key);
        if (entry == null || !entry.aliveAt(clock.millis())) return Optional.empty();
        return Optional.of(entry);
    }

    private long expiresAt(final Duration ttl) {
        return ttl == null ? NO_EXPIRY : clock.millis() + ttl.toMillis();
    }

    private <T> T read(final Supplier<T> action) {
        final Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return action.get();
        } finally {
            readLock.unlock();
        }
    }

    record Entry(String value, List<String> items, long expiresAt) {

        static Entry value(final String value, final long expiresAt) {
            return new Entry(value, null, expiresAt);
        }

        static Entry list(final List<String> items, final long expiresAt) {
            return new Entry(null, List.copyOf(items), expiresAt);
        }

        boolean aliveAt(final long nowMillis) {
            return expiresAt == NO_EXPIRY || nowMillis < expiresAt;
        }
    }

    private final class EntryExpiry implements Expiry<String, Entry> {

        @Override
        public long expireAfterCreate(final String key, final Entry entry, final long currentTime) {
            return remaining(entry);
        }

        @Override
        public long expireAfterUpdate(final String key, final Entry entry, final long currentTime, final long currentDuration) {
            return remaining(entry);
        }

        @Override
        public long expireAfterRead(final String key, final Entry entry, final long currentTime, final long currentDuration) {
            return currentDuration;
        }

        private long remaining(final Entry entry) {
            if (entry.expiresAt() == NO_EXPIRY) return Long.MAX_VALUE;
            return TimeUnit.MILLISECONDS.toNanos(Math.max(0, entry.expiresAt() - clock.millis()));
        }
    }
}
