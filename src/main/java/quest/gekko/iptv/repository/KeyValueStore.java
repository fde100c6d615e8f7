package quest.gekko.iptv.repository;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;

/**
 * String key-value store with per-key expiry and an atomic conditional increment.
 * Implementations raise {@link quest.gekko.iptv.exception.StoreUnavailableException} when the
 * backend cannot be reached.
 */
public interface KeyValueStore {

    Optional<String> get(String key);

    /** Live entries whose key starts with {@code prefix}, keyed by full key. */
    Map<String, String> getAllWithPrefix(String prefix);

    Set<String> keysWithPrefix(String prefix);

    /** Writes a value; a {@code null} ttl stores it without expiry. */
    void put(String key, String value, Duration ttl);

    boolean delete(String key);

    long delete(Collection<String> keys);

    /** Remaining time to live; empty when the key is missing or never expires. */
    Optional<Duration> ttl(String key);

    /**
     * Increments the counter at {@code key} unless it already reached {@code ceiling}.
     * The first increment sets the expiry to {@code window}; later increments keep it.
     *
     * @return the new count, or empty when the ceiling was already reached
     */
    OptionalLong tryIncrement(String key, long ceiling, Duration window);

    /** Applies the mutations in order, as one unit. */
    void apply(List<Mutation> mutations);

    /** Prepends to a list, keeps the newest {@code maxLength} items and refreshes its expiry. */
    void pushBounded(String key, String value, int maxLength, Duration ttl);

    /** Newest-first items of a list. */
    List<String> range(String key, int limit);

    boolean isAvailable();

    sealed interface Mutation permits Put, Delete {
        String key();
    }

    record Put(String key, String value, Duration ttl) implements Mutation {}

    record Delete(String key) implements Mutation {}
}
