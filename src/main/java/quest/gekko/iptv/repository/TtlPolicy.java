package quest.gekko.iptv.repository;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Expiry rules of the store. Pure functions; callers pass {@code now}.
 */
public record TtlPolicy(
        Duration eventGrace,
        Duration epgTtl,
        Duration imageTtl,
        Duration manifestTtl,
        Duration auditTtl
) {
    public static final int PARSE_HISTORY_LENGTH = 50;

    /**
     * Time an event stays visible: until {@code start + grace}. Empty once that point passed;
     * the remainder is rounded up to whole seconds.
     */
    public Optional<Duration> eventTtl(Instant start, Instant now) {
        Duration remaining = Duration.between(now, start.plus(eventGrace));
        if (remaining.isNegative() || remaining.isZero()) {
            return Optional.empty();
        }
        long seconds = remaining.getSeconds() + (remaining.getNano() > 0 ? 1 : 0);
        return Optional.of(Duration.ofSeconds(seconds));
    }

    public boolean eventExpired(Instant start, Instant now) {
        return eventTtl(start, now).isEmpty();
    }
}
