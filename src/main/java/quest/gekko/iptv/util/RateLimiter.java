package quest.gekko.iptv.util;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import quest.gekko.iptv.config.IptvProperties;
import quest.gekko.iptv.exception.StoreUnavailableException;
import quest.gekko.iptv.repository.TenantStore;

import java.time.Duration;
import java.util.Optional;

/**
 * Fixed-window limiter: at most {@code iptv.rate-limit.requests} per client per window, the window
 * starting at the client's first request. Lets requests through while the store is down.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RateLimiter {
    private final TenantStore tenantStore;
    private final IptvProperties.RateLimit limits;

    public boolean tryAcquire(final String clientId) {
        try {
            final boolean allowed = tenantStore.tryIncrement(clientId, limits.requests(), limits.window()).isPresent();
            if (!allowed) log.debug("Rate limit reached for {}", clientId);
            return allowed;
        } catch (StoreUnavailableException e) {
            log.warn("Rate limit not enforced for {}, store unavailable: {}", clientId, e.getMessage());
            return true;
        }
    }

    /** Time until the client's current window closes. */
    public Optional<Duration> resetIn(final String clientId) {
        return tenantStore.rateLimitResetIn(clientId);
    }
}
