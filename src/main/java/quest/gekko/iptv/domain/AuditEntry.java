package quest.gekko.iptv.domain;

import java.time.Instant;
import java.util.Map;

public record AuditEntry(
        Instant timestamp,
        String actor,
        String action,
        String resource,
        Map<String, String> details
) {
    public AuditEntry {
        details = details == null ? Map.of() : Map.copyOf(details);
    }
}
