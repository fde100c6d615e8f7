package quest.gekko.iptv.domain;

import java.time.Instant;
import java.util.List;

/**
 * Result of one ingestion cycle for a tenant.
 */
public record IngestionReport(
        Instant finishedAt,
        IngestionOutcome outcome,
        int channelCount,
        int programCount,
        List<String> errors
) {
    public IngestionReport {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public boolean successful() {
        return outcome != IngestionOutcome.FATAL;
    }
}
