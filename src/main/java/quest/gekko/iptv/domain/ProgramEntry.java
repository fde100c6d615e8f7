package quest.gekko.iptv.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProgramEntry(
        String title,
        String description,
        String category,
        Instant start,
        Instant stop
) {}
