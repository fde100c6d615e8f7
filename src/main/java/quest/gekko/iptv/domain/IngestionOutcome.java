package quest.gekko.iptv.domain;

public enum IngestionOutcome {
    SUCCESS,
    PARTIAL_FAILURE,
    FATAL
}
