package quest.gekko.iptv.domain;

public enum JobState {
    SCHEDULED,
    RUNNING,
    REMOVED
}
