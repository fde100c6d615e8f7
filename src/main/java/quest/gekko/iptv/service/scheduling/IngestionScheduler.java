package quest.gekko.iptv.service.scheduling;

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Service;
import quest.gekko.iptv.domain.IngestionReport;
import quest.gekko.iptv.domain.JobState;
import quest.gekko.iptv.domain.TenantConfig;
import quest.gekko.iptv.exception.ConfigInvalidException;
import quest.gekko.iptv.exception.StoreUnavailableException;
import quest.gekko.iptv.repository.TenantStore;
import quest.gekko.iptv.util.Tokens;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keeps one cron job per tenant. Runs of one tenant never overlap; different tenants run in parallel
 * on the ingestion task scheduler.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionScheduler {
    private final ThreadPoolTaskScheduler ingestionTaskScheduler;
    private final IngestionRunner runner;
    private final TenantStore tenantStore;

    private final Map<String, ScheduledFuture<?>> jobs = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Map<String, JobState> states = new ConcurrentHashMap<>();
    private final Map<String, IngestionReport> lastReports = new ConcurrentHashMap<>();

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        try {
            final int scheduled = reloadAllJobs();
            log.info("Ingestion scheduler started with {} tenant jobs", scheduled);
        } catch (StoreUnavailableException e) {
            log.error("Ingestion scheduler started without jobs, store unavailable: {}", e.getMessage());
        }
    }

    @PreDestroy
    public synchronized void stop() {
        cancelAll();
        log.info("Ingestion scheduler stopped");
    }

    public void schedule(final String tenant, final TenantConfig config) {
        schedule(tenant, config.cronSchedule(), zoneOf(config));
    }

    public void schedule(final String tenant, final String cron) {
        schedule(tenant, cron, ZoneOffset.UTC);
    }

    /**
     * Installs the tenant's job, replacing any previous one.
     *
     * @throws ConfigInvalidException when the cron expression or tenant token is invalid
     */
    public synchronized void schedule(final String tenant, final String cron, final ZoneId zone) {
        final String key = Tokens.requireValid(tenant);
        final CronTrigger trigger = new CronTrigger(CronSchedules.toSpringCron(cron), zone);
        jobs.compute(key, (k, previous) -> {
            if (previous != null) previous.cancel(false);
            return ingestionTaskScheduler.schedule(() -> runScheduled(key), trigger);
        });
        states.put(key, JobState.SCHEDULED);
        log.info("Scheduled ingestion for tenant {} at '{}' ({})", Tokens.abbreviate(key), cron, zone);
    }

    /** Removes the tenant's job; a run in progress finishes. */
    public synchronized boolean unschedule(final String tenant) {
        final ScheduledFuture<?> job = jobs.remove(tenant);
        if (job != null) job.cancel(false);
        states.put(tenant, JobState.REMOVED);
        log.info("Unscheduled ingestion for tenant {}", Tokens.abbreviate(tenant));
        return job != null;
    }

    /**
     * Drops every job and schedules one per stored tenant config. Tenants whose stored schedule is
     * invalid are logged and left unscheduled.
     *
     * @return number of jobs installed
     */
    public synchronized int reloadAllJobs() {
        cancelAll();

        int scheduled = 0;
        for (String tenant : tenantStore.listTenants()) {
            final Optional<TenantConfig> config = tenantStore.getTenantConfig(tenant);
            if (config.isEmpty()) continue;
            try {
                schedule(tenant, config.get());
                scheduled++;
            } catch (ConfigInvalidException e) {
                log.warn("Not scheduling tenant {}: {}", Tokens.abbreviate(tenant), e.getMessage());
            }
        }
        log.info("Reloaded {} ingestion jobs", scheduled);
        return scheduled;
    }

    /** Runs an ingestion cycle on the calling thread, waiting for a run of the same tenant to finish first. */
    public IngestionReport triggerNow(final String tenant, final TenantConfig config) {
        return runLocked(Tokens.requireValid(tenant), config);
    }

    /** Blocks until a run of the tenant in progress, if any, has finished. */
    public void awaitIdle(final String tenant) {
        final ReentrantLock lock = locks.get(tenant);
        if (lock == null) return;
        lock.lock();
        lock.unlock();
    }

    public Optional<JobState> jobState(final String tenant) {
        return Optional.ofNullable(states.get(tenant));
    }

    public Optional<IngestionReport> lastReport(final String tenant) {
        return Optional.ofNullable(lastReports.get(tenant));
    }

    public Set<String> scheduledTenants() {
        return new TreeSet<>(jobs.keySet());
    }

    ScheduledFuture<?> currentJob(final String tenant) {
        return jobs.get(tenant);
    }

    private void cancelAll() {
        for (String tenant : Set.copyOf(jobs.keySet())) {
            final ScheduledFuture<?> job = jobs.remove(tenant);
            if (job != null) job.cancel(false);
            states.put(tenant, JobState.REMOVED);
        }
    }

    private void runScheduled(final String tenant) {
        final Optional<TenantConfig> config;
        try {
            config = tenantStore.getTenantConfig(tenant);
        } catch (StoreUnavailableException e) {
            log.error("Skipping scheduled ingestion for tenant {}: {}", Tokens.abbreviate(tenant), e.getMessage());
            return;
        }
        if (config.isEmpty()) {
            log.warn("Tenant {} has no config anymore; removing its job", Tokens.abbreviate(tenant));
            unschedule(tenant);
            return;
        }
        runLocked(tenant, config.get());
    }

    private IngestionReport runLocked(final String tenant, final TenantConfig config) {
        final ReentrantLock lock = locks.computeIfAbsent(tenant, k -> new ReentrantLock());
        lock.lock();
        try {
            states.put(tenant, JobState.RUNNING);
            final IngestionReport report = runner.run(tenant, config);
            lastReports.put(tenant, report);
            return report;
        } finally {
            states.put(tenant, jobs.containsKey(tenant) ? JobState.SCHEDULED : JobState.REMOVED);
            lock.unlock();
        }
    }

    private static ZoneId zoneOf(final TenantConfig config) {
        if (config.timezone() == null || config.timezone().isBlank()) return ZoneOffset.UTC;
        try {
            return ZoneId.of(config.timezone());
        } catch (DateTimeException e) {
            throw new ConfigInvalidException("Invalid timezone '" + config.timezone() + "'", e);
        }
    }
}
