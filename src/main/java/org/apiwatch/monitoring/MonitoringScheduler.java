package org.apiwatch.monitoring;

import org.apiwatch.client.ApiCaller;
import org.apiwatch.client.ApiRequest;
import org.apiwatch.client.ApiResponse;
import org.apiwatch.client.UpstreamCallException;
import org.apiwatch.config.utils.LogContext;
import org.apiwatch.store.ApiConfiguration;
import org.apiwatch.store.CallResult;
import org.apiwatch.store.ConfigurationGoneException;
import org.apiwatch.store.ConfigurationStore;
import org.apiwatch.store.ResultStore;
import org.apiwatch.store.StoreException;
import org.apiwatch.store.UnstorablePayloadException;
import org.apiwatch.utils.JsonUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the active job set and turns due jobs into recorded calls.
 * <p>
 * The store is the source of truth. A boundary is executed only by the instance whose conditional update of
 * {@code next_fire_at} succeeds, so several schedulers may share one database.
 * <p>
 * {@link #tick()} is driven by a single timer. Due jobs run in parallel on {@code workers}; the tick waits for the
 * whole batch. Every per-job failure is logged and isolated to that job.
 */
public class MonitoringScheduler {

    private static final Logger logger = LoggerFactory.getLogger(MonitoringScheduler.class);

    private final ConfigurationStore configurations;
    private final ResultStore results;
    private final ApiCaller caller;
    private final ExecutorService workers;
    private final Clock clock;
    private final int resyncEveryTicks;

    private final Map<Long, Job> jobs = new ConcurrentHashMap<>();
    private final Set<Long> inFlight = ConcurrentHashMap.newKeySet();
    private final ReentrantLock tickLock = new ReentrantLock();
    private final AtomicLong tickCount = new AtomicLong();

    private enum Outcome { EXECUTED, RETIRED, EXPIRED, CONFLICT, ERROR, DROPPED }

    public MonitoringScheduler(ConfigurationStore configurations, ResultStore results, ApiCaller caller,
                               ExecutorService workers, Clock clock, int resyncEveryTicks) {
        this.configurations = configurations;
        this.results = results;
        this.caller = caller;
        this.workers = workers;
        this.clock = clock;
        this.resyncEveryTicks = Math.max(1, resyncEveryTicks);
    }

    // ------------------------------------------------------------------ lifecycle

    public ActivationResult activate(long configId, String tenantKey) {
        ApiConfiguration c = requireOwned(configId, tenantKey);
        Instant now = now();

        if (c.active()) {
            Job job = ensureJob(c, now);
            return new ActivationResult(configId, job.nextFireAt(), c.stopAt(), c.intervalMinutes(), true);
        }
        if (!now.isBefore(c.stopAt())) {
            throw new WindowExpiredException("Monitoring window of configuration " + configId
                    + " ended at " + c.stopAt());
        }

        Instant next = c.startAt().isAfter(now) ? c.startAt() : now;
        if (configurations.activate(configId, next)) {
            Job job = Job.of(c, next);
            jobs.put(configId, job);
            logger.info("Activated configuration {} ({}): first call at {}, every {} min until {}",
                    configId, c.name(), next, c.intervalMinutes(), c.stopAt());
            return new ActivationResult(configId, next, c.stopAt(), c.intervalMinutes(), false);
        }

        // Someone else flipped it between our read and the update; converge on what they stored.
        ApiConfiguration current = configurations.findByConfigId(configId)
                .orElseThrow(() -> new NotFoundException("Configuration " + configId + " not found"));
        if (!current.active()) {
            throw new StoreException("Activation of configuration " + configId + " did not take effect");
        }
        Job job = ensureJob(current, now);
        return new ActivationResult(configId, job.nextFireAt(), current.stopAt(), current.intervalMinutes(), true);
    }

    public void deactivate(long configId, String tenantKey) {
        requireOwned(configId, tenantKey);
        configurations.deactivate(configId);
        if (jobs.remove(configId) != null) {
            logger.info("Deactivated configuration {}", configId);
        }
    }

    private ApiConfiguration requireOwned(long configId, String tenantKey) {
        ApiConfiguration c = configurations.findByConfigId(configId)
                .orElseThrow(() -> new NotFoundException("Configuration " + configId + " not found"));
        if (!c.ownedBy(tenantKey)) {
            throw new ForbiddenException("API key does not own configuration " + configId);
        }
        return c;
    }

    private Job ensureJob(ApiConfiguration c, Instant now) {
        return jobs.computeIfAbsent(c.configId(), id -> {
            Instant next = c.nextFireAt() != null ? c.nextFireAt() : Job.resume(c.startAt(), c.interval(), now);
            return Job.of(c, next);
        });
    }

    // ------------------------------------------------------------------ tick

    public TickReport tick() {
        if (!tickLock.tryLock()) {
            logger.debug("Previous tick still running, skipping");
            return TickReport.SKIPPED;
        }
        try {
            if (tickCount.incrementAndGet() % resyncEveryTicks == 0) {
                try {
                    synchronize();
                } catch (StoreException e) {
                    logger.warn("Periodic resync failed: {}", e.getMessage());
                }
            }

            Instant now = now();
            List<Job> due = jobs.values().stream()
                    .filter(job -> job.isDue(now))
                    .filter(job -> !inFlight.contains(job.configId()))
                    .sorted(Comparator.comparing(Job::nextFireAt))
                    .toList();
            if (due.isEmpty()) {
                return new TickReport(false, 0, 0, 0, 0, 0);
            }

            int retired = 0;
            List<Callable<Outcome>> batch = new ArrayList<>();
            for (Job job : due) {
                if (job.isExpired(now)) {
                    if (retire(job, "stop time reached")) retired++;
                } else {
                    batch.add(() -> fire(job));
                }
            }

            int executed = 0;
            int conflicts = 0;
            int errors = 0;
            for (Future<Outcome> future : workers.invokeAll(batch)) {
                Outcome outcome;
                try {
                    outcome = future.get();
                } catch (ExecutionException e) {
                    logger.error("Job execution failed", e.getCause());
                    outcome = Outcome.ERROR;
                }
                switch (outcome) {
                    case EXECUTED -> executed++;
                    case RETIRED -> { executed++; retired++; }
                    case EXPIRED -> retired++;
                    case CONFLICT, DROPPED -> conflicts++;
                    case ERROR -> errors++;
                }
            }

            TickReport report = new TickReport(false, due.size(), executed, retired, conflicts, errors);
            logger.debug("Tick finished: {}", report);
            return report;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Tick interrupted");
            return TickReport.SKIPPED;
        } finally {
            tickLock.unlock();
        }
    }

    private Outcome fire(Job job) {
        long configId = job.configId();
        if (!inFlight.add(configId)) return Outcome.CONFLICT;
        LogContext.forConfiguration("MonitorJob", configId);
        try {
            ApiConfiguration c;
            try {
                c = configurations.findByConfigId(configId).orElse(null);
            } catch (StoreException e) {
                logger.warn("Could not load configuration {}, retrying next tick: {}", configId, e.getMessage());
                return Outcome.ERROR;
            }
            if (c == null || !c.active()) {
                jobs.remove(configId, job);
                logger.info("Configuration {} is gone or inactive, dropping job", configId);
                return Outcome.DROPPED;
            }

            Instant expected = job.nextFireAt();
            Instant next = job.followingBoundary();
            boolean claimed;
            try {
                claimed = configurations.compareAndSetNextFire(configId, expected, next);
            } catch (StoreException e) {
                logger.warn("Could not claim {} of configuration {}, retrying next tick: {}",
                        expected, configId, e.getMessage());
                return Outcome.ERROR;
            }
            if (!claimed) {
                logger.debug("Boundary {} of configuration {} was claimed elsewhere", expected, configId);
                refresh(job);
                return Outcome.CONFLICT;
            }
            Job advanced = job.withNextFireAt(next);
            jobs.replace(configId, job, advanced);

            // Queued behind slower calls; the window may have closed since the tick started.
            Instant calledAt = now();
            if (!calledAt.isBefore(c.stopAt())) {
                retire(advanced, "stop time reached before the call started");
                return Outcome.EXPIRED;
            }

            CallResult result = execute(c, calledAt);
            try {
                results.insert(result);
            } catch (ConfigurationGoneException e) {
                jobs.remove(configId);
                logger.info("Configuration {} was deleted while its call was in flight, retiring job", configId);
                return Outcome.DROPPED;
            } catch (UnstorablePayloadException e) {
                logger.warn("Response of configuration {} could not be stored, recording it as failed: {}",
                        configId, e.getMessage());
                if (!recordUnstorable(result, e)) {
                    revert(advanced, job);
                    return Outcome.ERROR;
                }
            } catch (StoreException e) {
                logger.error("Could not record result of configuration {}, releasing boundary {}",
                        configId, expected, e);
                revert(advanced, job);
                return Outcome.ERROR;
            }

            if (advanced.isComplete()) {
                retire(advanced, "last boundary executed");
                return Outcome.RETIRED;
            }
            return Outcome.EXECUTED;
        } finally {
            inFlight.remove(configId);
            LogContext.clear();
        }
    }

    private CallResult execute(ApiConfiguration c, Instant calledAt) {
        long configId = c.configId();
        try {
            ApiResponse response = caller.call(ApiRequest.from(c));
            logger.info("Configuration {} called: status={}, responseTime={}ms",
                    configId, response.status(), response.latencyMillis());
            return CallResult.success(configId, JsonUtil.readPayload(response.body()),
                    response.status(), response.latencyMillis(), calledAt);
        } catch (UpstreamCallException e) {
            logger.info("Configuration {} call failed after {}ms: {}", configId, e.getLatencyMillis(), e.getMessage());
            return CallResult.failure(configId, e.getMessage(), e.getLatencyMillis(), calledAt);
        } catch (RuntimeException e) {
            logger.warn("Configuration {} could not be called", configId, e);
            return CallResult.failure(configId, e.getClass().getSimpleName() + ": " + e.getMessage(), null, calledAt);
        }
    }

    private boolean recordUnstorable(CallResult result, UnstorablePayloadException cause) {
        try {
            results.insert(result.withoutPayload("Response could not be stored: " + cause.getMessage()));
            return true;
        } catch (ConfigurationGoneException e) {
            jobs.remove(result.configId());
            logger.info("Configuration {} was deleted while its call was in flight, retiring job", result.configId());
            return true;
        } catch (StoreException e) {
            logger.error("Could not record failed result of configuration {}", result.configId(), e);
            return false;
        }
    }

    private void revert(Job advanced, Job original) {
        try {
            if (configurations.compareAndSetNextFire(original.configId(), advanced.nextFireAt(),
                    original.nextFireAt())) {
                jobs.replace(original.configId(), advanced, original);
            } else {
                refresh(advanced);
            }
        } catch (StoreException e) {
            logger.error("Could not release boundary {} of configuration {}",
                    original.nextFireAt(), original.configId(), e);
        }
    }

    private void refresh(Job job) {
        try {
            Optional<ApiConfiguration> current = configurations.findByConfigId(job.configId());
            if (current.isEmpty() || !current.get().active() || current.get().nextFireAt() == null) {
                jobs.remove(job.configId(), job);
            } else {
                jobs.replace(job.configId(), job, job.withNextFireAt(current.get().nextFireAt()));
            }
        } catch (StoreException e) {
            logger.warn("Could not refresh configuration {}: {}", job.configId(), e.getMessage());
        }
    }

    private boolean retire(Job job, String reason) {
        try {
            configurations.deactivate(job.configId());
            jobs.remove(job.configId());
            logger.info("Retired configuration {}: {}", job.configId(), reason);
            return true;
        } catch (StoreException e) {
            logger.warn("Could not retire configuration {}, retrying next tick: {}", job.configId(), e.getMessage());
            return false;
        }
    }

    // ------------------------------------------------------------------ store reconciliation

    /**
     * Startup rebuild. Boundaries missed while no scheduler was running are skipped: each job resumes at the
     * first boundary of its grid after now.
     */
    public SyncReport rebuild() {
        SyncReport report = reconcile(true);
        logger.info("Rebuilt {} active jobs ({} retired)", jobs.size(), report.retired());
        return report;
    }

    /**
     * Adopts configurations activated by other instances and drops jobs whose rows are no longer active.
     */
    public SyncReport synchronize() {
        SyncReport report = reconcile(false);
        if (report.adopted() > 0 || report.dropped() > 0 || report.retired() > 0) {
            logger.info("Resynchronized jobs: {}", report);
        }
        return report;
    }

    private SyncReport reconcile(boolean startup) {
        Instant now = now();
        List<ApiConfiguration> active = configurations.findActive();
        Set<Long> activeIds = new HashSet<>();
        int adopted = 0;
        int retired = 0;

        for (ApiConfiguration c : active) {
            activeIds.add(c.configId());
            try {
                if (!now.isBefore(c.stopAt())) {
                    if (retire(Job.of(c, c.stopAt()), "stop time passed")) retired++;
                    continue;
                }
                Job current = jobs.get(c.configId());
                if (current != null) {
                    if (!inFlight.contains(c.configId()) && c.nextFireAt() != null
                            && c.nextFireAt().isAfter(current.nextFireAt())) {
                        jobs.replace(c.configId(), current, current.withNextFireAt(c.nextFireAt()));
                    }
                    continue;
                }
                Job job = adopt(c, now, startup);
                if (job == null) {
                    retired++;
                } else if (jobs.putIfAbsent(c.configId(), job) == null) {
                    adopted++;
                }
            } catch (StoreException e) {
                logger.warn("Could not adopt configuration {}: {}", c.configId(), e.getMessage());
            }
        }

        int dropped = 0;
        for (Long configId : new ArrayList<>(jobs.keySet())) {
            if (activeIds.contains(configId) || inFlight.contains(configId)) continue;
            try {
                // Re-read: it may have been activated after the listing above.
                Optional<ApiConfiguration> current = configurations.findByConfigId(configId);
                if (current.isEmpty() || !current.get().active()) {
                    jobs.remove(configId);
                    dropped++;
                }
            } catch (StoreException e) {
                logger.warn("Could not confirm state of configuration {}: {}", configId, e.getMessage());
            }
        }
        return new SyncReport(adopted, dropped, retired);
    }

    /**
     * @return the job to run, or null when the configuration was retired instead
     */
    private Job adopt(ApiConfiguration c, Instant now, boolean startup) {
        Instant stored = c.nextFireAt();
        Instant anchor = stored != null ? stored : c.startAt();
        boolean stale = startup ? anchor.isBefore(now) : !anchor.plus(c.interval()).isAfter(now);
        Instant next = stale ? Job.resume(anchor, c.interval(), now) : anchor;

        if (!next.isBefore(c.stopAt())) {
            retire(Job.of(c, next), "no boundary left before stop time");
            return null;
        }
        if (!Objects.equals(next, stored) && !configurations.compareAndSetNextFire(c.configId(), stored, next)) {
            Optional<ApiConfiguration> fresh = configurations.findByConfigId(c.configId());
            if (fresh.isEmpty() || !fresh.get().active() || fresh.get().nextFireAt() == null) return null;
            next = fresh.get().nextFireAt();
        }
        return Job.of(c, next);
    }

    // ------------------------------------------------------------------ queries

    public int activeJobCount() {
        return jobs.size();
    }

    public Optional<Job> job(long configId) {
        return Optional.ofNullable(jobs.get(configId));
    }

    public void shutdown() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("Monitoring scheduler stopped with {} active jobs", jobs.size());
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
