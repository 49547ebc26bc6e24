package org.apiwatch.monitoring;

import org.apiwatch.client.ApiResponse;
import org.apiwatch.store.ApiConfiguration;
import org.apiwatch.store.CallResult;
import org.apiwatch.store.ResultStats;
import org.apiwatch.store.ResultStore;
import org.apiwatch.store.StoreException;
import org.apiwatch.store.UnstorablePayloadException;
import org.apiwatch.support.FakeApiCaller;
import org.apiwatch.support.InMemoryMonitoringStore;
import org.apiwatch.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.apiwatch.support.Configurations.OTHER_TENANT;
import static org.apiwatch.support.Configurations.TENANT;
import static org.apiwatch.support.Configurations.inactive;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MonitoringSchedulerTest {

    private static final Instant T0 = Instant.parse("2025-03-01T10:00:00Z");
    private static final long CONFIG_ID = 123456789L;

    private final List<MonitoringScheduler> schedulers = new ArrayList<>();

    private MutableClock clock;
    private InMemoryMonitoringStore store;
    private FakeApiCaller caller;
    private MonitoringScheduler scheduler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        store = new InMemoryMonitoringStore();
        caller = new FakeApiCaller();
        scheduler = newScheduler(store);
    }

    @AfterEach
    void tearDown() {
        schedulers.forEach(MonitoringScheduler::shutdown);
    }

    private MonitoringScheduler newScheduler(ResultStore results) {
        MonitoringScheduler s = new MonitoringScheduler(store, results, caller,
                Executors.newFixedThreadPool(4), clock, 1000);
        schedulers.add(s);
        return s;
    }

    private void seed(double intervalMinutes, Instant start, Instant stop) {
        store.insert(inactive(CONFIG_ID, intervalMinutes, start, stop));
    }

    private void tickEvery(Duration step, Duration total) {
        for (Duration elapsed = Duration.ZERO; elapsed.compareTo(total) <= 0; elapsed = elapsed.plus(step)) {
            scheduler.tick();
            clock.advance(step);
        }
    }

    // ------------------------------------------------------------------ activation

    @Test
    void activatingUnknownConfigurationIsNotFound() {
        assertThatThrownBy(() -> scheduler.activate(42L, TENANT)).isInstanceOf(NotFoundException.class);
    }

    @Test
    void activatingSomeoneElsesConfigurationIsForbiddenAndChangesNothing() {
        seed(1, T0, T0.plus(Duration.ofHours(1)));

        assertThatThrownBy(() -> scheduler.activate(CONFIG_ID, OTHER_TENANT))
                .isInstanceOf(ForbiddenException.class);
        assertThat(store.findByConfigId(CONFIG_ID).orElseThrow().active()).isFalse();
        assertThat(scheduler.activeJobCount()).isZero();
    }

    @Test
    void activatingAfterStopTimeIsWindowExpired() {
        seed(1, T0, T0.plus(Duration.ofMinutes(5)));
        clock.advance(Duration.ofMinutes(5));

        assertThatThrownBy(() -> scheduler.activate(CONFIG_ID, TENANT))
                .isInstanceOf(WindowExpiredException.class);
        assertThat(store.findByConfigId(CONFIG_ID).orElseThrow().active()).isFalse();
    }

    @Test
    void activationStartsAtStartTimeWhenItIsInTheFuture() {
        Instant start = T0.plus(Duration.ofMinutes(10));
        seed(1, start, start.plus(Duration.ofHours(1)));

        ActivationResult result = scheduler.activate(CONFIG_ID, TENANT);

        assertThat(result.nextFireAt()).isEqualTo(start);
        assertThat(store.findByConfigId(CONFIG_ID).orElseThrow().nextFireAt()).isEqualTo(start);
        tickEvery(Duration.ofMinutes(1), Duration.ofMinutes(9));
        assertThat(caller.requests()).isEmpty();
    }

    @Test
    void activatingTwiceKeepsOneJob() {
        seed(1, T0, T0.plus(Duration.ofHours(1)));

        ActivationResult first = scheduler.activate(CONFIG_ID, TENANT);
        ActivationResult second = scheduler.activate(CONFIG_ID, TENANT);

        assertThat(first.alreadyActive()).isFalse();
        assertThat(second.alreadyActive()).isTrue();
        assertThat(second.nextFireAt()).isEqualTo(first.nextFireAt());
        assertThat(scheduler.activeJobCount()).isEqualTo(1);
    }

    @Test
    void concurrentActivationsConvergeOnOneBoundary() throws Exception {
        seed(1, T0, T0.plus(Duration.ofHours(1)));
        MonitoringScheduler other = newScheduler(store);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<ActivationResult>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < 8; i++) {
                MonitoringScheduler target = i % 2 == 0 ? scheduler : other;
                futures.add(pool.submit(() -> {
                    start.await();
                    return target.activate(CONFIG_ID, TENANT);
                }));
            }
            start.countDown();
            long fresh = 0;
            for (Future<ActivationResult> f : futures) {
                if (!f.get(5, TimeUnit.SECONDS).alreadyActive()) fresh++;
            }
            assertThat(fresh).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }

        scheduler.tick();
        other.tick();

        assertThat(store.results(CONFIG_ID)).hasSize(1);
    }

    // ------------------------------------------------------------------ ticking

    @Test
    void oneMinuteIntervalOverThreeMinuteWindowRecordsThreeResults() {
        Instant stop = T0.plus(Duration.ofMinutes(3));
        seed(1, T0, stop);
        scheduler.activate(CONFIG_ID, TENANT);

        tickEvery(Duration.ofSeconds(30), Duration.ofMinutes(6));

        List<CallResult> results = store.results(CONFIG_ID);
        assertThat(results).hasSize(3);
        assertThat(results).allSatisfy(r -> {
            assertThat(r.successful()).isTrue();
            assertThat(r.calledAt()).isBetween(T0, stop);
        });
        assertThat(store.findByConfigId(CONFIG_ID).orElseThrow().active()).isFalse();
        assertThat(scheduler.activeJobCount()).isZero();
    }

    @Test
    void resultCountIsWholeIntervalsInsideTheWindow() {
        Instant stop = T0.plus(Duration.ofMinutes(10));
        seed(2.5, T0, stop);
        scheduler.activate(CONFIG_ID, TENANT);

        tickEvery(Duration.ofSeconds(30), Duration.ofMinutes(15));

        assertThat(store.results(CONFIG_ID)).hasSize(4);
        assertThat(store.results(CONFIG_ID)).extracting(CallResult::calledAt)
                .containsExactly(T0.plusSeconds(450), T0.plusSeconds(300), T0.plusSeconds(150), T0);
    }

    @Test
    void jobIsRetiredWithoutCallingOnceStopTimePassed() {
        seed(1, T0, T0.plus(Duration.ofMinutes(30)));
        scheduler.activate(CONFIG_ID, TENANT);
        clock.advance(Duration.ofMinutes(31));

        TickReport report = scheduler.tick();

        assertThat(report.retired()).isEqualTo(1);
        assertThat(caller.requests()).isEmpty();
        assertThat(store.findByConfigId(CONFIG_ID).orElseThrow().active()).isFalse();
    }

    @Test
    void transportFailureIsRecordedAsFailedResult() {
        seed(1, T0, T0.plus(Duration.ofHours(1)));
        scheduler.activate(CONFIG_ID, TENANT);
        caller.failWith("Connection refused");

        scheduler.tick();

        CallResult result = store.results(CONFIG_ID).get(0);
        assertThat(result.successful()).isFalse();
        assertThat(result.errorMessage()).isEqualTo("Connection refused");
        assertThat(result.responseData()).isNull();
        assertThat(scheduler.job(CONFIG_ID)).isPresent();
    }

    @Test
    void errorStatusStillCountsAsSuccessfulCall() {
        seed(1, T0, T0.plus(Duration.ofHours(1)));
        scheduler.activate(CONFIG_ID, TENANT);
        caller.respondWith(503, "maintenance");

        scheduler.tick();

        CallResult result = store.results(CONFIG_ID).get(0);
        assertThat(result.successful()).isTrue();
        assertThat(result.httpStatus()).isEqualTo(503);
        assertThat(result.responseData().asText()).isEqualTo("maintenance");
        assertThat(result.errorMessage()).isNull();
    }

    @Test
    void pollingSendsConfiguredRequest() {
        seed(1, T0, T0.plus(Duration.ofHours(1)));
        scheduler.activate(CONFIG_ID, TENANT);

        scheduler.tick();

        assertThat(caller.lastRequest().url()).isEqualTo("https://api.example.com/v1/orders");
        assertThat(caller.lastRequest().params()).containsEntry("status", "open").containsEntry("page", 1);
        assertThat(caller.lastRequest().headers()).containsEntry("Accept", "application/json");
    }

    @Test
    void failedResultWriteReleasesTheBoundaryForTheNextTick() {
        AtomicInteger inserts = new AtomicInteger();
        ResultStore flaky = new ResultStore() {
            @Override
            public CallResult insert(CallResult result) {
                if (inserts.incrementAndGet() == 1) throw new StoreException("disk full");
                return store.insert(result);
            }

            @Override
            public List<CallResult> findByConfigId(long configId, int limit) {
                return store.findByConfigId(configId, limit);
            }

            @Override
            public ResultStats stats(long configId) {
                return store.stats(configId);
            }
        };
        MonitoringScheduler s = newScheduler(flaky);
        seed(1, T0, T0.plus(Duration.ofHours(1)));
        s.activate(CONFIG_ID, TENANT);

        TickReport failed = s.tick();

        assertThat(failed.errors()).isEqualTo(1);
        assertThat(store.findByConfigId(CONFIG_ID).orElseThrow().nextFireAt()).isEqualTo(T0);
        assertThat(s.job(CONFIG_ID).orElseThrow().nextFireAt()).isEqualTo(T0);

        clock.advance(Duration.ofSeconds(30));
        s.tick();

        assertThat(store.results(CONFIG_ID)).hasSize(1);
        assertThat(store.findByConfigId(CONFIG_ID).orElseThrow().nextFireAt()).isEqualTo(T0.plusSeconds(60));
    }

    @Test
    void unstorableResponseIsRecordedAsFailedAndKeepsTheBoundary() {
        ResultStore rejectingBodies = new ResultStore() {
            @Override
            public CallResult insert(CallResult result) {
                if (result.responseData() != null) {
                    throw new UnstorablePayloadException("Result was rejected by the database (22P05)", null);
                }
                return store.insert(result);
            }

            @Override
            public List<CallResult> findByConfigId(long configId, int limit) {
                return store.findByConfigId(configId, limit);
            }

            @Override
            public ResultStats stats(long configId) {
                return store.stats(configId);
            }
        };
        MonitoringScheduler s = newScheduler(rejectingBodies);
        seed(1, T0, T0.plus(Duration.ofHours(1)));
        s.activate(CONFIG_ID, TENANT);
        caller.respondWith(200, "{\"a\":\"\\u0000\"}");

        TickReport report = s.tick();

        assertThat(report.executed()).isEqualTo(1);
        assertThat(report.errors()).isZero();
        CallResult recorded = store.results(CONFIG_ID).get(0);
        assertThat(recorded.successful()).isFalse();
        assertThat(recorded.responseData()).isNull();
        assertThat(recorded.httpStatus()).isEqualTo(200);
        assertThat(recorded.errorMessage()).startsWith("Response could not be stored");
        assertThat(store.findByConfigId(CONFIG_ID).orElseThrow().nextFireAt()).isEqualTo(T0.plusSeconds(60));

        clock.advance(Duration.ofSeconds(30));
        s.tick();

        assertThat(caller.requests()).hasSize(1);
        assertThat(store.results(CONFIG_ID)).hasSize(1);
    }

    private MonitoringScheduler singleWorkerScheduler() {
        MonitoringScheduler s = new MonitoringScheduler(store, store, caller,
                Executors.newSingleThreadExecutor(), clock, 1000);
        schedulers.add(s);
        return s;
    }

    @Test
    void queuedCallIsStampedWhenItRunsNotWhenTheTickStarted() {
        long laterId = CONFIG_ID + 1;
        seed(1, T0, T0.plus(Duration.ofHours(1)));
        store.insert(inactive(laterId, 1, T0.plusSeconds(5), T0.plus(Duration.ofHours(1))));
        MonitoringScheduler s = singleWorkerScheduler();
        s.activate(CONFIG_ID, TENANT);
        s.activate(laterId, TENANT);
        clock.advance(Duration.ofSeconds(5));
        caller.answer(request -> {
            clock.advance(Duration.ofSeconds(25));
            return new ApiResponse(200, "{}", 25_000);
        });

        TickReport report = s.tick();

        assertThat(report.executed()).isEqualTo(2);
        assertThat(store.results(CONFIG_ID)).extracting(CallResult::calledAt).containsExactly(T0.plusSeconds(5));
        assertThat(store.results(laterId)).extracting(CallResult::calledAt).containsExactly(T0.plusSeconds(30));
    }

    @Test
    void queuedCallThatWouldStartAfterStopTimeRecordsNothing() {
        long shortId = CONFIG_ID + 1;
        seed(1, T0, T0.plus(Duration.ofHours(1)));
        store.insert(inactive(shortId, 1, T0.plusSeconds(5), T0.plusSeconds(20)));
        MonitoringScheduler s = singleWorkerScheduler();
        s.activate(CONFIG_ID, TENANT);
        s.activate(shortId, TENANT);
        clock.advance(Duration.ofSeconds(5));
        caller.answer(request -> {
            clock.advance(Duration.ofSeconds(25));
            return new ApiResponse(200, "{}", 25_000);
        });

        TickReport report = s.tick();

        assertThat(report.executed()).isEqualTo(1);
        assertThat(report.retired()).isEqualTo(1);
        assertThat(caller.requests()).hasSize(1);
        assertThat(store.results(shortId)).isEmpty();
        assertThat(store.findByConfigId(shortId).orElseThrow().active()).isFalse();
        assertThat(s.job(shortId)).isEmpty();
    }

    @Test
    void configurationDeletedDuringCallRetiresJobQuietly() {
        seed(1, T0, T0.plus(Duration.ofHours(1)));
        scheduler.activate(CONFIG_ID, TENANT);
        caller.answer(request -> {
            store.delete(CONFIG_ID);
            return new ApiResponse(200, "{}", 3);
        });

        TickReport report = scheduler.tick();

        assertThat(report.errors()).isZero();
        assertThat(scheduler.activeJobCount()).isZero();
        assertThat(store.configurationCount()).isZero();
    }

    @Test
    void callInFlightDuringDeactivationStillRecordsItsResult() {
        seed(1, T0, T0.plus(Duration.ofHours(1)));
        scheduler.activate(CONFIG_ID, TENANT);
        caller.answer(request -> {
            scheduler.deactivate(CONFIG_ID, TENANT);
            return new ApiResponse(200, "{}", 3);
        });

        scheduler.tick();
        clock.advance(Duration.ofMinutes(2));
        scheduler.tick();

        assertThat(store.results(CONFIG_ID)).hasSize(1);
        assertThat(scheduler.activeJobCount()).isZero();
    }

    @Test
    void overlappingTickIsSkipped() throws Exception {
        seed(1, T0, T0.plus(Duration.ofHours(1)));
        scheduler.activate(CONFIG_ID, TENANT);
        CountDownLatch inCall = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        caller.answer(request -> {
            inCall.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return new ApiResponse(200, "{}", 3);
        });

        ExecutorService background = Executors.newSingleThreadExecutor();
        try {
            Future<TickReport> first = background.submit(scheduler::tick);
            assertThat(inCall.await(5, TimeUnit.SECONDS)).isTrue();

            assertThat(scheduler.tick().skipped()).isTrue();

            release.countDown();
            assertThat(first.get(5, TimeUnit.SECONDS).executed()).isEqualTo(1);
        } finally {
            background.shutdownNow();
        }
        assertThat(store.results(CONFIG_ID)).hasSize(1);
    }

    // ------------------------------------------------------------------ deactivation

    @Test
    void deactivationStopsFurtherCallsAndIsIdempotent() {
        seed(1, T0, T0.plus(Duration.ofHours(1)));
        scheduler.activate(CONFIG_ID, TENANT);
        scheduler.tick();

        scheduler.deactivate(CONFIG_ID, TENANT);
        scheduler.deactivate(CONFIG_ID, TENANT);
        tickEvery(Duration.ofMinutes(1), Duration.ofMinutes(5));

        ApiConfiguration stored = store.findByConfigId(CONFIG_ID).orElseThrow();
        assertThat(stored.active()).isFalse();
        assertThat(stored.nextFireAt()).isNull();
        assertThat(store.results(CONFIG_ID)).hasSize(1);
    }

    @Test
    void deactivatingSomeoneElsesConfigurationIsForbidden() {
        seed(1, T0, T0.plus(Duration.ofHours(1)));
        scheduler.activate(CONFIG_ID, TENANT);

        assertThatThrownBy(() -> scheduler.deactivate(CONFIG_ID, OTHER_TENANT))
                .isInstanceOf(ForbiddenException.class);
        assertThat(scheduler.activeJobCount()).isEqualTo(1);
    }

    // ------------------------------------------------------------------ restart and several instances

    @Test
    void restartResumesAtNextBoundaryWithoutCatchingUp() {
        seed(1, T0, T0.plus(Duration.ofHours(1)));
        scheduler.activate(CONFIG_ID, TENANT);
        scheduler.tick();

        clock.advance(Duration.ofSeconds(630));
        MonitoringScheduler restarted = newScheduler(store);
        restarted.rebuild();

        assertThat(restarted.job(CONFIG_ID).orElseThrow().nextFireAt()).isEqualTo(T0.plusSeconds(660));
        assertThat(store.findByConfigId(CONFIG_ID).orElseThrow().nextFireAt()).isEqualTo(T0.plusSeconds(660));
        restarted.tick();
        assertThat(store.results(CONFIG_ID)).hasSize(1);

        clock.advance(Duration.ofSeconds(30));
        restarted.tick();
        assertThat(store.results(CONFIG_ID)).hasSize(2);
    }

    @Test
    void rebuildRetiresRowsWhoseWindowEnded() {
        seed(1, T0, T0.plus(Duration.ofMinutes(10)));
        scheduler.activate(CONFIG_ID, TENANT);
        clock.advance(Duration.ofMinutes(20));

        MonitoringScheduler restarted = newScheduler(store);
        SyncReport report = restarted.rebuild();

        assertThat(report.retired()).isEqualTo(1);
        assertThat(restarted.activeJobCount()).isZero();
        assertThat(store.findByConfigId(CONFIG_ID).orElseThrow().active()).isFalse();
    }

    @Test
    void twoSchedulersSharingOneStoreFireEachBoundaryOnce() {
        seed(1, T0, T0.plus(Duration.ofHours(1)));
        MonitoringScheduler other = newScheduler(store);
        scheduler.activate(CONFIG_ID, TENANT);
        assertThat(other.synchronize().adopted()).isEqualTo(1);

        for (int i = 0; i < 5; i++) {
            scheduler.tick();
            other.tick();
            clock.advance(Duration.ofMinutes(1));
        }

        assertThat(store.results(CONFIG_ID)).hasSize(5);
        assertThat(store.results(CONFIG_ID)).extracting(CallResult::calledAt).doesNotHaveDuplicates();
    }

    @Test
    void synchronizeDropsJobsDeactivatedElsewhere() {
        seed(1, T0, T0.plus(Duration.ofHours(1)));
        MonitoringScheduler other = newScheduler(store);
        scheduler.activate(CONFIG_ID, TENANT);
        other.synchronize();

        scheduler.deactivate(CONFIG_ID, TENANT);

        assertThat(other.synchronize().dropped()).isEqualTo(1);
        assertThat(other.job(CONFIG_ID)).isEmpty();
    }
}
