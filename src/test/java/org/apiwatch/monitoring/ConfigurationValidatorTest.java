package org.apiwatch.monitoring;

import org.apiwatch.store.ApiConfiguration;
import org.apiwatch.support.FakeApiCaller;
import org.apiwatch.support.InMemoryMonitoringStore;
import org.apiwatch.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;
import java.util.stream.Stream;

import static org.apiwatch.support.Configurations.TENANT;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigurationValidatorTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    private InMemoryMonitoringStore store;
    private FakeApiCaller caller;
    private ConfigurationValidator validator;

    @BeforeEach
    void setUp() {
        store = new InMemoryMonitoringStore();
        caller = new FakeApiCaller();
        validator = validator(MonitoringSettings.defaults(), sequence(500_000_001L));
    }

    private ConfigurationValidator validator(MonitoringSettings settings, LongSupplier ids) {
        return new ConfigurationValidator(store, store, caller, settings, new MutableClock(NOW), ids);
    }

    private static LongSupplier sequence(long first) {
        AtomicLong next = new AtomicLong(first);
        return next::getAndIncrement;
    }

    private static ConfigurationDraft.Builder draft() {
        return ConfigurationDraft.builder()
                .name("Orders API")
                .method("get")
                .baseUrl("https://api.example.com/")
                .endpoint("/v1/orders")
                .intervalMinutes(5);
    }

    @Test
    void successfulTrialCallStoresOneInactiveConfiguration() {
        ValidationOutcome outcome = validator.validate(TENANT, draft().build());

        assertThat(outcome.configId()).isEqualTo(500_000_001L);
        assertThat(outcome.httpStatus()).isEqualTo(200);
        assertThat(outcome.sampleResponse().get("ok").asBoolean()).isTrue();
        assertThat(outcome.startAt()).isEqualTo(NOW);
        assertThat(outcome.stopAt()).isEqualTo(NOW.plus(Duration.ofHours(24)));

        assertThat(store.configurationCount()).isEqualTo(1);
        ApiConfiguration stored = store.findByConfigId(outcome.configId()).orElseThrow();
        assertThat(stored.active()).isFalse();
        assertThat(stored.nextFireAt()).isNull();
        assertThat(stored.apiKey()).isEqualTo(TENANT);
        assertThat(stored.method()).isEqualTo("GET");
        assertThat(stored.intervalMinutes()).isEqualByComparingTo("5");
        assertThat(caller.requests()).hasSize(1);
        assertThat(store.resultCount()).isZero();
    }

    @Test
    void nonJsonBodyIsReturnedAsRawText() {
        caller.respondWith(200, "pong");

        ValidationOutcome outcome = validator.validate(TENANT, draft().build());

        assertThat(outcome.sampleResponse().isTextual()).isTrue();
        assertThat(outcome.sampleResponse().asText()).isEqualTo("pong");
    }

    @Test
    void keyValueLinesAreParsedAndAdditionalParamsMergedOverParams() {
        ConfigurationDraft d = draft()
                .params("page: 2\nverbose: true\nq: status: open")
                .headers("Accept: application/json")
                .additionalParams(Map.of("page", 3))
                .build();

        validator.validate(TENANT, d);

        assertThat(caller.lastRequest().url()).isEqualTo("https://api.example.com/v1/orders");
        assertThat(caller.lastRequest().params())
                .containsEntry("page", 3)
                .containsEntry("verbose", true)
                .containsEntry("q", "status: open");
        assertThat(caller.lastRequest().headers()).containsEntry("Accept", "application/json");
    }

    @Test
    void unreachableUpstreamStoresNothing() {
        caller.failWith("Connection refused");

        assertThatThrownBy(() -> validator.validate(TENANT, draft().build()))
                .isInstanceOf(UpstreamUnreachableException.class)
                .hasMessageContaining("Connection refused");
        assertThat(store.configurationCount()).isZero();
    }

    @Test
    void rejectedTrialCallStoresNothing() {
        caller.respondWith(404, "{\"error\":\"not found\"}");

        assertThatThrownBy(() -> validator.validate(TENANT, draft().build()))
                .isInstanceOfSatisfying(UpstreamRejectedException.class,
                        e -> assertThat(e.getUpstreamStatus()).isEqualTo(404));
        assertThat(store.configurationCount()).isZero();
    }

    static Stream<Arguments> invalidDrafts() {
        return Stream.of(
                Arguments.of("blank name", draft().name(" ")),
                Arguments.of("unsupported method", draft().method("TRACE")),
                Arguments.of("missing base url", draft().baseUrl(null)),
                Arguments.of("non-http scheme", draft().baseUrl("ftp://files.example.com")),
                Arguments.of("relative url", draft().baseUrl("/just/a/path")),
                Arguments.of("malformed endpoint", draft().endpoint("/orders?q=a b")),
                Arguments.of("zero interval", draft().intervalMinutes(0)),
                Arguments.of("negative interval", draft().intervalMinutes(-1)),
                Arguments.of("interval below bound", draft().intervalMinutes(0.5)),
                Arguments.of("interval above bound", draft().intervalMinutes(1441)),
                Arguments.of("too many decimals", draft().intervalMinutes(new BigDecimal("1.005"))),
                Arguments.of("missing interval", draft().intervalMinutes((BigDecimal) null)),
                Arguments.of("start in the past", draft().startAt(NOW.minus(Duration.ofHours(2)))),
                Arguments.of("stop before start", draft().stopAt(NOW.minus(Duration.ofMinutes(1)))),
                Arguments.of("window too long", draft().stopAt(NOW.plus(Duration.ofHours(169)))),
                Arguments.of("stop hours too many", draft().stopAfterHours(200)),
                Arguments.of("stop hours zero", draft().stopAfterHours(0)),
                Arguments.of("both stop forms", draft().stopAt(NOW.plus(Duration.ofHours(2))).stopAfterHours(2))
        );
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("invalidDrafts")
    void invalidDraftIsRejectedBeforeAnyCall(String label, ConfigurationDraft.Builder builder) {
        assertThatThrownBy(() -> validator.validate(TENANT, builder.build()))
                .isInstanceOf(InvalidConfigurationException.class);
        assertThat(caller.requests()).isEmpty();
        assertThat(store.configurationCount()).isZero();
    }

    @Test
    void missingTenantKeyIsInvalid() {
        assertThatThrownBy(() -> validator.validate("  ", draft().build()))
                .isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    void startWithinClockSkewGraceIsAccepted() {
        Instant start = NOW.minusSeconds(30);

        ValidationOutcome outcome = validator.validate(TENANT, draft().startAt(start).stopAfterHours(2).build());

        assertThat(outcome.startAt()).isEqualTo(start);
        assertThat(outcome.stopAt()).isEqualTo(start.plus(Duration.ofHours(2)));
    }

    @Test
    void takenConfigIdIsRetriedWithAnotherOne() {
        validator.validate(TENANT, draft().build());
        ConfigurationValidator sameIdsAgain = validator(MonitoringSettings.defaults(), sequence(500_000_001L));

        ValidationOutcome second = sameIdsAgain.validate(TENANT, draft().build());

        assertThat(second.configId()).isEqualTo(500_000_002L);
        assertThat(store.configurationCount()).isEqualTo(2);
    }

    @Test
    void trialResultIsRecordedWhenEnabled() {
        MonitoringSettings d = MonitoringSettings.defaults();
        MonitoringSettings recording = new MonitoringSettings(d.tickInterval(), d.callTimeout(), d.workerThreads(),
                d.resyncEveryTicks(), d.minIntervalMinutes(), d.maxIntervalMinutes(), d.defaultWindowHours(),
                d.maxWindowHours(), d.summaryResultLimit(), d.excerptLength(), d.retention(),
                d.retentionSweepInterval(), true);

        ValidationOutcome outcome = validator(recording, sequence(600_000_000L)).validate(TENANT, draft().build());

        assertThat(store.results(outcome.configId())).singleElement()
                .satisfies(r -> assertThat(r.httpStatus()).isEqualTo(200));
    }

    @Test
    void generatedIdsHaveNineDigits() {
        ConfigIdGenerator generator = new ConfigIdGenerator();
        for (int i = 0; i < 1000; i++) {
            assertThat(generator.getAsLong()).isBetween(100_000_000L, 999_999_999L);
        }
    }
}
