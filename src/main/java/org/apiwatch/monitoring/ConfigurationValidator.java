package org.apiwatch.monitoring;

import com.fasterxml.jackson.databind.JsonNode;
import org.apiwatch.client.ApiCaller;
import org.apiwatch.client.ApiRequest;
import org.apiwatch.client.ApiResponse;
import org.apiwatch.client.UpstreamCallException;
import org.apiwatch.store.ApiConfiguration;
import org.apiwatch.store.CallResult;
import org.apiwatch.store.ConfigurationStore;
import org.apiwatch.store.DuplicateConfigIdException;
import org.apiwatch.store.ResultStore;
import org.apiwatch.store.StoreException;
import org.apiwatch.utils.JsonUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Set;
import java.util.function.LongSupplier;

/**
 * Checks a draft, makes one trial call and stores the configuration inactive when the call succeeds.
 * Nothing is stored when a check or the call fails.
 */
public class ConfigurationValidator {

    private static final Logger logger = LoggerFactory.getLogger(ConfigurationValidator.class);

    private static final Set<String> METHODS = Set.of("GET", "POST", "PUT", "DELETE", "PATCH");
    private static final Duration START_GRACE = Duration.ofMinutes(1);
    private static final int MAX_ID_ATTEMPTS = 5;
    private static final int MAX_NAME_LENGTH = 255;
    private static final int MAX_URL_LENGTH = 500;

    private final ConfigurationStore configurations;
    private final ResultStore results;
    private final ApiCaller caller;
    private final MonitoringSettings settings;
    private final Clock clock;
    private final LongSupplier configIds;

    public ConfigurationValidator(ConfigurationStore configurations, ResultStore results, ApiCaller caller,
                                  MonitoringSettings settings, Clock clock, LongSupplier configIds) {
        this.configurations = configurations;
        this.results = results;
        this.caller = caller;
        this.settings = settings;
        this.clock = clock;
        this.configIds = configIds;
    }

    public ValidationOutcome validate(String tenantKey, ConfigurationDraft draft) {
        if (isBlank(tenantKey)) throw new InvalidConfigurationException("API key is required");
        if (draft == null) throw new InvalidConfigurationException("Configuration is required");

        String name = requireName(draft.name());
        String method = requireMethod(draft.method());
        String baseUrl = requireBaseUrl(draft.baseUrl());
        String endpoint = isBlank(draft.endpoint()) ? null : draft.endpoint().strip();
        String url = ApiRequest.joinUrl(baseUrl, endpoint);
        requireUri(url, "endpoint");
        BigDecimal interval = requireInterval(draft.intervalMinutes());

        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        Instant startAt = resolveStart(draft.startAt(), now);
        Instant stopAt = resolveStop(draft, startAt);

        ApiRequest request = ApiRequest.of(method, baseUrl, endpoint, draft.params(), draft.headers(),
                draft.additionalParams());
        ApiResponse response;
        try {
            response = caller.call(request);
        } catch (UpstreamCallException e) {
            logger.info("Trial call {} {} failed: {}", method, url, e.getMessage());
            throw new UpstreamUnreachableException("Could not reach " + url + ": " + e.getMessage(), e);
        }
        if (!response.isSuccessful()) {
            logger.info("Trial call {} {} rejected with HTTP {}", method, url, response.status());
            throw new UpstreamRejectedException(response.status(),
                    "Trial call to " + url + " returned HTTP " + response.status());
        }

        ApiConfiguration stored = insertWithFreshId(tenantKey, draft, name, method, baseUrl, endpoint,
                interval, startAt, stopAt, now);
        JsonNode sample = JsonUtil.readPayload(response.body());
        logger.info("Validated configuration {} ({}) for {} {}", stored.configId(), name, method, url);

        if (settings.recordTrialResult()) {
            try {
                results.insert(CallResult.success(stored.configId(), sample, response.status(),
                        response.latencyMillis(), now));
            } catch (StoreException e) {
                logger.warn("Trial result of configuration {} not recorded: {}", stored.configId(), e.getMessage());
            }
        }

        return new ValidationOutcome(stored.configId(), name, response.status(), response.latencyMillis(),
                sample, startAt, stopAt, interval);
    }

    private ApiConfiguration insertWithFreshId(String tenantKey, ConfigurationDraft draft, String name,
                                               String method, String baseUrl, String endpoint,
                                               BigDecimal interval, Instant startAt, Instant stopAt,
                                               Instant now) {
        DuplicateConfigIdException last = null;
        for (int attempt = 0; attempt < MAX_ID_ATTEMPTS; attempt++) {
            long configId = configIds.getAsLong();
            try {
                return configurations.insert(ApiConfiguration.draft(configId, tenantKey, name,
                        draft.description(), method, baseUrl, endpoint, draft.params(), draft.headers(),
                        draft.additionalParams(), interval, startAt, stopAt, now));
            } catch (DuplicateConfigIdException e) {
                logger.debug("config_id {} taken, drawing another", configId);
                last = e;
            }
        }
        throw new StoreException("Could not allocate a unique config_id", last);
    }

    private static String requireName(String name) {
        if (isBlank(name)) throw new InvalidConfigurationException("name is required");
        String trimmed = name.strip();
        if (trimmed.length() > MAX_NAME_LENGTH) {
            throw new InvalidConfigurationException("name must be at most " + MAX_NAME_LENGTH + " characters");
        }
        return trimmed;
    }

    private static String requireMethod(String method) {
        String upper = isBlank(method) ? "GET" : method.strip().toUpperCase(Locale.ROOT);
        if (!METHODS.contains(upper)) {
            throw new InvalidConfigurationException("Unsupported method " + method
                    + "; expected one of GET, POST, PUT, DELETE, PATCH");
        }
        return upper;
    }

    private static String requireBaseUrl(String baseUrl) {
        if (isBlank(baseUrl)) throw new InvalidConfigurationException("base_url is required");
        String trimmed = baseUrl.strip();
        if (trimmed.length() > MAX_URL_LENGTH) {
            throw new InvalidConfigurationException("base_url must be at most " + MAX_URL_LENGTH + " characters");
        }
        URI uri = requireUri(trimmed, "base_url");
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!uri.isAbsolute() || !(scheme.equals("http") || scheme.equals("https"))) {
            throw new InvalidConfigurationException("base_url must be an absolute http or https URL");
        }
        if (isBlank(uri.getHost())) {
            throw new InvalidConfigurationException("base_url must name a host");
        }
        return trimmed;
    }

    private static URI requireUri(String value, String field) {
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            throw new InvalidConfigurationException(field + " is not a valid URL: " + e.getReason(), e);
        }
    }

    private BigDecimal requireInterval(BigDecimal interval) {
        if (interval == null) throw new InvalidConfigurationException("schedule_interval_minutes is required");
        if (interval.signum() <= 0) {
            throw new InvalidConfigurationException("schedule_interval_minutes must be greater than 0");
        }
        if (interval.stripTrailingZeros().scale() > 2) {
            throw new InvalidConfigurationException("schedule_interval_minutes allows at most two decimals");
        }
        if (interval.compareTo(settings.minIntervalMinutes()) < 0
                || interval.compareTo(settings.maxIntervalMinutes()) > 0) {
            throw new InvalidConfigurationException("schedule_interval_minutes must be between "
                    + settings.minIntervalMinutes().stripTrailingZeros().toPlainString() + " and "
                    + settings.maxIntervalMinutes().stripTrailingZeros().toPlainString());
        }
        return interval;
    }

    private static Instant resolveStart(Instant requested, Instant now) {
        if (requested == null) return now;
        Instant start = requested.truncatedTo(ChronoUnit.MILLIS);
        if (start.isBefore(now.minus(START_GRACE))) {
            throw new InvalidConfigurationException("start_at must not be in the past");
        }
        return start;
    }

    private Instant resolveStop(ConfigurationDraft draft, Instant startAt) {
        Duration maxWindow = Duration.ofHours(settings.maxWindowHours());
        Instant stopAt;
        if (draft.stopAt() != null) {
            if (draft.stopAfterHours() != null) {
                throw new InvalidConfigurationException("Give either stop_at or stop_after_hours, not both");
            }
            stopAt = draft.stopAt().truncatedTo(ChronoUnit.MILLIS);
        } else {
            int hours = draft.stopAfterHours() != null ? draft.stopAfterHours() : settings.defaultWindowHours();
            if (hours < 1 || hours > settings.maxWindowHours()) {
                throw new InvalidConfigurationException("stop_after_hours must be between 1 and "
                        + settings.maxWindowHours());
            }
            stopAt = startAt.plus(Duration.ofHours(hours));
        }
        if (!startAt.isBefore(stopAt)) {
            throw new InvalidConfigurationException("start_at must be before stop_at");
        }
        if (Duration.between(startAt, stopAt).compareTo(maxWindow) > 0) {
            throw new InvalidConfigurationException("Monitoring window must not exceed "
                    + settings.maxWindowHours() + " hours");
        }
        return stopAt;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
