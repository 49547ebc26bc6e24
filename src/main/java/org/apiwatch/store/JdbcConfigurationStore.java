package org.apiwatch.store;

import org.apiwatch.utils.DbUtil;
import org.apiwatch.utils.JdbcUtils;
import org.apiwatch.utils.JsonUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL-backed {@link ConfigurationStore}.
 */
public class JdbcConfigurationStore implements ConfigurationStore {

    private static final Logger logger = LoggerFactory.getLogger(JdbcConfigurationStore.class);

    private static final String UNIQUE_VIOLATION = "23505";

    private static final String COLUMNS = """
            id, config_id, api_key, name, description, method, base_url, endpoint,
            params::text AS params, headers::text AS headers, additional_params::text AS additional_params,
            is_active, schedule_interval_minutes, start_at, stop_at, next_fire_at, created_at
            """;

    private final DbUtil.ConnectionProvider connections;

    public JdbcConfigurationStore(DbUtil.ConnectionProvider connections) {
        this.connections = connections;
    }

    public JdbcConfigurationStore() {
        this(JdbcUtils::getConnection);
    }

    @Override
    public ApiConfiguration insert(ApiConfiguration c) {
        String sql = """
                INSERT INTO api_configurations
                    (config_id, api_key, name, description, method, base_url, endpoint,
                     params, headers, additional_params, is_active, schedule_interval_minutes,
                     start_at, stop_at, next_fire_at, created_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?::jsonb, ?::jsonb, FALSE, ?, ?, ?, NULL, ?)
                RETURNING id
                """;
        try {
            Optional<Long> id = DbUtil.querySingle(connections, sql, ps -> {
                ps.setLong(1, c.configId());
                ps.setString(2, c.apiKey());
                ps.setString(3, c.name());
                ps.setString(4, c.description());
                ps.setString(5, c.method());
                ps.setString(6, c.baseUrl());
                ps.setString(7, c.endpoint());
                ps.setString(8, JsonUtil.toJson(c.params()));
                ps.setString(9, JsonUtil.toJson(c.headers()));
                ps.setString(10, JsonUtil.toJson(c.additionalParams()));
                ps.setBigDecimal(11, c.intervalMinutes());
                JdbcUtils.setInstant(ps, 12, c.startAt());
                JdbcUtils.setInstant(ps, 13, c.stopAt());
                JdbcUtils.setInstant(ps, 14, c.createdAt());
            }, rs -> rs.getLong("id"));
            long storedId = id.orElseThrow(() -> new StoreException("Insert returned no id"));
            return new ApiConfiguration(storedId, c.configId(), c.apiKey(), c.name(), c.description(), c.method(),
                    c.baseUrl(), c.endpoint(), c.params(), c.headers(), c.additionalParams(), false,
                    c.intervalMinutes(), c.startAt(), c.stopAt(), null, c.createdAt());
        } catch (SQLException e) {
            if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
                throw new DuplicateConfigIdException(c.configId(), e);
            }
            throw new StoreException("Failed to insert configuration " + c.configId(), e);
        }
    }

    @Override
    public Optional<ApiConfiguration> findByConfigId(long configId) {
        String sql = "SELECT " + COLUMNS + " FROM api_configurations WHERE config_id = ?";
        try {
            return DbUtil.querySingle(connections, sql, ps -> ps.setLong(1, configId), JdbcConfigurationStore::map);
        } catch (SQLException e) {
            throw new StoreException("Failed to load configuration " + configId, e);
        }
    }

    @Override
    public List<ApiConfiguration> findActive() {
        String sql = "SELECT " + COLUMNS + " FROM api_configurations WHERE is_active = TRUE ORDER BY config_id";
        try {
            return DbUtil.queryList(connections, sql, ps -> {}, JdbcConfigurationStore::map);
        } catch (SQLException e) {
            throw new StoreException("Failed to load active configurations", e);
        }
    }

    @Override
    public boolean activate(long configId, Instant nextFireAt) {
        String sql = """
                UPDATE api_configurations
                SET is_active = TRUE, next_fire_at = ?
                WHERE config_id = ? AND is_active = FALSE
                """;
        try {
            return DbUtil.update(connections, sql, ps -> {
                JdbcUtils.setInstant(ps, 1, nextFireAt);
                ps.setLong(2, configId);
            }) == 1;
        } catch (SQLException e) {
            throw new StoreException("Failed to activate configuration " + configId, e);
        }
    }

    @Override
    public boolean deactivate(long configId) {
        String sql = "UPDATE api_configurations SET is_active = FALSE, next_fire_at = NULL WHERE config_id = ?";
        try {
            return DbUtil.update(connections, sql, ps -> ps.setLong(1, configId)) == 1;
        } catch (SQLException e) {
            throw new StoreException("Failed to deactivate configuration " + configId, e);
        }
    }

    @Override
    public boolean compareAndSetNextFire(long configId, Instant expected, Instant next) {
        String sql = """
                UPDATE api_configurations
                SET next_fire_at = ?
                WHERE config_id = ?
                  AND is_active = TRUE
                  AND next_fire_at IS NOT DISTINCT FROM ?::timestamptz
                """;
        try {
            return DbUtil.update(connections, sql, ps -> {
                JdbcUtils.setInstant(ps, 1, next);
                ps.setLong(2, configId);
                JdbcUtils.setInstant(ps, 3, expected);
            }) == 1;
        } catch (SQLException e) {
            throw new StoreException("Failed to move next fire time of configuration " + configId, e);
        }
    }

    @Override
    public int deleteIdleSince(Instant cutoff) {
        String sql = """
                DELETE FROM api_configurations c
                WHERE COALESCE(
                        (SELECT MAX(r.called_at) FROM api_call_results r WHERE r.config_id = c.config_id),
                        c.created_at) < ?
                """;
        try {
            int deleted = DbUtil.update(connections, sql, ps -> JdbcUtils.setInstant(ps, 1, cutoff));
            logger.debug("Deleted {} configurations idle since {}", deleted, cutoff);
            return deleted;
        } catch (SQLException e) {
            throw new StoreException("Failed to delete idle configurations", e);
        }
    }

    private static ApiConfiguration map(ResultSet rs) throws SQLException {
        return new ApiConfiguration(
                rs.getLong("id"),
                rs.getLong("config_id"),
                rs.getString("api_key"),
                rs.getString("name"),
                rs.getString("description"),
                rs.getString("method"),
                rs.getString("base_url"),
                rs.getString("endpoint"),
                JsonUtil.toMap(rs.getString("params")),
                JsonUtil.toMap(rs.getString("headers")),
                JsonUtil.toMap(rs.getString("additional_params")),
                rs.getBoolean("is_active"),
                rs.getBigDecimal("schedule_interval_minutes"),
                JdbcUtils.getInstant(rs, "start_at"),
                JdbcUtils.getInstant(rs, "stop_at"),
                JdbcUtils.getInstant(rs, "next_fire_at"),
                JdbcUtils.getInstant(rs, "created_at")
        );
    }
}
