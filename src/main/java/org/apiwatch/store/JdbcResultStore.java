package org.apiwatch.store;

import org.apiwatch.utils.DbUtil;
import org.apiwatch.utils.JdbcUtils;
import org.apiwatch.utils.JsonUtil;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.List;
import java.util.Optional;

public class JdbcResultStore implements ResultStore {

    private static final String FOREIGN_KEY_VIOLATION = "23503";
    private static final String DATA_EXCEPTION_CLASS = "22";

    private final DbUtil.ConnectionProvider connections;

    public JdbcResultStore(DbUtil.ConnectionProvider connections) {
        this.connections = connections;
    }

    public JdbcResultStore() {
        this(JdbcUtils::getConnection);
    }

    @Override
    public CallResult insert(CallResult r) {
        String sql = """
                INSERT INTO api_call_results
                    (config_id, response_data, is_successful, error_message, http_status, response_time_ms, called_at)
                VALUES (?, ?::jsonb, ?, ?, ?, ?, ?)
                RETURNING id
                """;
        try {
            Optional<Long> id = DbUtil.querySingle(connections, sql, ps -> {
                ps.setLong(1, r.configId());
                ps.setString(2, r.responseData() == null ? null : JsonUtil.toJson(r.responseData()));
                ps.setBoolean(3, r.successful());
                ps.setString(4, r.errorMessage());
                if (r.httpStatus() == null) ps.setNull(5, Types.INTEGER);
                else ps.setInt(5, r.httpStatus());
                if (r.responseTimeMs() == null) ps.setNull(6, Types.BIGINT);
                else ps.setLong(6, r.responseTimeMs());
                JdbcUtils.setInstant(ps, 7, r.calledAt());
            }, rs -> rs.getLong("id"));
            return new CallResult(id.orElseThrow(() -> new StoreException("Insert returned no id")),
                    r.configId(), r.responseData(), r.successful(), r.errorMessage(),
                    r.httpStatus(), r.responseTimeMs(), r.calledAt());
        } catch (SQLException e) {
            if (FOREIGN_KEY_VIOLATION.equals(e.getSQLState())) {
                throw new ConfigurationGoneException(r.configId(), e);
            }
            if (e.getSQLState() != null && e.getSQLState().startsWith(DATA_EXCEPTION_CLASS)) {
                throw new UnstorablePayloadException("Result of configuration " + r.configId()
                        + " was rejected by the database (" + e.getSQLState() + ")", e);
            }
            throw new StoreException("Failed to record result for configuration " + r.configId(), e);
        }
    }

    @Override
    public List<CallResult> findByConfigId(long configId, int limit) {
        String sql = """
                SELECT id, config_id, response_data::text AS response_data, is_successful, error_message,
                       http_status, response_time_ms, called_at
                FROM api_call_results
                WHERE config_id = ?
                ORDER BY called_at DESC, id DESC
                """ + (limit > 0 ? "LIMIT ?" : "");
        try {
            return DbUtil.queryList(connections, sql, ps -> {
                ps.setLong(1, configId);
                if (limit > 0) ps.setInt(2, limit);
            }, JdbcResultStore::map);
        } catch (SQLException e) {
            throw new StoreException("Failed to load results for configuration " + configId, e);
        }
    }

    @Override
    public ResultStats stats(long configId) {
        String sql = """
                SELECT COUNT(*) AS total,
                       COUNT(*) FILTER (WHERE is_successful) AS successful,
                       MAX(called_at) AS last_called_at
                FROM api_call_results
                WHERE config_id = ?
                """;
        try {
            return DbUtil.querySingle(connections, sql, ps -> ps.setLong(1, configId),
                    rs -> new ResultStats(rs.getLong("total"), rs.getLong("successful"),
                            JdbcUtils.getInstant(rs, "last_called_at")))
                    .orElse(ResultStats.EMPTY);
        } catch (SQLException e) {
            throw new StoreException("Failed to count results for configuration " + configId, e);
        }
    }

    private static CallResult map(ResultSet rs) throws SQLException {
        return new CallResult(
                rs.getLong("id"),
                rs.getLong("config_id"),
                JsonUtil.toNode(rs.getString("response_data")),
                rs.getBoolean("is_successful"),
                rs.getString("error_message"),
                JdbcUtils.getNullableInt(rs, "http_status"),
                JdbcUtils.getNullableLong(rs, "response_time_ms"),
                JdbcUtils.getInstant(rs, "called_at")
        );
    }
}
