package org.apiwatch.utils;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * executeQuery / executeUpdate wrappers with connection management.
 * <pre>
 * Optional&lt;Long&gt; id = DbUtil.querySingle(connections,
 *     "SELECT config_id FROM api_configurations WHERE api_key = ?",
 *     ps -&gt; ps.setString(1, key),
 *     rs -&gt; rs.getLong("config_id"));
 *
 * DbUtil.update(connections, "UPDATE api_configurations SET is_active = FALSE WHERE config_id = ?",
 *     ps -&gt; ps.setLong(1, configId));
 * </pre>
 */
public class DbUtil {

    private DbUtil() {}

    public static int update(ConnectionProvider connections, String sql, SqlConsumer<PreparedStatement> paramSetter)
            throws SQLException {
        try (Connection conn = connections.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            paramSetter.accept(ps);
            return ps.executeUpdate();
        }
    }

    public static <T> Optional<T> querySingle(ConnectionProvider connections, String sql,
                                              SqlConsumer<PreparedStatement> paramSetter,
                                              RowMapper<T> mapper) throws SQLException {
        try (Connection conn = connections.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            paramSetter.accept(ps);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.ofNullable(mapper.map(rs)) : Optional.empty();
            }
        }
    }

    public static <T> List<T> queryList(ConnectionProvider connections, String sql,
                                        SqlConsumer<PreparedStatement> paramSetter,
                                        RowMapper<T> mapper) throws SQLException {
        List<T> rows = new ArrayList<>();
        try (Connection conn = connections.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            paramSetter.accept(ps);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    rows.add(mapper.map(rs));
                }
            }
        }
        return rows;
    }

    @FunctionalInterface
    public interface ConnectionProvider {
        Connection getConnection() throws SQLException;
    }

    @FunctionalInterface
    public interface SqlConsumer<T> {
        void accept(T t) throws SQLException;
    }

    @FunctionalInterface
    public interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }
}
