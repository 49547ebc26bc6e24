package org.apiwatch.config.database;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Applies db/schema.sql. Every statement is idempotent (IF NOT EXISTS).
 */
public final class SchemaInitializer {
    private static final Logger logger = LoggerFactory.getLogger(SchemaInitializer.class);
    private static final String SCHEMA_RESOURCE = "db/schema.sql";

    private SchemaInitializer() {}

    public static void apply(DataSource dataSource) throws SQLException {
        String script = readSchema();
        int executed = 0;
        try (Connection conn = dataSource.getConnection();
             Statement st = conn.createStatement()) {
            for (String statement : script.split(";")) {
                String sql = statement.strip();
                if (sql.isEmpty()) continue;
                st.execute(sql);
                executed++;
            }
        }
        logger.info("Schema applied ({} statements)", executed);
    }

    private static String readSchema() throws SQLException {
        try (InputStream in = SchemaInitializer.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new SQLException("Schema resource missing: " + SCHEMA_RESOURCE);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SQLException("Failed reading " + SCHEMA_RESOURCE, e);
        }
    }
}
