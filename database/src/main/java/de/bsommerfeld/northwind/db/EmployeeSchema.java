package de.bsommerfeld.northwind.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Creates the {@code Employees} table from {@code schema.sql}. Every DDL
 * statement uses {@code IF NOT EXISTS}, so applying the script to an existing
 * Northwind database leaves it unchanged.
 */
public final class EmployeeSchema {

    private static final Logger LOG = LoggerFactory.getLogger(EmployeeSchema.class);
    private static final String SCHEMA_RESOURCE = "schema.sql";

    private EmployeeSchema() {
    }

    /**
     * Splits the script on statement-terminating semicolons and runs all
     * statements in one transaction. On failure the transaction is rolled back
     * and the cause is rethrown as {@link PersistenceException}.
     */
    public static void apply(ConnectionSettings settings) {
        String script = SqlLoader.readResource(SCHEMA_RESOURCE);

        try (Connection conn = settings.connectionFactory().open(settings.connectionString())) {
            if (conn == null) {
                throw new ConfigurationException("Can't connect to database.");
            }
            conn.setAutoCommit(false);
            try (Statement stmt = conn.createStatement()) {
                int executed = 0;
                for (String sql : script.split(";\\s*(\\r?\\n|$)")) {
                    if (sql.isBlank())
                        continue;
                    stmt.execute(sql.trim());
                    executed++;
                }
                conn.commit();
                LOG.info("Employees schema applied ({} statements).", executed);
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            LOG.error("Schema application failed", e);
            throw new PersistenceException("Failed to apply the Employees schema.", e);
        }
    }
}
