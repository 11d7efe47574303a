package de.bsommerfeld.northwind.db;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Produces a fresh, open JDBC connection for a connection string. The caller
 * owns the returned connection and closes it when the operation ends.
 *
 * <p>
 * Implementations may return {@code null} when they cannot supply a
 * connection; {@link EmployeeRepository} reports that as a
 * {@link ConfigurationException}.
 */
@FunctionalInterface
public interface ConnectionFactory {

    /**
     * @param connectionString driver-specific connection string, usually a
     *                         JDBC URL
     * @return an open connection, or {@code null} if none can be provided
     * @throws SQLException if the driver fails to connect
     */
    Connection open(String connectionString) throws SQLException;
}
