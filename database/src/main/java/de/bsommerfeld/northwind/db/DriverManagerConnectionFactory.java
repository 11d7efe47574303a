package de.bsommerfeld.northwind.db;

import com.google.inject.Singleton;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * Default {@link ConnectionFactory}: treats the connection string as a JDBC
 * URL and opens a new connection through {@link DriverManager} per call.
 * Drivers on the classpath register themselves through the service loader, so
 * {@code jdbc:sqlite:...} works as soon as sqlite-jdbc is present.
 */
@Singleton
public class DriverManagerConnectionFactory implements ConnectionFactory {

    @Override
    public Connection open(String connectionString) throws SQLException {
        return DriverManager.getConnection(connectionString);
    }
}
