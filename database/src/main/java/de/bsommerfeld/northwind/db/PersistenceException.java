package de.bsommerfeld.northwind.db;

import java.sql.SQLException;

/**
 * Wraps a driver-level {@link SQLException}. The original exception is always
 * available as {@link #getCause()}.
 */
public class PersistenceException extends EmployeeServiceException {

    public PersistenceException(String message, SQLException cause) {
        super(message, cause);
    }

    @Override
    public synchronized SQLException getCause() {
        return (SQLException) super.getCause();
    }
}
