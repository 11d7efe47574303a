package de.bsommerfeld.northwind.db;

/**
 * The repository cannot reach its store as configured: missing connection
 * factory, blank connection string, a factory that yields no connection, or
 * a missing SQL resource.
 */
public class ConfigurationException extends EmployeeServiceException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
