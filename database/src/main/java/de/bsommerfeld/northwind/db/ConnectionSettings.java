package de.bsommerfeld.northwind.db;

/**
 * Everything {@link EmployeeRepository} needs to reach its store. Both values
 * are checked on construction so that a misconfigured repository fails when
 * it is built rather than on its first call.
 *
 * @param connectionFactory opens one connection per repository call
 * @param connectionString  passed verbatim to the factory
 */
public record ConnectionSettings(ConnectionFactory connectionFactory, String connectionString) {

    public ConnectionSettings {
        if (connectionFactory == null) {
            throw new ConfigurationException("Connection factory cannot be null.");
        }
        if (connectionString == null || connectionString.isBlank()) {
            throw new ConfigurationException(
                    "Connection string cannot be empty or contain only white-space characters.");
        }
    }

    /** Omits the connection string, which may carry credentials. */
    @Override
    public String toString() {
        return "ConnectionSettings[connectionFactory=" + connectionFactory.getClass().getSimpleName() + "]";
    }
}
