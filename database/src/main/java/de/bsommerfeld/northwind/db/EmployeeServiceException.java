package de.bsommerfeld.northwind.db;

/**
 * Base type of every error raised by {@link EmployeeRepository}. Callers that
 * do not care about the concrete failure can catch this type alone.
 */
public class EmployeeServiceException extends RuntimeException {

    public EmployeeServiceException(String message) {
        super(message);
    }

    public EmployeeServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
