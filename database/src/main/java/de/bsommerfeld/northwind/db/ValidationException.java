package de.bsommerfeld.northwind.db;

/**
 * An argument was rejected before any SQL ran.
 */
public class ValidationException extends EmployeeServiceException {

    public ValidationException(String message) {
        super(message);
    }
}
