package de.bsommerfeld.northwind.db;

/**
 * No row exists for the requested {@code EmployeeID}.
 */
public class EmployeeNotFoundException extends EmployeeServiceException {

    private final long employeeId;

    public EmployeeNotFoundException(long employeeId) {
        super("Employee with ID " + employeeId + " not found.");
        this.employeeId = employeeId;
    }

    public long getEmployeeId() {
        return employeeId;
    }
}
