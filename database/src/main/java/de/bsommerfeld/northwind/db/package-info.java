/**
 * Data access for the Northwind {@code Employees} table over plain JDBC.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   caller
 *     │
 *     ▼
 *   EmployeeRepository   ← one connection per call, errors translated
 *     │
 *     ├── SqlLoader → NamedSql        (sql/*.sql, :name placeholders)
 *     ├── NamedStatement              (bind by name, null → setNull)
 *     ▼
 *   ConnectionFactory    ← DriverManager by default, swappable
 * </pre>
 *
 * <h2>SQL File Inventory</h2>
 * <ul>
 * <li>{@code select-employees.sql} – summary rows for the listing</li>
 * <li>{@code select-employee.sql} – all columns of one employee</li>
 * <li>{@code insert-employee.sql} – names and title, key generated</li>
 * <li>{@code update-employee.sql} – all mutable columns by id</li>
 * <li>{@code delete-employee.sql} – one row by id</li>
 * </ul>
 * {@code schema.sql} at the classpath root is applied by
 * {@link de.bsommerfeld.northwind.db.EmployeeSchema}.
 *
 * <h2>Error taxonomy</h2>
 * All exceptions extend
 * {@link de.bsommerfeld.northwind.db.EmployeeServiceException}:
 * {@code ConfigurationException}, {@code ValidationException},
 * {@code EmployeeNotFoundException} and {@code PersistenceException}.
 */
package de.bsommerfeld.northwind.db;
