package de.bsommerfeld.northwind.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.northwind.core.domain.Employee;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLDataException;
import java.sql.SQLException;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * CRUD access to the Northwind {@code Employees} table.
 *
 * <p>
 * All SQL lives in {@code sql/*.sql} resources loaded via {@link SqlLoader}.
 * Every value, including the id of a lookup, is bound through
 * {@link NamedStatement}; nothing is concatenated into statement text.
 *
 * <h3>Connection strategy</h3>
 * Each public method opens exactly one connection through the configured
 * {@link ConnectionFactory} and closes it before returning, on success and on
 * failure alike. Pooling, if any, is the factory's business.
 *
 * <h3>Errors</h3>
 * <ul>
 * <li>{@link ConfigurationException} if the factory yields no connection</li>
 * <li>{@link ValidationException} for a {@code null} employee or missing
 * names</li>
 * <li>{@link EmployeeNotFoundException} when a lookup or update matches no
 * row</li>
 * <li>{@link PersistenceException} for any {@link SQLException}, with the
 * original as cause</li>
 * </ul>
 * Deleting a missing id is not an error.
 */
@Singleton
public class EmployeeRepository {

    private static final Logger LOG = LoggerFactory.getLogger(EmployeeRepository.class);

    private final ConnectionFactory connectionFactory;
    private final String connectionString;

    @Inject
    public EmployeeRepository(ConnectionSettings settings) {
        if (settings == null) {
            throw new ConfigurationException("Connection settings cannot be null.");
        }
        this.connectionFactory = settings.connectionFactory();
        this.connectionString = settings.connectionString();
    }

    /**
     * @throws ConfigurationException if {@code connectionFactory} is
     *                                {@code null} or {@code connectionString}
     *                                is blank
     */
    public EmployeeRepository(ConnectionFactory connectionFactory, String connectionString) {
        this(new ConnectionSettings(connectionFactory, connectionString));
    }

    Connection openConnection() throws SQLException {
        Connection conn = connectionFactory.open(connectionString);
        if (conn == null) {
            throw new ConfigurationException("Can't connect to database.");
        }
        return conn;
    }

    // =====================================================================
    // Queries
    // =====================================================================

    /**
     * Returns every employee as a summary row ({@code EmployeeID},
     * {@code FirstName}, {@code LastName}, {@code Title}). Order is whatever the
     * store returns.
     */
    public List<Employee> listEmployees() {
        List<Employee> employees = new ArrayList<>();
        try (Connection conn = openConnection();
                NamedStatement ps = NamedStatement.prepare(conn, SqlLoader.load("select-employees"));
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                employees.add(mapSummary(rs));
            }
        } catch (SQLException e) {
            LOG.error("Failed to list employees", e);
            throw new PersistenceException("An error occurred while listing employees.", e);
        }
        LOG.debug("[DB] Listed {} employees.", employees.size());
        return employees;
    }

    /**
     * Returns the employee with the given id, all columns populated.
     *
     * @throws EmployeeNotFoundException if no row has this id
     */
    public Employee getEmployee(long employeeId) {
        try (Connection conn = openConnection();
                NamedStatement ps = NamedStatement.prepare(conn, SqlLoader.load("select-employee"))) {
            ps.setLong("id", employeeId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return mapEmployee(rs);
                }
            }
        } catch (SQLException e) {
            LOG.error("Failed to fetch employee {}", employeeId, e);
            throw new PersistenceException("An error occurred while fetching the employee.", e);
        }
        throw new EmployeeNotFoundException(employeeId);
    }

    // =====================================================================
    // Writes
    // =====================================================================

    /**
     * Inserts first name, last name and title. Other fields are ignored here;
     * use {@link #updateEmployee} afterwards to fill them in.
     *
     * @return the id generated by the store
     * @throws ValidationException if {@code employee} or one of its names is
     *                             {@code null}
     */
    public long addEmployee(Employee employee) {
        validate(employee);

        try (Connection conn = openConnection();
                NamedStatement ps = NamedStatement.prepareReturningKeys(conn, SqlLoader.load("insert-employee"))) {
            ps.setString("firstName", employee.firstName())
                    .setString("lastName", employee.lastName())
                    .setString("title", employee.title());
            ps.executeUpdate();

            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("Insert did not return a generated EmployeeID.");
                }
                long id = keys.getLong(1);
                LOG.debug("[DB] Added employee {}.", id);
                return id;
            }
        } catch (SQLException e) {
            LOG.error("Failed to add employee {} {}", employee.firstName(), employee.lastName(), e);
            throw new PersistenceException("An error occurred while adding the employee.", e);
        }
    }

    /**
     * Deletes the employee with the given id. Completes normally when no such
     * row exists.
     */
    public void removeEmployee(long employeeId) {
        try (Connection conn = openConnection();
                NamedStatement ps = NamedStatement.prepare(conn, SqlLoader.load("delete-employee"))) {
            ps.setLong("id", employeeId);
            int rows = ps.executeUpdate();
            LOG.debug("[DB] Removed employee {} ({} rows).", employeeId, rows);
        } catch (SQLException e) {
            LOG.error("Failed to remove employee {}", employeeId, e);
            throw new PersistenceException("An error occurred while removing the employee.", e);
        }
    }

    /**
     * Overwrites every mutable column of the row identified by
     * {@link Employee#id()}. {@code null} fields are written as SQL
     * {@code NULL}.
     *
     * @throws ValidationException       if {@code employee} or one of its names
     *                                   is {@code null}
     * @throws EmployeeNotFoundException if no row has this id
     */
    public void updateEmployee(Employee employee) {
        validate(employee);

        int rows;
        try (Connection conn = openConnection();
                NamedStatement ps = NamedStatement.prepare(conn, SqlLoader.load("update-employee"))) {
            bindEmployee(ps, employee);
            rows = ps.executeUpdate();
        } catch (SQLException e) {
            LOG.error("Failed to update employee {}", employee.id(), e);
            throw new PersistenceException("An error occurred while updating the employee.", e);
        }

        if (rows == 0) {
            throw new EmployeeNotFoundException(employee.id());
        }
        LOG.debug("[DB] Updated employee {}.", employee.id());
    }

    private static void validate(Employee employee) {
        if (employee == null) {
            throw new ValidationException("Employee cannot be null.");
        }
        if (employee.firstName() == null || employee.lastName() == null) {
            throw new ValidationException("Employee first and last name are required.");
        }
    }

    /** Binds all 17 parameters of {@code update-employee.sql}. */
    private static void bindEmployee(NamedStatement ps, Employee e) throws SQLException {
        ps.setLong("id", e.id())
                .setString("firstName", e.firstName())
                .setString("lastName", e.lastName())
                .setString("title", e.title())
                .setString("titleOfCourtesy", e.titleOfCourtesy())
                .setDate("birthDate", e.birthDate())
                .setDate("hireDate", e.hireDate())
                .setString("address", e.address())
                .setString("city", e.city())
                .setString("region", e.region())
                .setString("postalCode", e.postalCode())
                .setString("country", e.country())
                .setString("homePhone", e.homePhone())
                .setString("extension", e.extension())
                .setString("notes", e.notes())
                .setInteger("reportsTo", e.reportsTo())
                .setString("photoPath", e.photoPath());
    }

    // =====================================================================
    // ResultSet -> Domain Mapping
    // =====================================================================

    private static Employee mapSummary(ResultSet rs) throws SQLException {
        return new Employee(
                rs.getLong("EmployeeID"),
                rs.getString("FirstName"),
                rs.getString("LastName"),
                rs.getString("Title"));
    }

    private static Employee mapEmployee(ResultSet rs) throws SQLException {
        return new Employee(
                rs.getLong("EmployeeID"),
                rs.getString("FirstName"), rs.getString("LastName"),
                rs.getString("Title"), rs.getString("TitleOfCourtesy"),
                readDate(rs, "BirthDate"), readDate(rs, "HireDate"),
                rs.getString("Address"), rs.getString("City"),
                rs.getString("Region"), rs.getString("PostalCode"),
                rs.getString("Country"), rs.getString("HomePhone"),
                rs.getString("Extension"), rs.getString("Notes"),
                readInteger(rs, "ReportsTo"),
                rs.getString("PhotoPath"));
    }

    private static Integer readInteger(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    /**
     * Reads an ISO date column. Only the leading {@code yyyy-MM-dd} part is
     * used, so {@code 1948-12-08 00:00:00.000} from Northwind dumps parses too.
     */
    static LocalDate readDate(ResultSet rs, String column) throws SQLException {
        String raw = rs.getString(column);
        if (raw == null || raw.isBlank())
            return null;
        String date = raw.length() > 10 ? raw.substring(0, 10) : raw;
        try {
            return LocalDate.parse(date);
        } catch (DateTimeParseException e) {
            throw new SQLDataException("Column " + column + " does not hold an ISO date: " + raw, e);
        }
    }
}
