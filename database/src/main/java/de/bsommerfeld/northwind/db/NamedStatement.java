package de.bsommerfeld.northwind.db;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * {@link PreparedStatement} that is bound by parameter name instead of by
 * position. A {@code null} value is always bound with
 * {@link PreparedStatement#setNull(int, int)}, so absent fields reach the
 * store as SQL {@code NULL}.
 *
 * <p>
 * Dates travel as ISO-8601 text ({@code yyyy-MM-dd}); SQLite has no native
 * date type and stores them as TEXT.
 */
public final class NamedStatement implements AutoCloseable {

    private final NamedSql sql;
    private final PreparedStatement statement;

    private NamedStatement(NamedSql sql, PreparedStatement statement) {
        this.sql = sql;
        this.statement = statement;
    }

    public static NamedStatement prepare(Connection conn, NamedSql sql) throws SQLException {
        return new NamedStatement(sql, conn.prepareStatement(sql.jdbcSql()));
    }

    /** Prepares an insert whose generated key is read via {@link #getGeneratedKeys()}. */
    public static NamedStatement prepareReturningKeys(Connection conn, NamedSql sql) throws SQLException {
        return new NamedStatement(sql, conn.prepareStatement(sql.jdbcSql(), Statement.RETURN_GENERATED_KEYS));
    }

    public NamedStatement setString(String name, String value) throws SQLException {
        for (int index : indices(name)) {
            if (value == null)
                statement.setNull(index, Types.VARCHAR);
            else
                statement.setString(index, value);
        }
        return this;
    }

    public NamedStatement setLong(String name, long value) throws SQLException {
        for (int index : indices(name))
            statement.setLong(index, value);
        return this;
    }

    public NamedStatement setInteger(String name, Integer value) throws SQLException {
        for (int index : indices(name)) {
            if (value == null)
                statement.setNull(index, Types.INTEGER);
            else
                statement.setInt(index, value);
        }
        return this;
    }

    public NamedStatement setDate(String name, LocalDate value) throws SQLException {
        return setString(name, value == null ? null : value.format(DateTimeFormatter.ISO_LOCAL_DATE));
    }

    public ResultSet executeQuery() throws SQLException {
        return statement.executeQuery();
    }

    /** @return the number of affected rows */
    public int executeUpdate() throws SQLException {
        return statement.executeUpdate();
    }

    public ResultSet getGeneratedKeys() throws SQLException {
        return statement.getGeneratedKeys();
    }

    @Override
    public void close() throws SQLException {
        statement.close();
    }

    private List<Integer> indices(String name) {
        return sql.indicesOf(name);
    }
}
