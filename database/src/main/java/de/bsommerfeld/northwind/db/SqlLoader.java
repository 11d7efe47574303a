package de.bsommerfeld.northwind.db;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads SQL statements from classpath resources under {@code sql/} and parses
 * their {@code :name} placeholders once.
 *
 * <p>
 * The naming convention is {@code sql/<operation>-<entity>.sql}, e.g.
 * {@code select-employee.sql}. Each file is read on first use and cached for
 * the lifetime of the JVM.
 *
 * @see NamedSql
 */
public final class SqlLoader {

    private static final ConcurrentHashMap<String, NamedSql> CACHE = new ConcurrentHashMap<>();

    private SqlLoader() {
    }

    /**
     * Returns the parsed statement from {@code sql/<name>.sql}.
     *
     * @param name the file stem without path prefix or extension
     * @throws ConfigurationException if the resource is missing or unreadable
     */
    public static NamedSql load(String name) {
        return CACHE.computeIfAbsent(name, n -> NamedSql.parse(readResource("sql/" + n + ".sql")));
    }

    /**
     * Reads a classpath resource as trimmed UTF-8 text without caching. Used
     * for scripts such as {@code schema.sql} that run once.
     *
     * @throws ConfigurationException if the resource is missing or unreadable
     */
    static String readResource(String path) {
        try (InputStream in = SqlLoader.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new ConfigurationException("SQL resource not found: " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read SQL resource: " + path, e);
        }
    }
}
