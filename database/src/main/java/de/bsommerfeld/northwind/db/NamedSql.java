package de.bsommerfeld.northwind.db;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A SQL statement written with {@code :name} placeholders, together with its
 * JDBC form in which every placeholder has been replaced by {@code ?}.
 *
 * <p>
 * The parser recognises a placeholder as a colon followed by a Java
 * identifier. It leaves alone:
 * <ul>
 * <li>single-quoted string literals and double-quoted identifiers, including
 * doubled quote escapes</li>
 * <li>{@code --} line comments and block comments</li>
 * <li>{@code ::} type casts</li>
 * </ul>
 * A name may appear several times; each occurrence gets its own JDBC index.
 *
 * @param sql        the statement as written
 * @param jdbcSql    the statement with {@code ?} markers, ready for
 *                   {@link java.sql.Connection#prepareStatement(String)}
 * @param parameters 1-based JDBC indices per parameter name, in order of
 *                   first appearance
 */
public record NamedSql(String sql, String jdbcSql, Map<String, List<Integer>> parameters) {

    public NamedSql {
        Map<String, List<Integer>> copy = new LinkedHashMap<>();
        parameters.forEach((name, indices) -> copy.put(name, List.copyOf(indices)));
        parameters = Collections.unmodifiableMap(copy);
    }

    /**
     * Parses {@code sql} and records where each named parameter sits.
     */
    public static NamedSql parse(String sql) {
        int length = sql.length();
        StringBuilder jdbc = new StringBuilder(length);
        Map<String, List<Integer>> parameters = new LinkedHashMap<>();
        int nextIndex = 1;

        int i = 0;
        while (i < length) {
            char c = sql.charAt(i);
            char next = i + 1 < length ? sql.charAt(i + 1) : '\0';

            int end;
            if (c == '\'' || c == '"') {
                end = skipQuoted(sql, i, c);
            } else if (c == '-' && next == '-') {
                int newline = sql.indexOf('\n', i);
                end = newline < 0 ? length : newline;
            } else if (c == '/' && next == '*') {
                int close = sql.indexOf("*/", i + 2);
                end = close < 0 ? length : close + 2;
            } else if (c == ':' && next == ':') {
                end = i + 2;
            } else if (c == ':' && Character.isJavaIdentifierStart(next)) {
                end = i + 2;
                while (end < length && Character.isJavaIdentifierPart(sql.charAt(end)))
                    end++;
                String name = sql.substring(i + 1, end);
                parameters.computeIfAbsent(name, k -> new ArrayList<>()).add(nextIndex++);
                jdbc.append('?');
                i = end;
                continue;
            } else {
                end = i + 1;
            }
            jdbc.append(sql, i, end);
            i = end;
        }
        return new NamedSql(sql, jdbc.toString(), parameters);
    }

    /** Returns the index just past the closing quote, or the end of input. */
    private static int skipQuoted(String sql, int start, char quote) {
        int i = start + 1;
        while (i < sql.length()) {
            if (sql.charAt(i) == quote) {
                if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return sql.length();
    }

    /** Distinct parameter names, in order of first appearance. */
    public Set<String> parameterNames() {
        return parameters.keySet();
    }

    /** Total number of {@code ?} markers in {@link #jdbcSql()}. */
    public int markerCount() {
        return parameters.values().stream().mapToInt(List::size).sum();
    }

    /**
     * Returns the JDBC indices bound to {@code name}.
     *
     * @throws IllegalArgumentException if the statement has no such parameter
     */
    public List<Integer> indicesOf(String name) {
        List<Integer> indices = parameters.get(name);
        if (indices == null) {
            throw new IllegalArgumentException("Unknown parameter ':" + name + "' in: " + sql);
        }
        return indices;
    }
}
