package de.bsommerfeld.northwind.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Properties;

/**
 * Connection settings for the Employees store.
 *
 * <p>
 * {@link #load()} resolves each key in this order, first hit wins:
 * <ol>
 * <li>system property, e.g. {@code -Dnorthwind.db.url=...}</li>
 * <li>environment variable, e.g. {@code NORTHWIND_DB_URL}</li>
 * <li>{@code northwind.properties} on the classpath</li>
 * <li>the field default</li>
 * </ol>
 */
public class DatabaseConfig {

    private static final Logger LOG = LoggerFactory.getLogger(DatabaseConfig.class);

    static final String RESOURCE = "northwind.properties";
    static final String URL_KEY = "northwind.db.url";
    static final String INITIALIZE_SCHEMA_KEY = "northwind.db.initialize-schema";

    /** JDBC URL handed to the connection factory. */
    private String url = "jdbc:sqlite:northwind.db";

    /** Create the Employees table on startup if it does not exist. */
    private boolean initializeSchema = false;

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public boolean isInitializeSchema() {
        return initializeSchema;
    }

    public void setInitializeSchema(boolean initializeSchema) {
        this.initializeSchema = initializeSchema;
    }

    /**
     * Builds a configuration from the classpath defaults and any system
     * property or environment overrides.
     */
    public static DatabaseConfig load() {
        Properties defaults = readResource();
        DatabaseConfig config = new DatabaseConfig();

        String url = resolve(URL_KEY, defaults);
        if (url != null) {
            config.setUrl(url);
        }

        String init = resolve(INITIALIZE_SCHEMA_KEY, defaults);
        if (init != null) {
            config.setInitializeSchema(Boolean.parseBoolean(init.trim()));
        }

        LOG.info("Database configured for {}", config.getUrl());
        return config;
    }

    private static String resolve(String key, Properties defaults) {
        String value = System.getProperty(key);
        if (value == null || value.isBlank()) {
            value = System.getenv(toEnvName(key));
        }
        if (value == null || value.isBlank()) {
            value = defaults.getProperty(key);
        }
        return (value == null || value.isBlank()) ? null : value;
    }

    /** {@code northwind.db.initialize-schema} becomes {@code NORTHWIND_DB_INITIALIZE_SCHEMA}. */
    static String toEnvName(String key) {
        return key.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
    }

    private static Properties readResource() {
        Properties props = new Properties();
        try (InputStream in = DatabaseConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                LOG.debug("No {} on classpath, using built-in defaults", RESOURCE);
                return props;
            }
            props.load(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + RESOURCE, e);
        }
        return props;
    }
}
