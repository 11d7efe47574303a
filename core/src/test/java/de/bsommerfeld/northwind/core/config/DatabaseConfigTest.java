package de.bsommerfeld.northwind.core.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DatabaseConfigTest {

    @AfterEach
    void clearOverrides() {
        System.clearProperty(DatabaseConfig.URL_KEY);
        System.clearProperty(DatabaseConfig.INITIALIZE_SCHEMA_KEY);
    }

    @Test
    void newConfig_shouldHaveSqliteDefaults() {
        var config = new DatabaseConfig();

        assertEquals("jdbc:sqlite:northwind.db", config.getUrl());
        assertFalse(config.isInitializeSchema());
    }

    @Test
    void load_shouldReadClasspathDefaults() {
        // Environment may override; only assert when it does not.
        if (System.getenv("NORTHWIND_DB_URL") != null)
            return;

        var config = DatabaseConfig.load();
        assertEquals("jdbc:sqlite:northwind.db", config.getUrl());
    }

    @Test
    void load_shouldPreferSystemProperty() {
        System.setProperty(DatabaseConfig.URL_KEY, "jdbc:sqlite:/tmp/override.db");
        System.setProperty(DatabaseConfig.INITIALIZE_SCHEMA_KEY, "true");

        var config = DatabaseConfig.load();

        assertEquals("jdbc:sqlite:/tmp/override.db", config.getUrl());
        assertTrue(config.isInitializeSchema());
    }

    @Test
    void load_shouldIgnoreBlankSystemProperty() {
        if (System.getenv("NORTHWIND_DB_URL") != null)
            return;
        System.setProperty(DatabaseConfig.URL_KEY, "   ");

        assertEquals("jdbc:sqlite:northwind.db", DatabaseConfig.load().getUrl());
    }

    @Test
    void toEnvName_shouldUppercaseAndReplaceSeparators() {
        assertEquals("NORTHWIND_DB_URL", DatabaseConfig.toEnvName("northwind.db.url"));
        assertEquals("NORTHWIND_DB_INITIALIZE_SCHEMA",
                DatabaseConfig.toEnvName("northwind.db.initialize-schema"));
    }

    @Test
    void setters_shouldOverrideDefaults() {
        var config = new DatabaseConfig();
        config.setUrl("jdbc:sqlite::memory:");
        config.setInitializeSchema(true);

        assertEquals("jdbc:sqlite::memory:", config.getUrl());
        assertTrue(config.isInitializeSchema());
    }
}
