package de.bsommerfeld.northwind.db;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.northwind.core.config.DatabaseConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Guice wiring for the Employees data-access layer.
 *
 * <p>
 * Binds the {@link DatabaseConfig}, the default {@link ConnectionFactory} and
 * provides the {@link ConnectionSettings} that {@link EmployeeRepository}
 * receives through its injectable constructor. When
 * {@link DatabaseConfig#isInitializeSchema()} is set, the schema is applied
 * once while the settings are first provided.
 */
public class DatabaseModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(DatabaseModule.class);

    private final DatabaseConfig config;

    /** Uses {@link DatabaseConfig#load()}. */
    public DatabaseModule() {
        this(DatabaseConfig.load());
    }

    public DatabaseModule(DatabaseConfig config) {
        this.config = config;
    }

    @Override
    protected void configure() {
        bind(DatabaseConfig.class).toInstance(config);
        bind(ConnectionFactory.class).to(DriverManagerConnectionFactory.class);
    }

    @Provides
    @Singleton
    ConnectionSettings provideConnectionSettings(DatabaseConfig databaseConfig, ConnectionFactory factory) {
        ConnectionSettings settings = new ConnectionSettings(factory, databaseConfig.getUrl());
        if (databaseConfig.isInitializeSchema()) {
            LOG.info("Initializing Employees schema at {}", databaseConfig.getUrl());
            EmployeeSchema.apply(settings);
        }
        return settings;
    }
}
