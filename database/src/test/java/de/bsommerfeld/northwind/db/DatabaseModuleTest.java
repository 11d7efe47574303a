package de.bsommerfeld.northwind.db;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.ProvisionException;
import de.bsommerfeld.northwind.core.config.DatabaseConfig;
import de.bsommerfeld.northwind.core.domain.Employee;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class DatabaseModuleTest {

    @TempDir
    Path tempDir;

    @Test
    void injector_shouldProvideWorkingRepository() {
        Injector injector = Guice.createInjector(new DatabaseModule(config(true)));

        EmployeeRepository repository = injector.getInstance(EmployeeRepository.class);
        long id = repository.addEmployee(new Employee("Nancy", "Davolio", "Sales Representative"));

        assertEquals("Davolio", repository.getEmployee(id).lastName());
    }

    @Test
    void injector_shouldReturnSingletonRepository() {
        Injector injector = Guice.createInjector(new DatabaseModule(config(true)));

        assertSame(injector.getInstance(EmployeeRepository.class),
                injector.getInstance(EmployeeRepository.class));
    }

    @Test
    void injector_shouldBindDriverManagerFactory() {
        Injector injector = Guice.createInjector(new DatabaseModule(config(false)));

        assertInstanceOf(DriverManagerConnectionFactory.class, injector.getInstance(ConnectionFactory.class));
    }

    @Test
    void injector_shouldSkipSchemaWhenDisabled() {
        Injector injector = Guice.createInjector(new DatabaseModule(config(false)));

        EmployeeRepository repository = injector.getInstance(EmployeeRepository.class);

        assertThrows(PersistenceException.class, repository::listEmployees);
    }

    @Test
    void injector_shouldFailFastOnBlankUrl() {
        DatabaseConfig config = new DatabaseConfig();
        config.setUrl(" ");
        Injector injector = Guice.createInjector(new DatabaseModule(config));

        ProvisionException e = assertThrows(ProvisionException.class,
                () -> injector.getInstance(EmployeeRepository.class));
        assertTrue(hasCause(e, ConfigurationException.class)
                || e.getErrorMessages().stream().anyMatch(m -> hasCause(m.getCause(), ConfigurationException.class)));
    }

    private DatabaseConfig config(boolean initializeSchema) {
        DatabaseConfig config = new DatabaseConfig();
        config.setUrl("jdbc:sqlite:" + tempDir.resolve("module.db").toAbsolutePath());
        config.setInitializeSchema(initializeSchema);
        return config;
    }

    private static boolean hasCause(Throwable t, Class<? extends Throwable> type) {
        for (Throwable c = t; c != null; c = c.getCause()) {
            if (type.isInstance(c))
                return true;
        }
        return false;
    }
}
