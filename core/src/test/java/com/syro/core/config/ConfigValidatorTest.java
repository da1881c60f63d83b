package com.syro.core.config;

import com.syro.test.TestBase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConfigValidator
 */
class ConfigValidatorTest extends TestBase {

    @TempDir
    File tempDir;

    private ConfigValidator validator;
    private Configuration config;

    @BeforeEach
    void createConfig() {
        validator = new ConfigValidator();
        config = new Configuration();
        config.databasePath = new File(tempDir, "db/commands").getPath();
    }

    private long count(List<ConfigValidator.ValidationError> errors, String severity) {
        return errors.stream().filter(e -> e.severity.equals(severity)).count();
    }

    @Test
    void testDefaultsAreValid() {
        List<ConfigValidator.ValidationError> errors = validator.validate(config);

        assertEquals(0, count(errors, "ERROR"), "Defaults should not produce errors: " + errors);
        assertDoesNotThrow(() -> validator.validateAndReport(config));
    }

    @Test
    void testPrefixProblems() {
        config.defaultPrefix = " ";
        assertEquals(1, count(validator.validate(config), "ERROR"));

        config.defaultPrefix = "a b";
        assertEquals(1, count(validator.validate(config), "ERROR"));

        config.defaultPrefix = "toolong";
        List<ConfigValidator.ValidationError> errors = validator.validate(config);
        assertEquals(0, count(errors, "ERROR"));
        assertEquals(1, count(errors, "WARNING"), "Over-long default prefix is only a warning");
    }

    @Test
    void testNonPositiveCapacitiesAreErrors() {
        config.executionHistoryCapacity = 0;
        config.auditLogCapacity = -1;
        config.maxCooldownEntries = 0;
        config.workerThreads = 0;

        assertEquals(4, count(validator.validate(config), "ERROR"));
        assertThrows(IllegalStateException.class, () -> validator.validateAndReport(config));
    }

    @Test
    void testEmptyCategoriesIsError() {
        config.categories.clear();
        assertEquals(1, count(validator.validate(config), "ERROR"));
    }

    @Test
    void testDisabledDatabaseIsWarning() {
        config.databaseEnabled = false;
        List<ConfigValidator.ValidationError> errors = validator.validate(config);

        assertEquals(0, count(errors, "ERROR"));
        assertEquals(1, count(errors, "WARNING"));
    }
}
