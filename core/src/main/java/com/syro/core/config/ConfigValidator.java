package com.syro.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

/**
 * ConfigValidator - Validates configuration on startup.
 * Catches settings the dispatcher cannot run with before any event arrives.
 */
public class ConfigValidator {
    private static final Logger logger = LoggerFactory.getLogger(ConfigValidator.class);

    public static class ValidationError {
        public final String message;
        public final String severity; // ERROR, WARNING

        public ValidationError(String message, String severity) {
            this.message = message;
            this.severity = severity;
        }

        @Override
        public String toString() {
            return "[" + severity + "] " + message;
        }
    }

    /**
     * Validate configuration and return list of errors/warnings
     */
    public List<ValidationError> validate(Configuration config) {
        List<ValidationError> errors = new ArrayList<>();

        validatePrefix(config, errors);
        validateCapacities(config, errors);
        validateCategories(config, errors);
        validateDatabase(config, errors);

        return errors;
    }

    private void validatePrefix(Configuration config, List<ValidationError> errors) {
        if (config.maxPrefixLength <= 0) {
            errors.add(new ValidationError("maxPrefixLength must be positive", "ERROR"));
        }

        String prefix = config.defaultPrefix;
        if (prefix == null || prefix.isBlank()) {
            errors.add(new ValidationError("defaultPrefix is empty - no message could ever match", "ERROR"));
            return;
        }
        if (prefix.chars().anyMatch(Character::isWhitespace)) {
            errors.add(new ValidationError("defaultPrefix contains whitespace: '" + prefix + "'", "ERROR"));
        }
        if (config.maxPrefixLength > 0 && prefix.length() > config.maxPrefixLength) {
            errors.add(new ValidationError(
                    String.format("defaultPrefix '%s' is longer than maxPrefixLength (%d)", prefix,
                            config.maxPrefixLength),
                    "WARNING"));
        }
    }

    private void validateCapacities(Configuration config, List<ValidationError> errors) {
        if (config.executionHistoryCapacity <= 0) {
            errors.add(new ValidationError("executionHistoryCapacity must be positive", "ERROR"));
        }
        if (config.auditLogCapacity <= 0) {
            errors.add(new ValidationError("auditLogCapacity must be positive", "ERROR"));
        }
        if (config.maxCooldownEntries <= 0) {
            errors.add(new ValidationError("maxCooldownEntries must be positive", "ERROR"));
        }
        if (config.workerThreads <= 0) {
            errors.add(new ValidationError("workerThreads must be positive", "ERROR"));
        } else if (config.workerThreads > 64) {
            errors.add(new ValidationError(
                    "workerThreads=" + config.workerThreads + " is unusually high for a single process",
                    "WARNING"));
        }
    }

    private void validateCategories(Configuration config, List<ValidationError> errors) {
        if (config.categories == null || config.categories.isEmpty()) {
            errors.add(new ValidationError("No command categories configured - every registration will be rejected",
                    "ERROR"));
        }
    }

    private void validateDatabase(Configuration config, List<ValidationError> errors) {
        if (!config.databaseEnabled) {
            errors.add(new ValidationError(
                    "Database disabled - permission overrides and prefixes are kept in memory only",
                    "WARNING"));
            return;
        }
        if (config.databasePath == null || config.databasePath.isBlank()) {
            errors.add(new ValidationError("databaseEnabled but no databasePath configured", "ERROR"));
            return;
        }

        File parent = new File(config.databasePath).getAbsoluteFile().getParentFile();
        if (parent != null && !parent.exists() && !parent.mkdirs()) {
            errors.add(new ValidationError("Cannot create database directory: " + parent, "ERROR"));
        }
    }

    /**
     * Validate and report errors to logger.
     * Throws IllegalStateException if critical errors found.
     */
    public void validateAndReport(Configuration config) {
        List<ValidationError> errors = validate(config);

        int errorCount = 0;
        int warningCount = 0;

        for (ValidationError error : errors) {
            if (error.severity.equals("ERROR")) {
                logger.error("❌ Config Error: {}", error.message);
                errorCount++;
            } else {
                logger.warn("⚠️ Config Warning: {}", error.message);
                warningCount++;
            }
        }

        if (errorCount > 0 || warningCount > 0) {
            logger.warn("📋 Configuration validation: {} errors, {} warnings", errorCount, warningCount);
        } else {
            logger.info("✅ Configuration validation passed");
        }

        if (errorCount > 0) {
            throw new IllegalStateException(
                    String.format("Configuration validation failed with %d error(s). Fix config and restart.",
                            errorCount));
        }
    }
}
