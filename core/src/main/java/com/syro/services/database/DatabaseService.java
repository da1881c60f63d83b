package com.syro.services.database;

import org.jdbi.v3.core.Jdbi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * DatabaseService - H2 embedded database holding guild prefixes and
 * per-role command permission overrides.
 */
public class DatabaseService {
    private static final Logger logger = LoggerFactory.getLogger(DatabaseService.class);
    private final Jdbi jdbi;
    private final String url;

    public DatabaseService(String jdbcUrl) {
        this.url = jdbcUrl;
        this.jdbi = Jdbi.create(jdbcUrl);
        logger.info("🗄️ Database initialized: {}", jdbcUrl);
        initializeSchema();
    }

    /**
     * File-backed database below the working directory (or at an absolute path).
     */
    public static DatabaseService forPath(String dbPath) {
        File file = new File(dbPath);
        File parent = file.getAbsoluteFile().getParentFile();
        if (parent != null) parent.mkdirs();

        // H2 2.x wants an explicit ./ for relative paths
        String location = file.isAbsolute() ? dbPath : "./" + dbPath;
        String url = "jdbc:h2:" + location +
                ";MODE=MySQL" + // MySQL compatibility mode
                ";DB_CLOSE_DELAY=-1" + // Keep DB open
                ";CACHE_SIZE=8192" +
                ";DATABASE_TO_UPPER=FALSE" + // Case-sensitive names
                ";AUTO_SERVER=TRUE"; // Allow multiple connections
        return new DatabaseService(url);
    }

    /**
     * Private in-memory database, lives until {@link #shutdown()}.
     */
    public static DatabaseService inMemory(String name) {
        return new DatabaseService("jdbc:h2:mem:" + name + ";MODE=MySQL;DB_CLOSE_DELAY=-1;DATABASE_TO_UPPER=FALSE");
    }

    /**
     * Initialize database schema
     */
    private void initializeSchema() {
        jdbi.useHandle(handle -> {
            handle.execute("""
                        CREATE TABLE IF NOT EXISTS guild_settings (
                            guild_id VARCHAR(64) PRIMARY KEY,
                            prefix VARCHAR(16),
                            updated_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        )
                    """);

            handle.execute("""
                        CREATE TABLE IF NOT EXISTS command_permissions (
                            guild_id VARCHAR(64) NOT NULL,
                            command_name VARCHAR(64) NOT NULL,
                            role_id VARCHAR(64) NOT NULL,
                            allowed BOOLEAN NOT NULL,
                            set_by VARCHAR(64),
                            set_at TIMESTAMP,
                            PRIMARY KEY (guild_id, command_name, role_id)
                        )
                    """);

            handle.execute("CREATE INDEX IF NOT EXISTS idx_perm_guild ON command_permissions(guild_id)");

            logger.info("✅ Database schema initialized");
        });
    }

    /**
     * Get JDBI instance for custom queries
     */
    public Jdbi getJdbi() {
        return jdbi;
    }

    public String getUrl() {
        return url;
    }

    public void shutdown() {
        try {
            jdbi.useHandle(handle -> handle.execute("SHUTDOWN"));
        } catch (Exception e) {
            logger.warn("Error shutting down database: {}", e.getMessage());
        }
        logger.info("✅ Database shutdown complete");
    }
}
