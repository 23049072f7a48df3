package com.libauto.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.DigestUtils;
import org.springframework.util.StreamUtils;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies the numbered scripts under {@code libauto/migration/} once each, in
 * version order, recording them in {@code libauto_schema_migrations}. All work
 * happens on one pinned connection so the PostgreSQL advisory lock covers it.
 */
@Component
@ConditionalOnProperty(prefix = "libauto.database", name = "skip-create", havingValue = "false", matchIfMissing = true)
public class LibAutoSchemaInitializer implements InitializingBean {

    private static final Logger log = LoggerFactory.getLogger(LibAutoSchemaInitializer.class);
    static final String MIGRATION_LOCATION = "classpath*:libauto/migration/V*__*.sql";
    private static final Pattern MIGRATION_FILE = Pattern.compile("^V(\\d+)__(\\w[\\w-]*)\\.sql$");
    private static final String HISTORY_TABLE = "libauto_schema_migrations";
    private static final long ADVISORY_LOCK_KEY = 5_873_311_902_440_118_007L;

    private final DataSource dataSource;
    private final boolean failOnMigrationError;

    public LibAutoSchemaInitializer(DataSource dataSource, LibAutoProperties properties) {
        this.dataSource = dataSource;
        this.failOnMigrationError = properties.getDatabase().isFailOnMigrationError();
    }

    @Override
    public void afterPropertiesSet() {
        try {
            migrate();
        } catch (Exception e) {
            if (failOnMigrationError) {
                throw new IllegalStateException("Automation schema migration failed", e);
            }
            log.error("Automation schema migration failed; starting anyway because "
                    + "libauto.database.fail-on-migration-error=false", e);
        }
    }

    private void migrate() throws SQLException, IOException {
        List<Migration> migrations = loadMigrations();
        if (migrations.isEmpty()) {
            throw new IllegalStateException("No migration scripts found at " + MIGRATION_LOCATION);
        }
        try (Connection connection = dataSource.getConnection()) {
            SingleConnectionDataSource pinned = new SingleConnectionDataSource(connection, true);
            JdbcTemplate jdbc = new JdbcTemplate(pinned);
            boolean locked = "PostgreSQL".equalsIgnoreCase(connection.getMetaData().getDatabaseProductName());
            if (locked) {
                jdbc.execute("SELECT pg_advisory_lock(" + ADVISORY_LOCK_KEY + ")");
            }
            try {
                Map<String, String> applied = readHistory(jdbc);
                List<Migration> pending = pendingMigrations(migrations, applied);
                TransactionTemplate transaction = new TransactionTemplate(new DataSourceTransactionManager(pinned));
                for (Migration migration : pending) {
                    apply(migration, pinned, jdbc, transaction);
                }
                log.info("Automation schema at V{}: {} migration(s) applied now, {} before",
                        migrations.get(migrations.size() - 1).version(), pending.size(), applied.size());
            } finally {
                if (locked) {
                    unlock(jdbc);
                }
            }
        }
    }

    private Map<String, String> readHistory(JdbcTemplate jdbc) {
        jdbc.execute("""
                CREATE TABLE IF NOT EXISTS %s (
                    version VARCHAR(64) PRIMARY KEY,
                    description VARCHAR(255) NOT NULL,
                    checksum VARCHAR(64) NOT NULL,
                    installed_on TIMESTAMP WITH TIME ZONE NOT NULL DEFAULT CURRENT_TIMESTAMP,
                    execution_time_ms BIGINT NOT NULL
                )
                """.formatted(HISTORY_TABLE));
        Map<String, String> applied = new HashMap<>();
        jdbc.query("SELECT version, checksum FROM " + HISTORY_TABLE,
                (RowCallbackHandler) rs -> applied.put(rs.getString("version"), rs.getString("checksum")));
        return applied;
    }

    private static List<Migration> pendingMigrations(List<Migration> migrations, Map<String, String> applied) {
        Map<String, Migration> known = new HashMap<>();
        migrations.forEach(migration -> known.put(String.valueOf(migration.version()), migration));
        applied.forEach((version, checksum) -> {
            Migration migration = known.get(version);
            if (migration == null) {
                throw new IllegalStateException("Database has migration V" + version + " that is not on the classpath");
            }
            if (!migration.checksum().equals(checksum)) {
                throw new IllegalStateException("Migration V" + version + " was modified after it was applied");
            }
        });
        return migrations.stream()
                .filter(migration -> !applied.containsKey(String.valueOf(migration.version())))
                .toList();
    }

    private void apply(Migration migration, DataSource pinned, JdbcTemplate jdbc, TransactionTemplate transaction) {
        long started = System.nanoTime();
        try {
            transaction.executeWithoutResult(status -> {
                ResourceDatabasePopulator populator = new ResourceDatabasePopulator(new ByteArrayResource(
                        migration.sql().getBytes(StandardCharsets.UTF_8), migration.fileName()));
                populator.setSqlScriptEncoding(StandardCharsets.UTF_8.name());
                populator.execute(pinned);
                jdbc.update("INSERT INTO " + HISTORY_TABLE
                                + " (version, description, checksum, execution_time_ms) VALUES (?, ?, ?, ?)",
                        String.valueOf(migration.version()), migration.description(), migration.checksum(),
                        Duration.ofNanos(System.nanoTime() - started).toMillis());
            });
        } catch (RuntimeException e) {
            throw new IllegalStateException("Could not apply " + migration.fileName(), e);
        }
        log.info("Applied automation migration V{} ({})", migration.version(), migration.description());
    }

    private void unlock(JdbcTemplate jdbc) {
        try {
            jdbc.execute("SELECT pg_advisory_unlock(" + ADVISORY_LOCK_KEY + ")");
        } catch (DataAccessException e) {
            log.warn("Could not release the schema migration lock", e);
        }
    }

    /**
     * Scripts on the classpath ordered by version number.
     */
    List<Migration> loadMigrations() throws IOException {
        Map<Integer, Migration> byVersion = new TreeMap<>();
        for (Resource resource : new PathMatchingResourcePatternResolver().getResources(MIGRATION_LOCATION)) {
            String fileName = resource.getFilename();
            Matcher matcher = fileName == null ? null : MIGRATION_FILE.matcher(fileName);
            if (matcher == null || !matcher.matches()) {
                throw new IllegalStateException(
                        "Migration file '" + fileName + "' does not match V<number>__<description>.sql");
            }
            byte[] content = StreamUtils.copyToByteArray(resource.getInputStream());
            Migration migration = new Migration(
                    Integer.parseInt(matcher.group(1)),
                    matcher.group(2).replace('_', ' '),
                    fileName,
                    new String(content, StandardCharsets.UTF_8),
                    DigestUtils.md5DigestAsHex(content));
            Migration previous = byVersion.put(migration.version(), migration);
            if (previous != null) {
                throw new IllegalStateException("Migration version V" + migration.version() + " is used by both "
                        + previous.fileName() + " and " + fileName);
            }
        }
        return List.copyOf(byVersion.values());
    }

    record Migration(int version, String description, String fileName, String sql, String checksum) {
    }
}
