package com.adpilot;

import com.adpilot.config.AdPilotProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.EncodedResource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.jdbc.datasource.init.ScriptUtils;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs the {@code classpath:adpilot/migration/V<n>__<name>.sql} scripts missing from
 * {@code adpilot_schema_migrations}, in version order, each in its own transaction. Nodes starting together on
 * PostgreSQL take turns through an advisory lock.
 */
@Component
@ConditionalOnProperty(prefix = "adpilot.database", name = "skip-create", havingValue = "false", matchIfMissing = true)
public class JobSchemaInitializer implements InitializingBean {

    private static final Logger log = LoggerFactory.getLogger(JobSchemaInitializer.class);
    private static final Pattern SCRIPT_NAME = Pattern.compile("^V(\\d+)__\\w+\\.sql$");
    private static final String SCRIPT_LOCATION = "classpath*:adpilot/migration/V*__*.sql";
    private static final long ADVISORY_LOCK_KEY = 0x4164506974L;

    private final DataSource dataSource;
    private final boolean failOnMigrationError;

    public JobSchemaInitializer(DataSource dataSource, AdPilotProperties properties) {
        this.dataSource = dataSource;
        this.failOnMigrationError = properties.getDatabase().isFailOnMigrationError();
    }

    @Override
    public void afterPropertiesSet() {
        try (Connection connection = dataSource.getConnection()) {
            JdbcTemplate jdbc = new JdbcTemplate(new SingleConnectionDataSource(connection, true));
            boolean locked = isPostgres(connection);
            if (locked) {
                jdbc.execute("SELECT pg_advisory_lock(" + ADVISORY_LOCK_KEY + ")");
            }
            try {
                migrate(connection, jdbc);
            } finally {
                if (locked) {
                    jdbc.execute("SELECT pg_advisory_unlock(" + ADVISORY_LOCK_KEY + ")");
                }
            }
        } catch (Exception e) {
            if (failOnMigrationError) {
                throw new IllegalStateException("AdPilot schema migration failed", e);
            }
            log.error("AdPilot schema migration failed, starting anyway because fail-on-migration-error=false", e);
        }
    }

    private void migrate(Connection connection, JdbcTemplate jdbc) throws IOException, SQLException {
        jdbc.execute("""
                CREATE TABLE IF NOT EXISTS adpilot_schema_migrations (
                    version INT PRIMARY KEY,
                    script VARCHAR(255) NOT NULL,
                    checksum VARCHAR(32) NOT NULL,
                    applied_at TIMESTAMP WITH TIME ZONE NOT NULL DEFAULT CURRENT_TIMESTAMP
                )
                """);
        Map<Integer, String> applied = new HashMap<>();
        jdbc.query("SELECT version, checksum FROM adpilot_schema_migrations",
                (RowCallbackHandler) rs -> applied.put(rs.getInt("version"), rs.getString("checksum")));

        int ran = 0;
        for (Script script : scripts()) {
            String checksum = applied.remove(script.version());
            if (checksum != null) {
                if (!checksum.equals(script.checksum())) {
                    throw new IllegalStateException(script.name() + " was modified after it was applied");
                }
                continue;
            }
            run(connection, jdbc, script);
            ran++;
        }
        if (!applied.isEmpty()) {
            throw new IllegalStateException("Applied migration(s) " + applied.keySet() + " not found on the classpath");
        }
        log.info("AdPilot schema up to date ({} migration(s) applied now)", ran);
    }

    private void run(Connection connection, JdbcTemplate jdbc, Script script) throws SQLException {
        boolean autoCommit = connection.getAutoCommit();
        connection.setAutoCommit(false);
        try {
            ScriptUtils.executeSqlScript(connection, new EncodedResource(script.resource(), StandardCharsets.UTF_8));
            jdbc.update("INSERT INTO adpilot_schema_migrations (version, script, checksum) VALUES (?, ?, ?)",
                    script.version(), script.name(), script.checksum());
            connection.commit();
            log.info("Applied AdPilot migration {}", script.name());
        } catch (RuntimeException | SQLException e) {
            connection.rollback();
            throw e;
        } finally {
            connection.setAutoCommit(autoCommit);
        }
    }

    private List<Script> scripts() throws IOException {
        Resource[] resources = new PathMatchingResourcePatternResolver().getResources(SCRIPT_LOCATION);
        if (resources.length == 0) {
            throw new IllegalStateException("No migration scripts found at " + SCRIPT_LOCATION);
        }
        List<Script> scripts = new ArrayList<>();
        for (Resource resource : resources) {
            Matcher matcher = SCRIPT_NAME.matcher(String.valueOf(resource.getFilename()));
            if (!matcher.matches()) {
                throw new IllegalStateException("Migration script " + resource.getFilename()
                        + " does not match V<n>__<name>.sql");
            }
            try (InputStream in = resource.getInputStream()) {
                scripts.add(new Script(Integer.parseInt(matcher.group(1)), resource.getFilename(), resource,
                        DigestUtils.md5DigestAsHex(in)));
            }
        }
        scripts.sort(Comparator.comparingInt(Script::version));
        for (int i = 1; i < scripts.size(); i++) {
            if (scripts.get(i).version() == scripts.get(i - 1).version()) {
                throw new IllegalStateException("Duplicate migration version V" + scripts.get(i).version());
            }
        }
        return scripts;
    }

    private static boolean isPostgres(Connection connection) throws SQLException {
        return "PostgreSQL".equals(connection.getMetaData().getDatabaseProductName());
    }

    private record Script(int version, String name, Resource resource, String checksum) {
    }
}
