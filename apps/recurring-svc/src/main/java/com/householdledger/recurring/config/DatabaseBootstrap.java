package com.householdledger.recurring.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Optional bootstrap that applies {@code db/schema.sql} when the transaction log table is
 * missing. Enable with environment variable RECURRING_DB_BOOTSTRAP=true.
 */
@Component
public class DatabaseBootstrap {
    private static final Logger log = LoggerFactory.getLogger(DatabaseBootstrap.class);
    static final String SCHEMA_RESOURCE = "db/schema.sql";

    private final DataSource dataSource;
    private final boolean enabled;

    public DatabaseBootstrap(DataSource dataSource, RecurringProperties properties) {
        this.dataSource = dataSource;
        this.enabled = properties.db().bootstrapEnabledFlag();
    }

    @PostConstruct
    void maybeBootstrap() {
        if (!enabled) {
            log.info("DB bootstrap disabled (recurring.db.bootstrap-enabled=false)");
            return;
        }
        try (Connection conn = dataSource.getConnection()) {
            if (transactionLogTableExists(conn)) {
                log.info("DB bootstrap skipped: schema already present (transaction_log table exists)");
                return;
            }
            log.warn("DB bootstrap starting: applying {}", SCHEMA_RESOURCE);
            int applied = 0;
            for (String stmt : splitStatements(loadSchemaSql())) {
                try (Statement s = conn.createStatement()) {
                    s.execute(stmt);
                    applied++;
                } catch (SQLException ex) {
                    // extension creation needs superuser on managed databases
                    if (isExtensionStatement(stmt)) {
                        log.warn("Ignoring extension creation failure: {} -> {}", stmt, ex.getMessage());
                    } else {
                        log.error("Failed executing bootstrap statement: {}", stmt, ex);
                        throw ex;
                    }
                }
            }
            log.info("DB bootstrap completed: {} statements applied", applied);
        } catch (SQLException | IOException e) {
            // application still starts; the error handler reports the missing schema per request
            log.error("DB bootstrap failed (application will continue to start)", e);
        }
    }

    private boolean transactionLogTableExists(Connection conn) {
        try (PreparedStatement ps = conn.prepareStatement(
                "select 1 from information_schema.tables where lower(table_name) = 'transaction_log'")) {
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            log.warn("Could not check for existing tables: {}", e.getMessage());
            return false;
        }
    }

    private String loadSchemaSql() throws IOException {
        ClassPathResource res = new ClassPathResource(SCHEMA_RESOURCE);
        try (BufferedReader br = new BufferedReader(new InputStreamReader(res.getInputStream(), StandardCharsets.UTF_8))) {
            return br.lines()
                    .filter(line -> !line.trim().startsWith("--"))
                    .collect(Collectors.joining("\n"));
        }
    }

    static boolean isExtensionStatement(String stmt) {
        return stmt.toLowerCase(Locale.ROOT).startsWith("create extension");
    }

    static List<String> splitStatements(String sql) {
        // schema.sql has no procedural blocks, so a plain split is enough
        return Arrays.stream(sql.split(";"))
                .map(String::trim)
                .filter(stmt -> !stmt.isEmpty())
                .toList();
    }
}
