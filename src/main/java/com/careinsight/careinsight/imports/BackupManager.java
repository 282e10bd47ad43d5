package com.careinsight.careinsight.imports;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.UUID;

/**
 * Snapshots a destination table before an overwrite and restores it verbatim on failure.
 * On PostgreSQL the backup copies the full column definitions (NOT NULL, defaults,
 * identity) and rows are copied with their identity values. Other databases get a
 * column-type-only copy.
 */
@Component
public class BackupManager {

    private static final Logger log = LoggerFactory.getLogger(BackupManager.class);

    private static final String POSTGRES_PRODUCT = "postgresql";

    private final JdbcTemplate jdbcTemplate;
    private volatile Boolean postgres;

    public BackupManager(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Creates a uniquely named copy of the destination's structure and rows. A partially
     * built copy is dropped before the failure propagates.
     */
    public BackupHandle snapshot(String destinationTable) {
        String destination = TableNames.sanitize(destinationTable);
        String backup = TableNames.sanitize(destination + ImportConstants.BACKUP_TABLE_INFIX
                + UUID.randomUUID().toString().replace("-", "").substring(0, 8));
        BackupHandle handle = new BackupHandle(destination, backup);

        try {
            jdbcTemplate.execute(createBackupSql(destination, backup));
            int copied = jdbcTemplate.update(copyRowsSql(destination, backup));
            log.info("Backed up {} rows of {} into {}", copied, destination, backup);
            return handle;
        } catch (DataAccessException ex) {
            discard(handle);
            throw ex;
        }
    }

    /**
     * Replaces the destination's content with the backup's rows and returns how many were restored.
     */
    public int restore(BackupHandle handle) {
        String destination = TableNames.sanitize(handle.destinationTable());
        String backup = TableNames.sanitize(handle.backupTable());
        jdbcTemplate.execute(ImportConstants.SQL_TRUNCATE_TABLE + destination);
        int restored = jdbcTemplate.update(copyRowsSql(backup, destination));
        log.info("Restored {} rows into {} from {}", restored, destination, backup);
        return restored;
    }

    /**
     * Drops the backup table. Safe to call more than once; failures are only logged.
     */
    public void discard(BackupHandle handle) {
        try {
            jdbcTemplate.execute(ImportConstants.SQL_DROP_TABLE_IF_EXISTS + TableNames.sanitize(handle.backupTable()));
            log.debug("Dropped backup table {}", handle.backupTable());
        } catch (RuntimeException ex) {
            log.warn("Failed to drop backup table {}: {}", handle.backupTable(), ex.getMessage());
        }
    }

    private String createBackupSql(String destination, String backup) {
        if (isPostgres()) {
            return "CREATE TABLE " + backup + " (LIKE " + destination + " INCLUDING ALL)";
        }
        return "CREATE TABLE " + backup + " AS " + ImportConstants.SQL_SELECT_ALL_PREFIX + destination + " WHERE 1 = 0";
    }

    private String copyRowsSql(String from, String to) {
        String overriding = isPostgres() ? "OVERRIDING SYSTEM VALUE " : "";
        return ImportConstants.SQL_INSERT_INTO + to + " " + overriding + ImportConstants.SQL_SELECT_ALL_PREFIX + from;
    }

    private boolean isPostgres() {
        Boolean detected = postgres;
        if (detected == null) {
            String product = jdbcTemplate.execute(
                    (ConnectionCallback<String>) connection -> connection.getMetaData().getDatabaseProductName());
            detected = product != null && product.toLowerCase(Locale.ROOT).contains(POSTGRES_PRODUCT);
            postgres = detected;
        }
        return detected;
    }
}
