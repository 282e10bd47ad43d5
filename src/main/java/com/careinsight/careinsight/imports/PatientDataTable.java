package com.careinsight.careinsight.imports;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.ResultSetMetaData;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Destination table for imported patient rows: live column discovery plus the truncate and
 * bulk-insert operations used by commits.
 */
@Component
public class PatientDataTable {

    private static final Logger log = LoggerFactory.getLogger(PatientDataTable.class);

    private static final int[] PARAMETER_TYPES = {
            Types.VARCHAR, Types.DATE, Types.DATE, Types.VARCHAR, Types.VARCHAR,
            Types.DOUBLE, Types.DOUBLE, Types.DOUBLE, Types.DOUBLE
    };

    private final JdbcTemplate jdbcTemplate;
    private final ImportProperties importProperties;

    public PatientDataTable(JdbcTemplate jdbcTemplate, ImportProperties importProperties) {
        this.jdbcTemplate = jdbcTemplate;
        this.importProperties = importProperties;
    }

    /**
     * Creates the destination table at startup when it does not exist yet.
     */
    @PostConstruct
    public void initializeSchema() {
        if (!importProperties.isInitializeDestination()) {
            return;
        }
        jdbcTemplate.execute("""
                CREATE TABLE IF NOT EXISTS __TABLE__ (
                    person_id VARCHAR(255),
                    start_date DATE,
                    end_date DATE,
                    m_risk_factors VARCHAR(4000),
                    gender VARCHAR(32),
                    age DOUBLE PRECISION,
                    mna DOUBLE PRECISION,
                    bmi DOUBLE PRECISION,
                    weight DOUBLE PRECISION
                )
                """.replace("__TABLE__", getTableName()));
    }

    public String getTableName() {
        return TableNames.sanitize(importProperties.getDestinationTable());
    }

    /**
     * Column names as the database currently reports them.
     */
    public List<String> liveColumns() {
        List<String> columns = jdbcTemplate.query(
                ImportConstants.SQL_SELECT_ALL_PREFIX + getTableName() + ImportConstants.SQL_SELECT_SINGLE_ROW_SUFFIX,
                rs -> {
                    ResultSetMetaData meta = rs.getMetaData();
                    List<String> names = new ArrayList<>();
                    for (int i = 1; i <= meta.getColumnCount(); i++) {
                        names.add(meta.getColumnLabel(i));
                    }
                    return names;
                }
        );
        return columns == null ? List.of() : columns;
    }

    public void truncate() {
        jdbcTemplate.execute(ImportConstants.SQL_TRUNCATE_TABLE + getTableName());
    }

    public long countRows() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + getTableName(), Long.class);
        return count == null ? 0 : count;
    }

    /**
     * Inserts all rows in batches, binding {@link PatientRow#toParameters()} to the given
     * destination columns, and returns the number of rows inserted.
     */
    public int insertAll(List<String> destinationColumns, List<PatientRow> rows) {
        if (rows.isEmpty()) {
            return 0;
        }
        if (destinationColumns.size() != PARAMETER_TYPES.length) {
            throw new IllegalArgumentException("Expected " + PARAMETER_TYPES.length
                    + " destination columns but got " + destinationColumns.size());
        }

        String columnSql = destinationColumns.stream()
                .map(TableNames::quoteColumn)
                .collect(Collectors.joining(", "));
        String placeholders = String.join(", ", Collections.nCopies(destinationColumns.size(), "?"));
        String sql = ImportConstants.SQL_INSERT_INTO + getTableName()
                + " (" + columnSql + ") VALUES (" + placeholders + ")";

        int[][] counts = jdbcTemplate.batchUpdate(sql, rows, Math.max(1, importProperties.getInsertBatchSize()),
                (ps, row) -> {
                    Object[] values = row.toParameters();
                    for (int i = 0; i < values.length; i++) {
                        if (values[i] == null) {
                            ps.setNull(i + 1, PARAMETER_TYPES[i]);
                        } else {
                            ps.setObject(i + 1, values[i], PARAMETER_TYPES[i]);
                        }
                    }
                });

        int inserted = 0;
        for (int[] batch : counts) {
            for (int count : batch) {
                inserted += count == Statement.SUCCESS_NO_INFO ? 1 : Math.max(count, 0);
            }
        }
        log.debug("Inserted {} rows into {}", inserted, getTableName());
        return inserted;
    }
}
