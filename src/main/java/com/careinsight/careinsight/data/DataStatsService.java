package com.careinsight.careinsight.data;

import com.careinsight.careinsight.imports.ImportConstants;
import com.careinsight.careinsight.imports.PatientDataTable;
import com.careinsight.careinsight.imports.SchemaNormalizer;
import com.careinsight.careinsight.imports.TableNames;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Row and patient counts for the destination table.
 */
@Service
public class DataStatsService {

    private final JdbcTemplate jdbcTemplate;
    private final PatientDataTable patientDataTable;

    public DataStatsService(JdbcTemplate jdbcTemplate, PatientDataTable patientDataTable) {
        this.jdbcTemplate = jdbcTemplate;
        this.patientDataTable = patientDataTable;
    }

    /**
     * Total rows plus distinct identifiers, ignoring null and whitespace-only values.
     */
    public DataStatsResponse getStats() {
        long totalRows = patientDataTable.countRows();
        String personColumn = SchemaNormalizer.buildMapping(
                List.of(ImportConstants.FIELD_PERSON_ID), patientDataTable.liveColumns()
        ).get(ImportConstants.FIELD_PERSON_ID);
        if (personColumn == null) {
            return new DataStatsResponse(totalRows, 0);
        }

        String quoted = TableNames.quoteColumn(personColumn);
        Long uniquePersons = jdbcTemplate.queryForObject(
                "SELECT COUNT(DISTINCT NULLIF(TRIM(" + quoted + "), '')) FROM " + patientDataTable.getTableName(),
                Long.class
        );
        return new DataStatsResponse(totalRows, uniquePersons == null ? 0 : uniquePersons);
    }
}
