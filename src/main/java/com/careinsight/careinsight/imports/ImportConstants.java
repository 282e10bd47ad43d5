package com.careinsight.careinsight.imports;

import java.util.List;
import java.util.Set;

/**
 * Shared constants for the patient CSV import flow.
 */
public final class ImportConstants {

    private ImportConstants() {
    }

    public static final String FIELD_PERSON_ID = "PersonID";
    public static final String FIELD_START_DATE = "Start date";
    public static final String FIELD_END_DATE = "End date";
    public static final String FIELD_RISK_FACTORS = "M-Risk Factors";
    public static final String FIELD_GENDER = "Gender";
    public static final String FIELD_AGE = "Age";
    public static final String FIELD_MNA = "MNA";
    public static final String FIELD_BMI = "BMI";
    public static final String FIELD_WEIGHT = "Weight";

    /**
     * Fields every source file and the destination table must provide, in insert order.
     */
    public static final List<String> EXPECTED_COLUMNS = List.of(
            FIELD_PERSON_ID,
            FIELD_START_DATE,
            FIELD_END_DATE,
            FIELD_RISK_FACTORS,
            FIELD_GENDER,
            FIELD_AGE,
            FIELD_MNA,
            FIELD_BMI,
            FIELD_WEIGHT
    );

    public static final String DEFAULT_UPLOAD_DIR = "data/uploads";
    public static final String DEFAULT_DESTINATION_TABLE = "patient_data";
    public static final int MAX_PREVIEW_ROWS = 20;
    public static final int DEFAULT_INSERT_BATCH_SIZE = 1000;

    public static final String DEFAULT_STAGED_SUFFIX = ".csv";
    public static final String KEEP_FILE_NAME = ".gitkeep";
    public static final String UNNAMED_COLUMN_PREFIX = "Unnamed: ";
    public static final String BACKUP_TABLE_INFIX = "_backup_";

    public static final String MODE_OVERWRITE = "overwrite";
    public static final String MODE_APPEND = "append";

    /**
     * Cell spellings treated as a missing value when reading staged files.
     */
    public static final Set<String> MISSING_VALUE_MARKERS = Set.of(
            "", "#N/A", "#N/A N/A", "#NA", "-1.#IND", "-1.#QNAN", "-NaN", "-nan", "1.#IND", "1.#QNAN",
            "<NA>", "N/A", "NA", "NULL", "NaN", "None", "n/a", "nan", "null"
    );

    public static final String VALID_TABLE_NAME_REGEX = "[a-zA-Z_][a-zA-Z0-9_]*";

    public static final String SQL_SELECT_ALL_PREFIX = "SELECT * FROM ";
    public static final String SQL_SELECT_SINGLE_ROW_SUFFIX = " LIMIT 1";
    public static final String SQL_TRUNCATE_TABLE = "TRUNCATE TABLE ";
    public static final String SQL_DROP_TABLE_IF_EXISTS = "DROP TABLE IF EXISTS ";
    public static final String SQL_INSERT_INTO = "INSERT INTO ";

    public static final String MSG_NO_FILE = "No file provided";
    public static final String MSG_SAVE_FAILED = "Failed to save temp file";
    public static final String MSG_READ_FAILED = "Failed to read staged file: %s";
    public static final String MSG_PARSE_FAILED = "Failed to parse CSV: %s";
    public static final String MSG_FILE_EMPTY = "No columns to parse from file";
    public static final String MSG_NOT_UTF8 = "File is not valid UTF-8 text";
    public static final String MSG_TOO_MANY_FIELDS = "Expected %d fields in line %d, saw %d";
    public static final String MSG_INVALID_TOKEN = "Invalid token or file expired";
    public static final String MSG_INVALID_MODE = "mode must be overwrite or append";
    public static final String MSG_MISSING_IN_SOURCE = "CSV missing required columns";
    public static final String MSG_MISSING_IN_DESTINATION = "Destination table %s missing required columns";
    public static final String MSG_INVALID_TABLE = "Invalid table name: %s";
    public static final String MSG_BACKUP_FAILED = "Import aborted; backup of %s could not be created, destination unchanged: %s";
    public static final String MSG_RESTORED = "Import failed; data restored to pre-import state: %s";
    public static final String MSG_RESTORE_FAILED = "Import failed and restore did not complete; backup table %s was kept: %s";
    public static final String MSG_APPEND_FAILED = "Import failed in append mode; rows inserted before the failure may remain: %s";
}
