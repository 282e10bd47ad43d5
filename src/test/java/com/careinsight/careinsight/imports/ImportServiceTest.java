package com.careinsight.careinsight.imports;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Date;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
class ImportServiceTest {

    private static final String HEADER = "PersonID,Start date,End date,M-Risk Factors,Gender,Age,MNA,BMI,Weight";

    @Autowired
    private ImportService importService;

    @Autowired
    private PatientDataTable patientDataTable;

    @Autowired
    private StagedFileStore stagedFileStore;

    @Autowired
    private DestinationLocks destinationLocks;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void resetState() throws IOException {
        for (String backup : backupTables()) {
            jdbcTemplate.execute("DROP TABLE IF EXISTS " + backup);
        }
        jdbcTemplate.execute("DROP TABLE IF EXISTS patient_data");
        patientDataTable.initializeSchema();

        Path uploadDir = stagedFileStore.getUploadDir();
        if (Files.isDirectory(uploadDir)) {
            try (Stream<Path> files = Files.list(uploadDir)) {
                for (Path file : files.toList()) {
                    Files.deleteIfExists(file);
                }
            }
        }
    }

    @Test
    void shouldPreviewWithoutTouchingDestination() {
        ImportModels.PreviewResponse preview = preview(patients("P1", "P2", "P3"));

        assertTrue(preview.canImport());
        assertEquals(3, preview.totalRows());
        assertEquals(ImportConstants.EXPECTED_COLUMNS, preview.expectedColumns());
        assertTrue(preview.missingInSource().isEmpty());
        assertTrue(preview.missingInDestination().isEmpty());
        assertEquals("m_risk_factors", preview.expectedToDestinationMap().get("M-Risk Factors"));
        assertEquals("P1", preview.previewRows().get(0).get("PersonID"));
        assertEquals(0, patientDataTable.countRows());
        assertEquals(1, stagedFileCount());
    }

    @Test
    void shouldMatchPreviewRowCountOnCommit() {
        ImportModels.PreviewResponse preview = preview(patients("P1", "P2", "P3", "P4"));

        ImportModels.CommitResponse commit = importService.commit(preview.token(), ImportMode.APPEND);

        assertEquals(preview.totalRows(), commit.totalRowsInFile());
        assertEquals(4, commit.inserted());
        assertEquals("append", commit.mode());
        assertEquals(0, stagedFileCount());
        assertThrows(InvalidTokenException.class, () -> importService.commit(preview.token(), ImportMode.APPEND));
    }

    @Test
    void shouldAccumulateRowsOnAppend() {
        commit(patients("A1", "A2"), ImportMode.APPEND);

        commit(patients("B1", "B2", "B3"), ImportMode.APPEND);
        assertEquals(5, patientDataTable.countRows());

        commit(patients("B1", "B2", "B3"), ImportMode.APPEND);
        assertEquals(8, patientDataTable.countRows());
    }

    @Test
    void shouldReplaceContentOnOverwriteAndDropBackup() {
        commit(patients("A1", "A2", "A3", "A4"), ImportMode.APPEND);

        ImportModels.CommitResponse response = commit(patients("B1", "B2"), ImportMode.OVERWRITE);

        assertEquals(2, response.inserted());
        assertEquals(List.of("B1", "B2"),
                jdbcTemplate.queryForList("SELECT person_id FROM patient_data ORDER BY person_id", String.class));
        assertTrue(backupTables().isEmpty());
    }

    @Test
    void shouldRestorePriorContentWhenOverwriteFails() {
        recreateWithRequiredPersonId();
        commit(patients("A1", "A2", "A3"), ImportMode.APPEND);
        List<Map<String, Object>> before = allRows();

        // third row has no PersonID; the first batch of two lands before the failure
        ImportModels.PreviewResponse preview = preview(HEADER + "\n"
                + row("B1") + "\n" + row("B2") + "\n" + row("") + "\n" + row("B4") + "\n");
        CommitFailedException failure = assertThrows(CommitFailedException.class,
                () -> importService.commit(preview.token(), ImportMode.OVERWRITE));

        assertTrue(failure.isRestored());
        assertEquals(before, allRows());
        assertTrue(backupTables().isEmpty());
        assertEquals(1, stagedFileCount());
    }

    @Test
    void shouldReportUnrestoredAppendFailure() {
        recreateWithRequiredPersonId();
        commit(patients("A1"), ImportMode.APPEND);

        ImportModels.PreviewResponse preview = preview(HEADER + "\n" + row("") + "\n");
        CommitFailedException failure = assertThrows(CommitFailedException.class,
                () -> importService.commit(preview.token(), ImportMode.APPEND));

        assertFalse(failure.isRestored());
        assertEquals(1, patientDataTable.countRows());
    }

    @Test
    void shouldRejectUnknownTokenWithoutMutation() {
        commit(patients("A1", "A2"), ImportMode.APPEND);

        assertThrows(InvalidTokenException.class,
                () -> importService.commit("0123456789abcdef0123456789abcdef.csv", ImportMode.OVERWRITE));
        assertThrows(InvalidTokenException.class, () -> importService.commit("../../etc/passwd", ImportMode.OVERWRITE));
        assertThrows(InvalidTokenException.class, () -> importService.commit(null, ImportMode.APPEND));
        assertEquals(2, patientDataTable.countRows());
    }

    @Test
    void shouldMapHeaderSpellingVariants() {
        String csv = "person id,START DATE,end_date,m risk factors,gender,AGE,mna,Bmi,weight\n"
                + "P1,2021-05-01,2021-06-01,None known,female,81,22,19.5,55\n";
        ImportModels.PreviewResponse preview = preview(csv);

        assertTrue(preview.canImport());
        assertEquals("START DATE", preview.sourceToExpectedMap().get("Start date"));
        assertEquals("start_date", preview.expectedToDestinationMap().get("Start date"));

        importService.commit(preview.token(), ImportMode.OVERWRITE);
        Date startDate = jdbcTemplate.queryForObject("SELECT start_date FROM patient_data", Date.class);
        assertEquals(LocalDate.of(2021, 5, 1), startDate.toLocalDate());
    }

    @Test
    void shouldRefuseCommitWhenSourceColumnMissing() {
        commit(patients("A1"), ImportMode.APPEND);
        String csv = "PersonID,Start date,End date,Gender,Age,MNA,BMI,Weight\n"
                + "P1,2021-05-01,2021-06-01,female,81,22,19.5,55\n";
        ImportModels.PreviewResponse preview = preview(csv);

        assertFalse(preview.canImport());
        assertEquals(List.of("M-Risk Factors"), preview.missingInSource());

        SchemaMismatchException mismatch = assertThrows(SchemaMismatchException.class,
                () -> importService.commit(preview.token(), ImportMode.OVERWRITE));
        assertEquals(List.of("M-Risk Factors"), mismatch.getMissingInSource());
        assertEquals(1, patientDataTable.countRows());
    }

    @Test
    void shouldRefuseCommitWhenDestinationDrifts() {
        ImportModels.PreviewResponse preview = preview(patients("P1"));
        assertTrue(preview.canImport());

        jdbcTemplate.execute("ALTER TABLE patient_data DROP COLUMN gender");

        SchemaMismatchException mismatch = assertThrows(SchemaMismatchException.class,
                () -> importService.commit(preview.token(), ImportMode.APPEND));
        assertEquals(List.of("Gender"), mismatch.getMissingInDestination());
        assertEquals(0, patientDataTable.countRows());
        assertEquals(1, stagedFileCount());
    }

    @Test
    void shouldDiscardMalformedUpload() {
        assertThrows(MalformedImportFileException.class, () -> preview("a\tb\n1\t2\t3\n"));
        assertEquals(0, stagedFileCount());
    }

    @Test
    void shouldAcceptTabDelimitedFile() {
        String csv = HEADER.replace(',', '\t') + "\n" + row("T1").replace(',', '\t') + "\n";

        ImportModels.PreviewResponse preview = preview(csv);

        assertTrue(preview.canImport());
        assertEquals(1, importService.commit(preview.token(), ImportMode.APPEND).inserted());
    }

    @Test
    void shouldCapPreviewRows() {
        List<String> ids = new ArrayList<>();
        for (int i = 1; i <= 25; i++) {
            ids.add("P" + i);
        }

        ImportModels.PreviewResponse preview = preview(patients(ids.toArray(String[]::new)));

        assertEquals(25, preview.totalRows());
        assertEquals(20, preview.previewRows().size());
    }

    @Test
    void shouldStoreUnparseableCellsAsNull() {
        commit(HEADER + "\nP1,someday,2021-13-40,Falls,male,abc,NaN,,heavy\n", ImportMode.APPEND);

        Map<String, Object> stored = jdbcTemplate.queryForMap("SELECT * FROM patient_data");
        assertEquals("P1", stored.get("person_id"));
        assertNull(stored.get("start_date"));
        assertNull(stored.get("end_date"));
        assertNull(stored.get("age"));
        assertNull(stored.get("mna"));
        assertNull(stored.get("bmi"));
        assertNull(stored.get("weight"));
    }

    @Test
    void shouldSerializeConcurrentOverwrites() throws Exception {
        ImportModels.PreviewResponse small = preview(patients("S1", "S2", "S3"));
        ImportModels.PreviewResponse large = preview(patients("L1", "L2", "L3", "L4", "L5"));

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<ImportModels.CommitResponse> first = executor.submit(
                    () -> importService.commit(small.token(), ImportMode.OVERWRITE));
            Future<ImportModels.CommitResponse> second = executor.submit(
                    () -> importService.commit(large.token(), ImportMode.OVERWRITE));
            first.get();
            second.get();
        } finally {
            executor.shutdownNow();
        }

        long rows = patientDataTable.countRows();
        assertTrue(rows == 3 || rows == 5, "expected one file's rows but found " + rows);
        assertTrue(backupTables().isEmpty());
    }

    @Test
    void shouldConsumeTokenOnceWhenSameCommitIsQueuedTwice() throws Exception {
        ImportModels.PreviewResponse preview = preview(patients("D1", "D2"));
        ReentrantLock lock = destinationLocks.forTable("patient_data");

        ExecutorService executor = Executors.newFixedThreadPool(2);
        List<Future<ImportModels.CommitResponse>> commits = new ArrayList<>();
        lock.lock();
        try {
            for (int i = 0; i < 2; i++) {
                commits.add(executor.submit(() -> importService.commit(preview.token(), ImportMode.APPEND)));
            }
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
            while (lock.getQueueLength() < 2 && System.nanoTime() < deadline) {
                Thread.sleep(10);
            }
            assertEquals(2, lock.getQueueLength());
        } finally {
            lock.unlock();
        }

        int succeeded = 0;
        int rejected = 0;
        try {
            for (Future<ImportModels.CommitResponse> commit : commits) {
                try {
                    assertEquals(2, commit.get(10, TimeUnit.SECONDS).inserted());
                    succeeded++;
                } catch (ExecutionException ex) {
                    assertInstanceOf(InvalidTokenException.class, ex.getCause());
                    rejected++;
                }
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, succeeded);
        assertEquals(1, rejected);
        assertEquals(2, patientDataTable.countRows());
        assertEquals(0, stagedFileCount());
    }

    @Test
    void shouldDiscardUploadWhenDestinationCannotBeInspected() {
        jdbcTemplate.execute("DROP TABLE patient_data");

        assertThrows(DataAccessException.class, () -> preview(patients("P1")));
        assertEquals(0, stagedFileCount());
    }

    private ImportModels.PreviewResponse preview(String csv) {
        return importService.preview("patients.csv",
                new ByteArrayInputStream(csv.getBytes(StandardCharsets.UTF_8)));
    }

    private ImportModels.CommitResponse commit(String csv, ImportMode mode) {
        return importService.commit(preview(csv).token(), mode);
    }

    private String patients(String... ids) {
        StringBuilder csv = new StringBuilder(HEADER).append('\n');
        for (String id : ids) {
            csv.append(row(id)).append('\n');
        }
        return csv.toString();
    }

    private String row(String id) {
        return id + ",2020-01-01,2020-02-01,Diabetes,male,70,24,22.5,70";
    }

    private void recreateWithRequiredPersonId() {
        jdbcTemplate.execute("DROP TABLE patient_data");
        jdbcTemplate.execute("""
                CREATE TABLE patient_data (
                    person_id VARCHAR(255) NOT NULL,
                    start_date DATE,
                    end_date DATE,
                    m_risk_factors VARCHAR(4000),
                    gender VARCHAR(32),
                    age DOUBLE PRECISION,
                    mna DOUBLE PRECISION,
                    bmi DOUBLE PRECISION,
                    weight DOUBLE PRECISION
                )
                """);
    }

    private List<Map<String, Object>> allRows() {
        return jdbcTemplate.queryForList("SELECT * FROM patient_data ORDER BY person_id");
    }

    private List<String> backupTables() {
        return jdbcTemplate.queryForList(
                "SELECT table_name FROM information_schema.tables WHERE LOWER(table_name) LIKE 'patient_data_backup%'",
                String.class);
    }

    private long stagedFileCount() {
        Path uploadDir = stagedFileStore.getUploadDir();
        if (!Files.isDirectory(uploadDir)) {
            return 0;
        }
        try (Stream<Path> files = Files.list(uploadDir)) {
            return files.count();
        } catch (IOException ex) {
            throw new IllegalStateException(ex);
        }
    }
}
