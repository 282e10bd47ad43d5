package com.careinsight.careinsight.imports;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Two-phase patient CSV import: {@link #preview} stages an upload and reports schema
 * compatibility without touching the destination; {@link #commit} re-validates the staged
 * file against both live schemas and writes it in overwrite or append mode.
 */
@Service
public class ImportService {

    private static final Logger log = LoggerFactory.getLogger(ImportService.class);

    private final StagedFileStore stagedFileStore;
    private final CsvDatasetReader csvDatasetReader;
    private final PatientRowTransformer rowTransformer;
    private final PatientDataTable patientDataTable;
    private final BackupManager backupManager;
    private final DestinationLocks destinationLocks;
    private final ImportProperties importProperties;

    public ImportService(StagedFileStore stagedFileStore,
                         CsvDatasetReader csvDatasetReader,
                         PatientRowTransformer rowTransformer,
                         PatientDataTable patientDataTable,
                         BackupManager backupManager,
                         DestinationLocks destinationLocks,
                         ImportProperties importProperties) {
        this.stagedFileStore = stagedFileStore;
        this.csvDatasetReader = csvDatasetReader;
        this.rowTransformer = rowTransformer;
        this.patientDataTable = patientDataTable;
        this.backupManager = backupManager;
        this.destinationLocks = destinationLocks;
        this.importProperties = importProperties;
    }

    /**
     * Stages the upload under a new token and reports the schema verdict plus a bounded preview.
     */
    public ImportModels.PreviewResponse preview(String originalFilename, InputStream content) {
        if (originalFilename == null || originalFilename.isBlank()) {
            throw new ImportRejectedException(ImportConstants.MSG_NO_FILE);
        }

        String token = stagedFileStore.stage(originalFilename, content);
        StagedDataset dataset;
        Map<String, String> sourceMap;
        Map<String, String> destinationMap;
        try {
            dataset = csvDatasetReader.read(stagedFileStore.resolve(token));
            sourceMap = SchemaNormalizer.buildMapping(ImportConstants.EXPECTED_COLUMNS, dataset.headers());
            destinationMap = SchemaNormalizer.buildMapping(
                    ImportConstants.EXPECTED_COLUMNS, patientDataTable.liveColumns());
        } catch (RuntimeException ex) {
            // the client never receives this token
            stagedFileStore.delete(token);
            throw ex;
        }
        List<String> missingInSource = SchemaNormalizer.missingFields(sourceMap);
        List<String> missingInDestination = SchemaNormalizer.missingFields(destinationMap);
        boolean canImport = missingInSource.isEmpty() && missingInDestination.isEmpty();

        int previewLimit = Math.min(importProperties.getPreviewRowLimit(), ImportConstants.MAX_PREVIEW_ROWS);
        log.info("Previewed {} ({} rows, canImport={}) as {}", originalFilename, dataset.size(), canImport, token);

        return new ImportModels.PreviewResponse(
                token,
                originalFilename,
                dataset.size(),
                dataset.headers(),
                ImportConstants.EXPECTED_COLUMNS,
                missingInSource,
                missingInDestination,
                sourceMap,
                destinationMap,
                canImport,
                dataset.head(previewLimit)
        );
    }

    /**
     * Writes the staged file behind {@code token} into the destination table.
     *
     * @throws InvalidTokenException   when the token has no staged file
     * @throws SchemaMismatchException when either schema lacks an expected field; nothing is mutated
     * @throws CommitFailedException   when the write fails; overwrite mode restores the prior content
     */
    public ImportModels.CommitResponse commit(String token, ImportMode mode) {
        Path stagedFile = stagedFileStore.resolve(token);

        // Re-parse: the file and both schemas may have changed since the preview.
        StagedDataset dataset = csvDatasetReader.read(stagedFile);
        Map<String, String> sourceMap = SchemaNormalizer.buildMapping(ImportConstants.EXPECTED_COLUMNS, dataset.headers());
        List<String> missingInSource = SchemaNormalizer.missingFields(sourceMap);
        if (!missingInSource.isEmpty()) {
            throw new SchemaMismatchException(ImportConstants.MSG_MISSING_IN_SOURCE, missingInSource, List.of());
        }

        String table = patientDataTable.getTableName();
        ReentrantLock lock = destinationLocks.forTable(table);
        lock.lock();
        int inserted;
        try {
            // a concurrent commit of the same token may have consumed it while we waited
            stagedFileStore.resolve(token);

            Map<String, String> destinationMap = SchemaNormalizer.buildMapping(
                    ImportConstants.EXPECTED_COLUMNS, patientDataTable.liveColumns());
            List<String> missingInDestination = SchemaNormalizer.missingFields(destinationMap);
            if (!missingInDestination.isEmpty()) {
                throw new SchemaMismatchException(ImportConstants.MSG_MISSING_IN_DESTINATION.formatted(table),
                        List.of(), missingInDestination);
            }

            List<String> destinationColumns = new ArrayList<>(destinationMap.values());
            List<PatientRow> rows = new ArrayList<>(dataset.size());
            for (Map<String, String> record : dataset.project(sourceMap)) {
                rows.add(rowTransformer.transform(record));
            }

            inserted = mode == ImportMode.OVERWRITE
                    ? overwrite(table, destinationColumns, rows)
                    : append(destinationColumns, rows);
            if (!stagedFileStore.delete(token)) {
                log.warn("Staged file for {} was already gone after commit", token);
            }
        } finally {
            lock.unlock();
        }

        log.info("Committed {} in {} mode: inserted={}, totalRowsInFile={}", token, mode.value(), inserted, dataset.size());
        return new ImportModels.CommitResponse(mode.value(), inserted, dataset.size());
    }

    private int overwrite(String table, List<String> destinationColumns, List<PatientRow> rows) {
        BackupHandle backup;
        try {
            backup = backupManager.snapshot(table);
        } catch (RuntimeException ex) {
            throw new CommitFailedException(ImportConstants.MSG_BACKUP_FAILED.formatted(table, ex.getMessage()), ex, true);
        }

        int inserted;
        try {
            patientDataTable.truncate();
            inserted = patientDataTable.insertAll(destinationColumns, rows);
        } catch (RuntimeException ex) {
            throw rollBack(backup, ex);
        }
        backupManager.discard(backup);
        return inserted;
    }

    private CommitFailedException rollBack(BackupHandle backup, RuntimeException failure) {
        log.error("Overwrite of {} failed, restoring from {}", backup.destinationTable(), backup.backupTable(), failure);
        try {
            backupManager.restore(backup);
        } catch (RuntimeException restoreFailure) {
            failure.addSuppressed(restoreFailure);
            log.error("Restore of {} from {} failed; backup kept", backup.destinationTable(), backup.backupTable(),
                    restoreFailure);
            return new CommitFailedException(
                    ImportConstants.MSG_RESTORE_FAILED.formatted(backup.backupTable(), failure.getMessage()), failure, false);
        }
        backupManager.discard(backup);
        return new CommitFailedException(ImportConstants.MSG_RESTORED.formatted(failure.getMessage()), failure, true);
    }

    private int append(List<String> destinationColumns, List<PatientRow> rows) {
        try {
            return patientDataTable.insertAll(destinationColumns, rows);
        } catch (RuntimeException ex) {
            log.error("Append into {} failed", patientDataTable.getTableName(), ex);
            throw new CommitFailedException(ImportConstants.MSG_APPEND_FAILED.formatted(ex.getMessage()), ex, false);
        }
    }
}
