package com.careinsight.careinsight.imports;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.io.UncheckedIOException;

/**
 * Maps import failures to client (400) or server (500) responses with a uniform body.
 * Only {@link ImportRejectedException} is treated as a client error.
 */
@RestControllerAdvice(assignableTypes = ImportController.class)
public class ImportExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ImportExceptionHandler.class);

    @ExceptionHandler(SchemaMismatchException.class)
    public ResponseEntity<ImportModels.ErrorResponse> handleSchemaMismatch(SchemaMismatchException ex) {
        log.warn("Import rejected: {} source={} destination={}",
                ex.getMessage(), ex.getMissingInSource(), ex.getMissingInDestination());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(new ImportModels.ErrorResponse(
                false, ex.getMessage(), ex.getMissingInSource(), ex.getMissingInDestination()));
    }

    @ExceptionHandler(ImportRejectedException.class)
    public ResponseEntity<ImportModels.ErrorResponse> handleRejected(ImportRejectedException ex) {
        log.warn("Import rejected: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(new ImportModels.ErrorResponse(ex.getMessage()));
    }

    @ExceptionHandler(CommitFailedException.class)
    public ResponseEntity<ImportModels.ErrorResponse> handleCommitFailed(CommitFailedException ex) {
        log.error("Import commit failed (restored={}): {}", ex.isRestored(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(new ImportModels.ErrorResponse(ex.getMessage()));
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ImportModels.ErrorResponse> handleDatabase(DataAccessException ex) {
        log.error("Database error during import", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ImportModels.ErrorResponse("Database error: " + ex.getMostSpecificCause().getMessage()));
    }

    /**
     * Anything else, including an {@link IllegalArgumentException} raised by server-side
     * configuration such as an invalid destination table name.
     */
    @ExceptionHandler({IllegalStateException.class, IllegalArgumentException.class, UncheckedIOException.class})
    public ResponseEntity<ImportModels.ErrorResponse> handleServerError(RuntimeException ex) {
        log.error("Import failed", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(new ImportModels.ErrorResponse(ex.getMessage()));
    }
}
