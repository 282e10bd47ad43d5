package com.careinsight.careinsight.imports;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

public final class ImportModels {

    private ImportModels() {
    }

    public record PreviewResponse(
            String token,
            String filename,
            int totalRows,
            List<String> sourceColumns,
            List<String> expectedColumns,
            List<String> missingInSource,
            List<String> missingInDestination,
            Map<String, String> sourceToExpectedMap,
            Map<String, String> expectedToDestinationMap,
            boolean canImport,
            List<Map<String, String>> previewRows
    ) {
    }

    public record CommitRequest(String token, String mode) {
    }

    public record CommitResponse(String mode, int inserted, int totalRowsInFile) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ErrorResponse(
            boolean ok,
            String error,
            List<String> missingInSource,
            List<String> missingInDestination
    ) {

        public ErrorResponse(String error) {
            this(false, error, null, null);
        }
    }
}
