package com.careinsight.careinsight.imports;

import java.util.List;

/**
 * One or more expected fields have no match in the source file or the destination table.
 */
public class SchemaMismatchException extends ImportRejectedException {

    private final List<String> missingInSource;
    private final List<String> missingInDestination;

    public SchemaMismatchException(String message, List<String> missingInSource, List<String> missingInDestination) {
        super(message);
        this.missingInSource = missingInSource == null ? List.of() : List.copyOf(missingInSource);
        this.missingInDestination = missingInDestination == null ? List.of() : List.copyOf(missingInDestination);
    }

    public List<String> getMissingInSource() {
        return missingInSource;
    }

    public List<String> getMissingInDestination() {
        return missingInDestination;
    }
}
