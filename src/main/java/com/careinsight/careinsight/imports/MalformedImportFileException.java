package com.careinsight.careinsight.imports;

/**
 * Staged file could not be parsed with either the comma or the tab delimiter.
 */
public class MalformedImportFileException extends ImportRejectedException {

    public MalformedImportFileException(String message) {
        super(message);
    }

    public MalformedImportFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
