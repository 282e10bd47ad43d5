package com.careinsight.careinsight.imports;

/**
 * Base type for import failures the client can correct. Always raised before any
 * destination mutation.
 */
public class ImportRejectedException extends IllegalArgumentException {

    public ImportRejectedException(String message) {
        super(message);
    }

    public ImportRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
