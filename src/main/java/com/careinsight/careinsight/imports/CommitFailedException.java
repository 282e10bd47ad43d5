package com.careinsight.careinsight.imports;

/**
 * Destination mutation failed during commit. {@link #isRestored()} tells whether the
 * destination was put back to its pre-commit content.
 */
public class CommitFailedException extends IllegalStateException {

    private final boolean restored;

    public CommitFailedException(String message, Throwable cause, boolean restored) {
        super(message, cause);
        this.restored = restored;
    }

    public boolean isRestored() {
        return restored;
    }
}
