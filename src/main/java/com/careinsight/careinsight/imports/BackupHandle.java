package com.careinsight.careinsight.imports;

/**
 * Names a backup table and the destination it was copied from.
 */
public record BackupHandle(String destinationTable, String backupTable) {
}
