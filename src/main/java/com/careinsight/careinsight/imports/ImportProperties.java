package com.careinsight.careinsight.imports;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Externalized import configuration bound from {@code application.properties}.
 */
@ConfigurationProperties(prefix = "import")
public class ImportProperties {

    private String uploadDir = ImportConstants.DEFAULT_UPLOAD_DIR;
    private String destinationTable = ImportConstants.DEFAULT_DESTINATION_TABLE;
    private int previewRowLimit = ImportConstants.MAX_PREVIEW_ROWS;
    private int insertBatchSize = ImportConstants.DEFAULT_INSERT_BATCH_SIZE;
    private boolean initializeDestination = true;

    public String getUploadDir() {
        return uploadDir;
    }

    public void setUploadDir(String uploadDir) {
        this.uploadDir = uploadDir;
    }

    public String getDestinationTable() {
        return destinationTable;
    }

    public void setDestinationTable(String destinationTable) {
        this.destinationTable = destinationTable;
    }

    public int getPreviewRowLimit() {
        return previewRowLimit;
    }

    public void setPreviewRowLimit(int previewRowLimit) {
        this.previewRowLimit = previewRowLimit;
    }

    public int getInsertBatchSize() {
        return insertBatchSize;
    }

    public void setInsertBatchSize(int insertBatchSize) {
        this.insertBatchSize = insertBatchSize;
    }

    public boolean isInitializeDestination() {
        return initializeDestination;
    }

    public void setInitializeDestination(boolean initializeDestination) {
        this.initializeDestination = initializeDestination;
    }
}
