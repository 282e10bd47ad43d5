package com.careinsight.careinsight.imports;

public class InvalidModeException extends ImportRejectedException {

    private final String requestedMode;

    public InvalidModeException(String requestedMode) {
        super(ImportConstants.MSG_INVALID_MODE);
        this.requestedMode = requestedMode;
    }

    public String getRequestedMode() {
        return requestedMode;
    }
}
