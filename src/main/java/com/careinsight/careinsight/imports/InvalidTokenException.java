package com.careinsight.careinsight.imports;

public class InvalidTokenException extends ImportRejectedException {

    public InvalidTokenException() {
        super(ImportConstants.MSG_INVALID_TOKEN);
    }
}
