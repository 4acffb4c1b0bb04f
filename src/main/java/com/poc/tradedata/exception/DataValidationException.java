package com.poc.tradedata.exception;

import java.util.Map;

public class DataValidationException extends IngestException {

    public DataValidationException(Map<String, ?> detail) {
        super(ErrorCode.DATA_VALIDATION_ERROR, detail);
    }

    public DataValidationException(ErrorCode errorCode, Map<String, ?> detail) {
        super(errorCode, detail);
    }
}
