package com.poc.tradedata.exception;

import java.util.Map;

public class DataProcessingException extends IngestException {

    public DataProcessingException(Map<String, ?> detail) {
        super(ErrorCode.DATA_PROCESSING_ERROR, detail);
    }

    public DataProcessingException(Map<String, ?> detail, Throwable cause) {
        super(ErrorCode.DATA_PROCESSING_ERROR, detail, cause);
    }
}
