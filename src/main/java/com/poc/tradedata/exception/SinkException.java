package com.poc.tradedata.exception;

import java.util.Map;

public class SinkException extends IngestException {

    public SinkException(Map<String, ?> detail, Throwable cause) {
        super(ErrorCode.DATABASE_ERROR, detail, cause);
    }
}
