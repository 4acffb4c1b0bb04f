package com.poc.tradedata.exception;

import java.util.Map;

public class SystemFailureException extends IngestException {

    public SystemFailureException(Map<String, ?> detail, Throwable cause) {
        super(ErrorCode.SYSTEM_ERROR, detail, cause);
    }
}
