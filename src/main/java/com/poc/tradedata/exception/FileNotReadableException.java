package com.poc.tradedata.exception;

import java.util.Map;

/**
 * Missing file (E1001), unsupported extension (E1002) or unreadable content (E1003).
 */
public class FileNotReadableException extends IngestException {

    public FileNotReadableException(ErrorCode errorCode, Map<String, ?> detail) {
        super(errorCode, detail);
    }

    public FileNotReadableException(ErrorCode errorCode, Map<String, ?> detail, Throwable cause) {
        super(errorCode, detail, cause);
    }
}
