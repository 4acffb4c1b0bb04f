package com.poc.tradedata.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base of every failure that ends a processing run. The message is the one recorded on the
 * run ledger; the detail map carries context such as the file path or sheet name.
 */
@Getter
public class IngestException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> detail;

    public IngestException(ErrorCode errorCode, Map<String, ?> detail) {
        this(errorCode, detail, null);
    }

    public IngestException(ErrorCode errorCode, Map<String, ?> detail, Throwable cause) {
        super(errorCode.getMessage(), cause);
        this.errorCode = errorCode;
        this.detail = detail == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(detail));
    }

    public String getCode() {
        return errorCode.getCode();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + errorCode.getCode() + "] " + getMessage() + " " + detail;
    }
}
