package com.poc.tradedata.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    // file (1000)
    FILE_NOT_FOUND("E1001", "File not found."),
    FILE_EXTENSION_ERROR("E1002", "Unsupported file extension."),
    FILE_READ_ERROR("E1003", "Failed to read the file."),
    FILE_HEADER_NOT_FOUND("E1004", "Header row not found in the file."),

    // data (2000)
    DATA_PROCESSING_ERROR("E2001", "Data processing failed."),
    DATA_VALIDATION_ERROR("E2002", "Data validation failed."),
    RUN_ALREADY_RUNNING("E2004", "The run is already in progress."),

    // database (3000)
    DATABASE_ERROR("E3001", "Database operation failed."),

    // request (4000)
    INVALID_REQUEST_PARAMETER("E4001", "Invalid request parameter."),

    // lookup (5000)
    RUN_NOT_FOUND("E5001", "Processing run not found."),

    // system (9000)
    SYSTEM_ERROR("E9001", "A system error occurred.");

    private final String code;
    private final String message;
}
