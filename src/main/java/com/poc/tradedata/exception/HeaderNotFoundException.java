package com.poc.tradedata.exception;

import java.util.Map;

public class HeaderNotFoundException extends IngestException {

    public HeaderNotFoundException(String sheetName, Object expectedHeader) {
        super(ErrorCode.FILE_HEADER_NOT_FOUND, Map.of(
                "sheet_name", sheetName == null ? "" : sheetName,
                "expected_header", String.valueOf(expectedHeader)));
    }
}
