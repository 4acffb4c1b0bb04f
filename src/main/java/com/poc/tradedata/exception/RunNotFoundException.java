package com.poc.tradedata.exception;

import java.util.Map;

public class RunNotFoundException extends IngestException {

    public RunNotFoundException(Long runId) {
        super(ErrorCode.RUN_NOT_FOUND, Map.of("run_id", String.valueOf(runId)));
    }
}
