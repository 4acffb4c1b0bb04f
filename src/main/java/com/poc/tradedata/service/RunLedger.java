package com.poc.tradedata.service;

/**
 * Lifecycle calls a pipeline makes against the run it is processing.
 */
public interface RunLedger {

    /**
     * Claims the run. Throws {@code DataValidationException} (E2004) when it is already running.
     */
    void start(Long runId);

    void success(Long runId, String resultTableName, int processedCount, String message);

    void fail(Long runId, String message);
}
