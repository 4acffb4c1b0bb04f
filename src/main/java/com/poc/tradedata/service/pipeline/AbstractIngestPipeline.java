package com.poc.tradedata.service.pipeline;

import com.poc.tradedata.entity.JobType;
import com.poc.tradedata.entity.ProcessingRun;
import com.poc.tradedata.exception.DataProcessingException;
import com.poc.tradedata.exception.ErrorCode;
import com.poc.tradedata.exception.FileNotReadableException;
import com.poc.tradedata.exception.IngestException;
import com.poc.tradedata.exception.SinkException;
import com.poc.tradedata.exception.SystemFailureException;
import com.poc.tradedata.model.ResultTable;
import com.poc.tradedata.service.RunLedger;
import com.poc.tradedata.service.sink.RecordSink;
import com.poc.tradedata.service.sink.ResultTableCsvWriter;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Shared run lifecycle: start, validate the file, transform, persist, snapshot, success.
 * Every run ends in exactly one ledger call of success or fail.
 */
@Slf4j
public abstract class AbstractIngestPipeline {

    public static final String SUCCESS_MESSAGE = "Data processing completed.";

    static final Set<String> ALLOWED_EXTENSIONS = Set.of("XLSX", "CSV");

    protected final RunLedger runLedger;
    protected final RecordSink recordSink;
    protected final ResultTableCsvWriter csvWriter;

    protected AbstractIngestPipeline(RunLedger runLedger, RecordSink recordSink, ResultTableCsvWriter csvWriter) {
        this.runLedger = runLedger;
        this.recordSink = recordSink;
        this.csvWriter = csvWriter;
    }

    public abstract Set<JobType> supportedJobTypes();

    /**
     * Turns the uploaded file into the rows of the run's result table.
     */
    protected abstract ResultTable transform(ProcessingRun run, Path file) throws Exception;

    public ResultTable process(ProcessingRun run, boolean replaceAll) {
        Long runId = run.getId();
        Path file = Paths.get(run.getFilePath(), run.getFileName());
        Map<String, Object> detail = detail(run, file);

        log.info("[{}] Processing start: {}", run.getJobType(), file);

        // 0. Ledger; a run claimed elsewhere is left untouched
        runLedger.start(runId);

        try {
            // 1. File
            validateFile(run, file);

            // 2. Transform
            ResultTable table;
            try {
                table = transform(run, file);
            } catch (IngestException e) {
                throw e;
            } catch (Exception e) {
                log.error("Data processing error for run {}", runId, e);
                throw new DataProcessingException(detail, e);
            }

            // 3. Persist
            int persisted;
            try {
                persisted = persist(run, table, replaceAll);
            } catch (IngestException e) {
                throw e;
            } catch (Exception e) {
                log.error("Database error for run {}", runId, e);
                throw new SinkException(detail, e);
            }
            log.info("[{}] {} rows persisted to {} (replaceAll={})",
                    run.getJobType(), persisted, table.getTableName(), replaceAll);

            // 4. Snapshot
            csvWriter.write(table, run.getJobType().getSnapshotPrefix());

            // 5. Ledger
            runLedger.success(runId, table.getTableName(), table.size(), SUCCESS_MESSAGE);
            return table;

        } catch (IngestException e) {
            log.error("Processing failed: {} - {}", e.getCode(), e.getMessage());
            runLedger.fail(runId, e.getMessage());
            throw e;
        } catch (Exception e) {
            log.error("Unexpected system error for run {}", runId, e);
            runLedger.fail(runId, ErrorCode.SYSTEM_ERROR.getMessage());
            throw new SystemFailureException(detail, e);
        }
    }

    protected int persist(ProcessingRun run, ResultTable table, boolean replaceAll) {
        return replaceAll ? recordSink.replaceAll(table) : recordSink.insert(table);
    }

    protected void validateFile(ProcessingRun run, Path file) {
        String extension = run.getFileExtension() == null ? "" : run.getFileExtension().toUpperCase(Locale.ROOT);
        if (!ALLOWED_EXTENSIONS.contains(extension)) {
            log.error("Unsupported file extension: {}", file);
            Map<String, Object> detail = detail(run, file);
            detail.put("file_exts_nm", extension);
            throw new FileNotReadableException(ErrorCode.FILE_EXTENSION_ERROR, detail);
        }
        if (!Files.exists(file)) {
            log.error("File does not exist: {}", file);
            throw new FileNotReadableException(ErrorCode.FILE_NOT_FOUND, detail(run, file));
        }
    }

    protected Map<String, Object> detail(ProcessingRun run, Path file) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("run_id", run.getId());
        detail.put("job_type", run.getJobType() == null ? null : run.getJobType().name());
        detail.put("file_path", String.valueOf(file));
        return detail;
    }
}
