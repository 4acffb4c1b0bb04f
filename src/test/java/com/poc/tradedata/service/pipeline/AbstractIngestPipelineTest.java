package com.poc.tradedata.service.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.poc.tradedata.entity.JobType;
import com.poc.tradedata.entity.ProcessingRun;
import com.poc.tradedata.exception.DataProcessingException;
import com.poc.tradedata.exception.DataValidationException;
import com.poc.tradedata.exception.ErrorCode;
import com.poc.tradedata.exception.FileNotReadableException;
import com.poc.tradedata.exception.SinkException;
import com.poc.tradedata.exception.SystemFailureException;
import com.poc.tradedata.model.ResultTable;
import com.poc.tradedata.service.RunLedger;
import com.poc.tradedata.service.sink.RecordSink;
import com.poc.tradedata.service.sink.ResultTableCsvWriter;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;

class AbstractIngestPipelineTest {

    @TempDir
    Path tempDir;

    private RunLedger runLedger;
    private RecordSink recordSink;
    private ResultTableCsvWriter csvWriter;
    private ResultTable table;

    @BeforeEach
    void setUp() {
        runLedger = mock(RunLedger.class);
        recordSink = mock(RecordSink.class);
        csvWriter = mock(ResultTableCsvWriter.class);
        table = new ResultTable("customs_table", List.of("a"));
        table.addRow(Map.of("a", 1));
        table.addRow(Map.of("a", 2));
    }

    @Test
    void successfulRunPersistsSnapshotsAndRecordsSuccess() throws Exception {
        ProcessingRun run = PipelineFixtures.run(JobType.CUSTOMS_COUNTRY, tempDir, "country.xlsx");

        ResultTable result = pipeline(table).process(run, true);

        assertThat(result).isSameAs(table);
        InOrder order = inOrder(runLedger, recordSink, csvWriter);
        order.verify(runLedger).start(1L);
        order.verify(recordSink).replaceAll(table);
        order.verify(csvWriter).write(table, "customs_country_data");
        order.verify(runLedger).success(1L, "customs_table", 2, AbstractIngestPipeline.SUCCESS_MESSAGE);
        verify(runLedger, never()).fail(any(), anyString());
    }

    @Test
    void appendModeInserts() throws Exception {
        ProcessingRun run = PipelineFixtures.run(JobType.CUSTOMS_COUNTRY, tempDir, "country.xlsx");

        pipeline(table).process(run, false);

        verify(recordSink).insert(table);
        verify(recordSink, never()).replaceAll(any());
    }

    @Test
    void unsupportedExtensionFailsBeforeTransform() throws Exception {
        ProcessingRun run = PipelineFixtures.run(JobType.CUSTOMS_COUNTRY, tempDir, "country.xls");
        FixedPipeline pipeline = pipeline(table);

        FileNotReadableException ex = catchThrowableOfType(
                () -> pipeline.process(run, true), FileNotReadableException.class);

        assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.FILE_EXTENSION_ERROR);
        assertThat(ex.getDetail()).containsEntry("file_exts_nm", "XLS");
        assertThat(pipeline.transformed).isFalse();
        verify(runLedger).fail(1L, ErrorCode.FILE_EXTENSION_ERROR.getMessage());
    }

    @Test
    void missingFileFails() throws Exception {
        ProcessingRun run = PipelineFixtures.run(JobType.CUSTOMS_COUNTRY, tempDir, "country.xlsx");
        run.setFileName("gone.xlsx");

        FileNotReadableException ex = catchThrowableOfType(
                () -> pipeline(table).process(run, true), FileNotReadableException.class);

        assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.FILE_NOT_FOUND);
        verify(runLedger).fail(1L, ErrorCode.FILE_NOT_FOUND.getMessage());
    }

    @Test
    void transformFailureBecomesProcessingError() throws Exception {
        ProcessingRun run = PipelineFixtures.run(JobType.CUSTOMS_COUNTRY, tempDir, "country.xlsx");
        FixedPipeline pipeline = pipeline(null);

        DataProcessingException ex = catchThrowableOfType(
                () -> pipeline.process(run, true), DataProcessingException.class);

        assertThat(ex.getCause()).isInstanceOf(IllegalStateException.class);
        assertThat(ex.getDetail()).containsEntry("run_id", 1L);
        verify(runLedger).fail(1L, ErrorCode.DATA_PROCESSING_ERROR.getMessage());
        verify(recordSink, never()).replaceAll(any());
    }

    @Test
    void sinkFailureBecomesDatabaseError() throws Exception {
        ProcessingRun run = PipelineFixtures.run(JobType.CUSTOMS_COUNTRY, tempDir, "country.xlsx");
        when(recordSink.replaceAll(table)).thenThrow(new IllegalStateException("connection refused"));

        SinkException ex = catchThrowableOfType(
                () -> pipeline(table).process(run, true), SinkException.class);

        assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.DATABASE_ERROR);
        verify(runLedger).fail(1L, ErrorCode.DATABASE_ERROR.getMessage());
        verify(runLedger, never()).success(any(), anyString(), anyInt(), anyString());
    }

    @Test
    void unexpectedFailureIsSystemError() throws Exception {
        ProcessingRun run = PipelineFixtures.run(JobType.CUSTOMS_COUNTRY, tempDir, "country.xlsx");
        when(csvWriter.write(any(), anyString())).thenThrow(new IOException("disk full"));

        SystemFailureException ex = catchThrowableOfType(
                () -> pipeline(table).process(run, true), SystemFailureException.class);

        assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.SYSTEM_ERROR);
        verify(runLedger).fail(1L, ErrorCode.SYSTEM_ERROR.getMessage());
    }

    @Test
    void runClaimedElsewhereIsNeitherProcessedNorFailed() throws Exception {
        ProcessingRun run = PipelineFixtures.run(JobType.CUSTOMS_COUNTRY, tempDir, "country.xlsx");
        doThrow(new DataValidationException(ErrorCode.RUN_ALREADY_RUNNING, Map.of("run_id", 1L)))
                .when(runLedger).start(1L);
        FixedPipeline pipeline = pipeline(table);

        DataValidationException ex = catchThrowableOfType(
                () -> pipeline.process(run, true), DataValidationException.class);

        assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.RUN_ALREADY_RUNNING);
        assertThat(pipeline.transformed).isFalse();
        verify(runLedger, never()).fail(any(), anyString());
        verify(recordSink, never()).replaceAll(any());
    }

    private FixedPipeline pipeline(ResultTable result) {
        return new FixedPipeline(runLedger, recordSink, csvWriter, result);
    }

    /**
     * Returns a fixed table, or throws when none is given.
     */
    private static class FixedPipeline extends AbstractIngestPipeline {

        private final ResultTable result;
        private boolean transformed;

        FixedPipeline(RunLedger runLedger, RecordSink recordSink, ResultTableCsvWriter csvWriter, ResultTable result) {
            super(runLedger, recordSink, csvWriter);
            this.result = result;
        }

        @Override
        public Set<JobType> supportedJobTypes() {
            return Set.of(JobType.CUSTOMS_COUNTRY);
        }

        @Override
        protected ResultTable transform(ProcessingRun run, Path file) {
            transformed = true;
            if (result == null) {
                throw new IllegalStateException("boom");
            }
            return result;
        }
    }
}
