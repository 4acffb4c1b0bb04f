package com.poc.tradedata.service;

import com.poc.tradedata.dto.ProcessResult;
import com.poc.tradedata.entity.JobType;
import com.poc.tradedata.entity.ProcessingRun;
import com.poc.tradedata.entity.RunStatus;
import com.poc.tradedata.exception.DataValidationException;
import com.poc.tradedata.exception.ErrorCode;
import com.poc.tradedata.model.ResultTable;
import com.poc.tradedata.service.pipeline.AbstractIngestPipeline;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Routes a registered run to the pipeline of its job type.
 */
@Slf4j
@Service
public class IngestService {

    private final RunLedgerService runLedgerService;
    private final Map<JobType, AbstractIngestPipeline> pipelines = new EnumMap<>(JobType.class);

    public IngestService(RunLedgerService runLedgerService, List<AbstractIngestPipeline> pipelineBeans) {
        this.runLedgerService = runLedgerService;
        for (AbstractIngestPipeline pipeline : pipelineBeans) {
            for (JobType jobType : pipeline.supportedJobTypes()) {
                AbstractIngestPipeline previous = pipelines.put(jobType, pipeline);
                if (previous != null) {
                    throw new IllegalStateException("Two pipelines handle " + jobType + ": "
                            + previous.getClass().getSimpleName() + ", " + pipeline.getClass().getSimpleName());
                }
            }
        }
        for (JobType jobType : JobType.values()) {
            if (!pipelines.containsKey(jobType)) {
                throw new IllegalStateException("No pipeline handles " + jobType);
            }
        }
    }

    public ProcessResult process(Long runId, boolean replaceAll) {
        ProcessingRun run = runLedgerService.get(runId);
        if (run.getStatus() == RunStatus.RUNNING) {
            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put("run_id", runId);
            detail.put("status", run.getStatus().name());
            throw new DataValidationException(ErrorCode.RUN_ALREADY_RUNNING, detail);
        }

        AbstractIngestPipeline pipeline = pipelines.get(run.getJobType());
        log.info("Run {} dispatched to {}", runId, pipeline.getClass().getSimpleName());
        ResultTable table = pipeline.process(run, replaceAll);
        return new ProcessResult(runId, run.getJobType(), table.getTableName(), table.size());
    }
}
