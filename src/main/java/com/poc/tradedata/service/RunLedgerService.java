package com.poc.tradedata.service;

import com.poc.tradedata.entity.JobType;
import com.poc.tradedata.entity.ProcessingRun;
import com.poc.tradedata.entity.RunStatus;
import com.poc.tradedata.exception.DataValidationException;
import com.poc.tradedata.exception.ErrorCode;
import com.poc.tradedata.exception.RunNotFoundException;
import com.poc.tradedata.repository.ProcessingRunRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class RunLedgerService implements RunLedger {

    private static final int REMARK_MAX_LENGTH = 4000;

    private final ProcessingRunRepository processingRunRepository;

    @Transactional
    public ProcessingRun register(ProcessingRun run) {
        run.setStatus(RunStatus.PENDING);
        ProcessingRun saved = processingRunRepository.save(run);
        log.info("Registered run {} ({}) for {}", saved.getId(), saved.getJobType(), saved.getFileName());
        return saved;
    }

    @Transactional(readOnly = true)
    public ProcessingRun get(Long runId) {
        return processingRunRepository.findById(runId)
                .orElseThrow(() -> new RunNotFoundException(runId));
    }

    @Transactional(readOnly = true)
    public Optional<ProcessingRun> findLatestByHash(String contentHash, JobType jobType) {
        return processingRunRepository.findFirstByContentHashAndJobTypeOrderByIdDesc(contentHash, jobType);
    }

    @Transactional(readOnly = true)
    public Page<ProcessingRun> page(RunStatus status, JobType jobType, Pageable pageable) {
        if (status != null && jobType != null) {
            return processingRunRepository.findByStatusAndJobType(status, jobType, pageable);
        }
        if (status != null) {
            return processingRunRepository.findByStatus(status, pageable);
        }
        if (jobType != null) {
            return processingRunRepository.findByJobType(jobType, pageable);
        }
        return processingRunRepository.findAll(pageable);
    }

    @Transactional
    public void delete(Long runId) {
        ProcessingRun run = get(runId);
        processingRunRepository.delete(run);
        log.info("Deleted run {}", runId);
    }

    @Override
    @Transactional
    public void start(Long runId) {
        int updated = processingRunRepository.markRunning(runId, RunStatus.RUNNING, LocalDateTime.now());
        if (updated == 0) {
            ProcessingRun run = get(runId);
            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put("run_id", runId);
            detail.put("status", run.getStatus().name());
            throw new DataValidationException(ErrorCode.RUN_ALREADY_RUNNING, detail);
        }
        log.info("Run {} is running", runId);
    }

    @Override
    @Transactional
    public void success(Long runId, String resultTableName, int processedCount, String message) {
        ProcessingRun run = get(runId);
        run.setStatus(RunStatus.SUCCESS);
        run.setEndedAt(LocalDateTime.now());
        run.setResultTableName(resultTableName);
        run.setProcessedCount(processedCount);
        run.setRemark(truncate(message));
        processingRunRepository.save(run);
        log.info("Run {} succeeded: {} rows into {}", runId, processedCount, resultTableName);
    }

    @Override
    @Transactional
    public void fail(Long runId, String message) {
        ProcessingRun run = get(runId);
        run.setStatus(RunStatus.FAILED);
        run.setEndedAt(LocalDateTime.now());
        run.setRemark(truncate(message));
        processingRunRepository.save(run);
        log.warn("Run {} failed: {}", runId, message);
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= REMARK_MAX_LENGTH) return message;
        return message.substring(0, REMARK_MAX_LENGTH);
    }
}
