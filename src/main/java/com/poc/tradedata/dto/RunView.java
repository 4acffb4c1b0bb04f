package com.poc.tradedata.dto;

import com.poc.tradedata.entity.JobType;
import com.poc.tradedata.entity.ProcessingRun;
import com.poc.tradedata.entity.RunStatus;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Ledger entry as returned by the API.
 */
@Data
public class RunView {
    private Long id;
    private JobType jobType;
    private String fileName;
    private String filePath;
    private String fileExtension;
    private Long fileSize;
    private String contentHash;
    private RunStatus status;
    private String finishedFlag;
    private LocalDateTime startedAt;
    private LocalDateTime endedAt;
    private String resultTableName;
    private Integer processedCount;
    private String remark;
    private LocalDateTime createdAt;

    public static RunView of(ProcessingRun run) {
        RunView view = new RunView();
        view.setId(run.getId());
        view.setJobType(run.getJobType());
        view.setFileName(run.getFileName());
        view.setFilePath(run.getFilePath());
        view.setFileExtension(run.getFileExtension());
        view.setFileSize(run.getFileSize());
        view.setContentHash(run.getContentHash());
        view.setStatus(run.getStatus());
        view.setFinishedFlag(run.getFinishedFlag());
        view.setStartedAt(run.getStartedAt());
        view.setEndedAt(run.getEndedAt());
        view.setResultTableName(run.getResultTableName());
        view.setProcessedCount(run.getProcessedCount());
        view.setRemark(run.getRemark());
        view.setCreatedAt(run.getCreatedAt());
        return view;
    }
}
