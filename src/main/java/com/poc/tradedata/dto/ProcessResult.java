package com.poc.tradedata.dto;

import com.poc.tradedata.entity.JobType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProcessResult {
    private Long runId;
    private JobType jobType;
    private String resultTable;
    private int processedCount;
}
