package com.poc.tradedata.entity;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Ledger entry of one uploaded file and the outcome of processing it.
 */
@Entity
@Table(name = "processing_runs")
@Data
@NoArgsConstructor
public class ProcessingRun {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 40)
    private JobType jobType;

    @Column(nullable = false, length = 300)
    private String fileName;

    @Column(nullable = false, length = 1000)
    private String filePath;

    @Column(length = 10)
    private String fileExtension;

    private Long fileSize;

    @Column(length = 64)
    private String contentHash;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private RunStatus status = RunStatus.PENDING;

    private LocalDateTime startedAt;

    private LocalDateTime endedAt;

    @Column(length = 200)
    private String resultTableName;

    private Integer processedCount;

    @Column(length = 4000)
    private String remark;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    /**
     * "Y" after success, "N" after failure, null while pending or running.
     */
    public String getFinishedFlag() {
        if (status == RunStatus.SUCCESS) return "Y";
        if (status == RunStatus.FAILED) return "N";
        return null;
    }

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
