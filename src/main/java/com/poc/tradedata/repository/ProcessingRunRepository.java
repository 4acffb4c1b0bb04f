package com.poc.tradedata.repository;

import com.poc.tradedata.entity.JobType;
import com.poc.tradedata.entity.ProcessingRun;
import com.poc.tradedata.entity.RunStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Optional;

public interface ProcessingRunRepository extends JpaRepository<ProcessingRun, Long> {
    Optional<ProcessingRun> findFirstByContentHashAndJobTypeOrderByIdDesc(String contentHash, JobType jobType);

    Page<ProcessingRun> findByStatus(RunStatus status, Pageable pageable);

    Page<ProcessingRun> findByJobType(JobType jobType, Pageable pageable);

    Page<ProcessingRun> findByStatusAndJobType(RunStatus status, JobType jobType, Pageable pageable);

    /**
     * Moves a run to RUNNING unless it already is. Returns 0 when the run is missing or running.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update ProcessingRun r set r.status = :running, r.startedAt = :now, r.endedAt = null,"
            + " r.remark = null, r.updatedAt = :now where r.id = :id and r.status <> :running")
    int markRunning(@Param("id") Long id, @Param("running") RunStatus running, @Param("now") LocalDateTime now);
}
