package com.poc.tradedata.controller;

import com.poc.tradedata.dto.ApiResponse;
import com.poc.tradedata.dto.ProcessResult;
import com.poc.tradedata.dto.RunView;
import com.poc.tradedata.entity.JobType;
import com.poc.tradedata.entity.ProcessingRun;
import com.poc.tradedata.entity.RunStatus;
import com.poc.tradedata.exception.ErrorCode;
import com.poc.tradedata.exception.IngestException;
import com.poc.tradedata.service.IngestService;
import com.poc.tradedata.service.RunLedgerService;
import com.poc.tradedata.service.UploadService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@Slf4j
@RestController
@RequestMapping("/api/ingest")
@RequiredArgsConstructor
public class IngestController {

    private final UploadService uploadService;
    private final IngestService ingestService;
    private final RunLedgerService runLedgerService;

    /**
     * Accepts the raw file as the request body.
     * Params: filename (original name with extension), jobType (e.g. ECONOMIC_INDICATOR).
     */
    @PostMapping(value = "/upload", consumes = "*/*")
    public ResponseEntity<ApiResponse<RunView>> upload(
            HttpServletRequest request,
            @RequestParam("filename") String filename,
            @RequestParam("jobType") JobType jobType
    ) {
        try {
            String contentType = request.getContentType();
            if (contentType != null && contentType.toLowerCase().contains("multipart/form-data")) {
                return ResponseEntity.badRequest().body(ApiResponse.error(
                        "Incorrect upload method. Send the file as the binary request body, not form-data.",
                        ErrorCode.INVALID_REQUEST_PARAMETER.getCode()));
            }

            ProcessingRun run = uploadService.processUpload(request.getInputStream(), filename, jobType);
            return ResponseEntity.ok(ApiResponse.success("File uploaded", RunView.of(run)));
        } catch (Exception e) {
            log.error("Upload failed", e);
            return ResponseEntity.internalServerError().body(ApiResponse.error(e.getMessage(), ErrorCode.SYSTEM_ERROR.getCode()));
        }
    }

    @PostMapping("/runs/{runId}/process")
    public ResponseEntity<ApiResponse<ProcessResult>> process(
            @PathVariable Long runId,
            @RequestParam(value = "replaceAll", defaultValue = "true") boolean replaceAll
    ) {
        try {
            ProcessResult result = ingestService.process(runId, replaceAll);
            return ResponseEntity.ok(ApiResponse.success("Data processing completed.", result));
        } catch (IngestException e) {
            return ResponseEntity.status(statusOf(e.getErrorCode())).body(ApiResponse.error(e.getMessage(), e.getCode()));
        } catch (Exception e) {
            log.error("Processing of run {} failed", runId, e);
            return ResponseEntity.internalServerError().body(ApiResponse.error(
                    ErrorCode.SYSTEM_ERROR.getMessage(), ErrorCode.SYSTEM_ERROR.getCode()));
        }
    }

    @GetMapping("/runs")
    public ResponseEntity<ApiResponse<Page<RunView>>> runs(
            @RequestParam(value = "status", required = false) RunStatus status,
            @RequestParam(value = "jobType", required = false) JobType jobType,
            @RequestParam(value = "page", defaultValue = "0") int page,
            @RequestParam(value = "size", defaultValue = "20") int size
    ) {
        if (page < 0 || size <= 0 || size > 500) {
            return ResponseEntity.badRequest().body(ApiResponse.error(
                    ErrorCode.INVALID_REQUEST_PARAMETER.getMessage(), ErrorCode.INVALID_REQUEST_PARAMETER.getCode()));
        }
        Page<RunView> runs = runLedgerService
                .page(status, jobType, PageRequest.of(page, size, Sort.by(Sort.Direction.DESC, "id")))
                .map(RunView::of);
        return ResponseEntity.ok(ApiResponse.success("OK", runs));
    }

    @GetMapping("/runs/{runId}")
    public ResponseEntity<ApiResponse<RunView>> run(@PathVariable Long runId) {
        try {
            return ResponseEntity.ok(ApiResponse.success("OK", RunView.of(runLedgerService.get(runId))));
        } catch (IngestException e) {
            return ResponseEntity.status(statusOf(e.getErrorCode())).body(ApiResponse.error(e.getMessage(), e.getCode()));
        }
    }

    @DeleteMapping("/runs/{runId}")
    public ResponseEntity<ApiResponse<Long>> delete(@PathVariable Long runId) {
        try {
            runLedgerService.delete(runId);
            return ResponseEntity.ok(ApiResponse.success("Run deleted", runId));
        } catch (IngestException e) {
            return ResponseEntity.status(statusOf(e.getErrorCode())).body(ApiResponse.error(e.getMessage(), e.getCode()));
        }
    }

    static HttpStatus statusOf(ErrorCode errorCode) {
        switch (errorCode) {
            case RUN_NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case RUN_ALREADY_RUNNING:
                return HttpStatus.CONFLICT;
            case FILE_NOT_FOUND:
            case FILE_EXTENSION_ERROR:
            case FILE_READ_ERROR:
            case FILE_HEADER_NOT_FOUND:
            case DATA_VALIDATION_ERROR:
            case INVALID_REQUEST_PARAMETER:
                return HttpStatus.BAD_REQUEST;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }
}
