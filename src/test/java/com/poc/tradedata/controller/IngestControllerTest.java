package com.poc.tradedata.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.poc.tradedata.dto.ApiResponse;
import com.poc.tradedata.dto.ProcessResult;
import com.poc.tradedata.dto.RunView;
import com.poc.tradedata.entity.JobType;
import com.poc.tradedata.exception.ErrorCode;
import com.poc.tradedata.exception.HeaderNotFoundException;
import com.poc.tradedata.exception.RunNotFoundException;
import com.poc.tradedata.service.IngestService;
import com.poc.tradedata.service.RunLedgerService;
import com.poc.tradedata.service.UploadService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;

class IngestControllerTest {

    private UploadService uploadService;
    private IngestService ingestService;
    private RunLedgerService runLedgerService;
    private IngestController controller;

    @BeforeEach
    void setUp() {
        uploadService = mock(UploadService.class);
        ingestService = mock(IngestService.class);
        runLedgerService = mock(RunLedgerService.class);
        controller = new IngestController(uploadService, ingestService, runLedgerService);
    }

    @Test
    void processReturnsResult() {
        ProcessResult result = new ProcessResult(4L, JobType.TRADE_PARTNER, "tb_rhr150", 12);
        when(ingestService.process(4L, true)).thenReturn(result);

        ResponseEntity<ApiResponse<ProcessResult>> response = controller.process(4L, true);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody().isSuccess()).isTrue();
        assertThat(response.getBody().getData()).isSameAs(result);
    }

    @Test
    void processFailureCarriesErrorCode() {
        when(ingestService.process(4L, true)).thenThrow(new HeaderNotFoundException("Sheet1", "[기간, 국가]"));

        ResponseEntity<ApiResponse<ProcessResult>> response = controller.process(4L, true);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().isSuccess()).isFalse();
        assertThat(response.getBody().getErrorCode()).isEqualTo("E1004");
    }

    @Test
    void unknownRunIsNotFound() {
        when(runLedgerService.get(8L)).thenThrow(new RunNotFoundException(8L));

        ResponseEntity<ApiResponse<RunView>> response = controller.run(8L);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody().getErrorCode()).isEqualTo("E5001");
    }

    @Test
    void multipartUploadIsRejected() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setContentType("multipart/form-data; boundary=x");

        ResponseEntity<ApiResponse<RunView>> response = controller.upload(request, "a.xlsx", JobType.CUSTOMS_COUNTRY);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        verify(uploadService, never()).processUpload(any(), any(), any());
    }

    @Test
    void statusFollowsErrorCode() {
        assertThat(IngestController.statusOf(ErrorCode.RUN_ALREADY_RUNNING)).isEqualTo(HttpStatus.CONFLICT);
        assertThat(IngestController.statusOf(ErrorCode.FILE_EXTENSION_ERROR)).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(IngestController.statusOf(ErrorCode.DATABASE_ERROR)).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
