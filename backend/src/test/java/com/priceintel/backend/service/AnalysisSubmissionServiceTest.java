package com.priceintel.backend.service;

import com.priceintel.backend.dto.SubmitAnalysisRequest;
import com.priceintel.backend.exception.AnalysisUnavailableException;
import com.priceintel.backend.exception.QuotaExceededException;
import com.priceintel.backend.exception.UploadFailedException;
import com.priceintel.backend.model.AnalysisJob;
import com.priceintel.backend.model.JobStatus;
import com.priceintel.backend.service.ArtifactStorageService.ArtifactRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.mock.web.MockMultipartFile;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class AnalysisSubmissionServiceTest {

    private static final String OWNER = "owner-1";

    private CreditLedgerService ledgerService;
    private ArtifactStorageService storageService;
    private AnalysisJobService jobService;
    private AnalysisOrchestrator orchestrator;
    private AnalysisSubmissionService submissionService;

    @BeforeEach
    void setUp() {
        ledgerService = mock(CreditLedgerService.class);
        storageService = mock(ArtifactStorageService.class);
        jobService = mock(AnalysisJobService.class);
        orchestrator = mock(AnalysisOrchestrator.class);
        submissionService = new AnalysisSubmissionService(ledgerService, storageService, jobService, orchestrator);

        when(ledgerService.reserve(eq(OWNER), anyString())).thenReturn(true);
        when(storageService.store(any())).thenReturn(
                new ArtifactRef("file-1", "/api/files/file-1", "camera.jpg", "image/jpeg"));
        when(jobService.createPending(any(AnalysisJob.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    private SubmitAnalysisRequest request() {
        return SubmitAnalysisRequest.builder()
                .image(new MockMultipartFile("image", "camera.jpg", "image/jpeg", new byte[] { 1, 2, 3 }))
                .condition(" Like New ")
                .estimatedCost(25.0)
                .notes("Tested, works")
                .build();
    }

    @Test
    void shouldCreatePendingJobAndHandOff() {
        // When
        String jobId = submissionService.submit(request(), OWNER);

        // Then
        ArgumentCaptor<AnalysisJob> job = ArgumentCaptor.forClass(AnalysisJob.class);
        verify(jobService).createPending(job.capture());
        assertEquals(jobId, job.getValue().getId());
        assertEquals(OWNER, job.getValue().getOwnerId());
        assertEquals(JobStatus.PENDING, job.getValue().getStatus());
        assertEquals("Like New", job.getValue().getCondition());
        assertEquals(25.0, job.getValue().getEstimatedCost());
        assertEquals("file-1", job.getValue().getArtifactId());
        assertEquals("/api/files/file-1", job.getValue().getArtifactUrl());

        verify(ledgerService).reserve(OWNER, jobId);
        verify(orchestrator).process(jobId);
    }

    @Test
    void shouldRejectWithoutQuotaBeforeUploading() {
        when(ledgerService.reserve(eq(OWNER), anyString())).thenReturn(false);

        assertThrows(QuotaExceededException.class, () -> submissionService.submit(request(), OWNER));

        verifyNoInteractions(storageService, jobService, orchestrator);
    }

    @Test
    void shouldReleaseReservationWhenUploadFails() {
        when(storageService.store(any())).thenThrow(new UploadFailedException("disk full", null));

        assertThrows(UploadFailedException.class, () -> submissionService.submit(request(), OWNER));

        verify(ledgerService).release(eq(OWNER), anyString());
        verifyNoInteractions(jobService, orchestrator);
    }

    @Test
    void shouldCleanUpWhenJobRowCannotBeCreated() {
        when(jobService.createPending(any(AnalysisJob.class)))
                .thenThrow(new DataAccessResourceFailureException("mongo down"));

        assertThrows(DataAccessResourceFailureException.class, () -> submissionService.submit(request(), OWNER));

        verify(ledgerService).release(eq(OWNER), anyString());
        verify(storageService).delete("file-1");
        verifyNoInteractions(orchestrator);
    }

    @Test
    void shouldWithdrawJobWhenExecutorIsSaturated() {
        // Given
        doThrow(new TaskRejectedException("queue full")).when(orchestrator).process(anyString());

        // When
        assertThrows(AnalysisUnavailableException.class, () -> submissionService.submit(request(), OWNER));

        // Then nothing of the submission survives
        ArgumentCaptor<String> jobId = ArgumentCaptor.forClass(String.class);
        verify(orchestrator).process(jobId.capture());
        verify(jobService).discardPending(jobId.getValue());
        verify(ledgerService).release(OWNER, jobId.getValue());
        verify(storageService).delete("file-1");
    }

    @Test
    void shouldKeepOriginalErrorWhenArtifactDeleteFails() {
        when(jobService.createPending(any(AnalysisJob.class)))
                .thenThrow(new DataAccessResourceFailureException("mongo down"));
        doThrow(new IllegalStateException("gridfs down")).when(storageService).delete("file-1");

        assertThrows(DataAccessResourceFailureException.class, () -> submissionService.submit(request(), OWNER));
    }

    @Test
    void shouldValidateBeforeTouchingQuota() {
        SubmitAnalysisRequest blankCondition = request();
        blankCondition.setCondition("  ");
        SubmitAnalysisRequest emptyImage = request();
        emptyImage.setImage(new MockMultipartFile("image", new byte[0]));
        SubmitAnalysisRequest negativeCost = request();
        negativeCost.setEstimatedCost(-1.0);

        assertThrows(IllegalArgumentException.class, () -> submissionService.submit(blankCondition, OWNER));
        assertThrows(IllegalArgumentException.class, () -> submissionService.submit(emptyImage, OWNER));
        assertThrows(IllegalArgumentException.class, () -> submissionService.submit(negativeCost, OWNER));
        assertThrows(IllegalArgumentException.class, () -> submissionService.submit(request(), " "));

        verifyNoInteractions(ledgerService, storageService, jobService);
    }
}
