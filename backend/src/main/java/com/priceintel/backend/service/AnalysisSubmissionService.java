package com.priceintel.backend.service;

import com.priceintel.backend.dto.SubmitAnalysisRequest;
import com.priceintel.backend.exception.AnalysisUnavailableException;
import com.priceintel.backend.exception.QuotaExceededException;
import com.priceintel.backend.exception.UploadFailedException;
import com.priceintel.backend.model.AnalysisJob;
import com.priceintel.backend.service.ArtifactStorageService.ArtifactRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Entry point for new analyses: quota, image upload, job row, background hand-off.
 */
@Service
public class AnalysisSubmissionService {

    private static final Logger log = LoggerFactory.getLogger(AnalysisSubmissionService.class);

    private final CreditLedgerService ledgerService;
    private final ArtifactStorageService storageService;
    private final AnalysisJobService jobService;
    private final AnalysisOrchestrator orchestrator;

    public AnalysisSubmissionService(CreditLedgerService ledgerService,
            ArtifactStorageService storageService,
            AnalysisJobService jobService,
            AnalysisOrchestrator orchestrator) {
        this.ledgerService = ledgerService;
        this.storageService = storageService;
        this.jobService = jobService;
        this.orchestrator = orchestrator;
    }

    /**
     * Submit an analysis and return its job id without waiting for the result.
     *
     * @throws IllegalArgumentException when the image or condition is missing
     * @throws QuotaExceededException   when the owner has no credits or allowance left
     * @throws UploadFailedException    when the image cannot be stored
     * @throws AnalysisUnavailableException when the analysis executor is saturated; nothing is kept
     */
    public String submit(SubmitAnalysisRequest request, String ownerId) {
        validate(request, ownerId);

        String jobId = UUID.randomUUID().toString();
        if (!ledgerService.reserve(ownerId, jobId)) {
            throw new QuotaExceededException(ownerId);
        }

        ArtifactRef artifact;
        try {
            artifact = storageService.store(request.getImage());
        } catch (UploadFailedException e) {
            ledgerService.release(ownerId, jobId);
            throw e;
        }

        try {
            jobService.createPending(AnalysisJob.builder()
                    .id(jobId)
                    .ownerId(ownerId)
                    .condition(request.getCondition().trim())
                    .estimatedCost(request.getEstimatedCost())
                    .notes(request.getNotes())
                    .artifactId(artifact.id())
                    .artifactUrl(artifact.url())
                    .originalFilename(artifact.originalFilename())
                    .contentType(artifact.contentType())
                    .build());
        } catch (RuntimeException e) {
            log.error("[SUBMIT] Failed to create job: {} for owner: {}", jobId, ownerId, e);
            ledgerService.release(ownerId, jobId);
            discardArtifact(artifact.id());
            throw e;
        }

        log.info("[SUBMIT] Job: {} | Owner: {} | Condition: {} | Artifact: {}",
                jobId, ownerId, request.getCondition(), artifact.id());

        try {
            orchestrator.process(jobId);
        } catch (TaskRejectedException e) {
            log.error("[SUBMIT] Analysis executor rejected job: {}, withdrawing it", jobId, e);
            withdraw(jobId, ownerId, artifact.id());
            throw new AnalysisUnavailableException("Analysis capacity exhausted, please retry shortly", e);
        }
        return jobId;
    }

    private void withdraw(String jobId, String ownerId, String artifactId) {
        try {
            jobService.discardPending(jobId);
        } catch (RuntimeException e) {
            log.error("[SUBMIT] Could not remove rejected job: {}", jobId, e);
        }
        ledgerService.release(ownerId, jobId);
        discardArtifact(artifactId);
    }

    private void discardArtifact(String artifactId) {
        try {
            storageService.delete(artifactId);
        } catch (RuntimeException e) {
            log.error("[SUBMIT] Orphaned artifact: {} could not be deleted", artifactId, e);
        }
    }

    private static void validate(SubmitAnalysisRequest request, String ownerId) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("Owner is required");
        }
        if (request == null || request.getImage() == null || request.getImage().isEmpty()) {
            throw new IllegalArgumentException("Image is required");
        }
        if (request.getCondition() == null || request.getCondition().isBlank()) {
            throw new IllegalArgumentException("Condition is required");
        }
        if (request.getEstimatedCost() != null && request.getEstimatedCost() < 0) {
            throw new IllegalArgumentException("Estimated cost must not be negative");
        }
    }
}
