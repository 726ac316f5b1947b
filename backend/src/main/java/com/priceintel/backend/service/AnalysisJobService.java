package com.priceintel.backend.service;

import com.priceintel.backend.dto.InferenceResponse;
import com.priceintel.backend.exception.JobNotFoundException;
import com.priceintel.backend.model.AnalysisJob;
import com.priceintel.backend.model.JobStatus;
import com.priceintel.backend.repository.AnalysisJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Reads and guarded status transitions for analysis jobs.
 */
@Service
public class AnalysisJobService {

    private static final Logger log = LoggerFactory.getLogger(AnalysisJobService.class);

    private final AnalysisJobRepository jobRepository;
    private final Clock clock;

    public AnalysisJobService(AnalysisJobRepository jobRepository, Clock clock) {
        this.jobRepository = jobRepository;
        this.clock = clock;
    }

    /**
     * Persist a new job in PENDING.
     */
    public AnalysisJob createPending(AnalysisJob job) {
        Instant now = now();
        job.setStatus(JobStatus.PENDING);
        job.setCreatedAt(now);
        job.setUpdatedAt(now);
        job.setCompletedAt(null);
        return jobRepository.insert(job);
    }

    /**
     * Remove a job that never left PENDING, when it could not be handed to the executor.
     */
    public void discardPending(String jobId) {
        jobRepository.findById(jobId)
                .filter(job -> job.getStatus() == JobStatus.PENDING)
                .ifPresent(job -> {
                    jobRepository.delete(job);
                    log.info("[JOB] Discarded pending job: {}", jobId);
                });
    }

    /**
     * The owner's job. Jobs of other owners are reported as missing.
     */
    public AnalysisJob getJob(String jobId, String ownerId) {
        return jobRepository.findByIdAndOwnerId(jobId, ownerId)
                .orElseThrow(() -> new JobNotFoundException(jobId));
    }

    public Page<AnalysisJob> listJobs(String ownerId, Pageable pageable) {
        return jobRepository.findByOwnerIdOrderByCreatedAtDesc(ownerId, pageable);
    }

    /**
     * PENDING -> ANALYZING.
     *
     * @return the updated job, or empty when the job is missing, already past PENDING,
     *         or claimed concurrently
     */
    public Optional<AnalysisJob> markAnalyzing(String jobId) {
        return transition(jobId, JobStatus.ANALYZING, job -> {
        });
    }

    /**
     * ANALYZING -> FAILED with a readable error.
     *
     * @return the updated job, or empty when the transition is not allowed
     */
    public Optional<AnalysisJob> markFailed(String jobId, String error) {
        String message = error != null && !error.isBlank() ? error : "Analysis failed";
        return transition(jobId, JobStatus.FAILED, job -> {
            job.setError(message);
            job.setCompletedAt(job.getUpdatedAt());
        });
    }

    /**
     * ANALYZING -> COMPLETED with the inference results. Meant to run inside the ledger
     * transaction, so a version conflict propagates and rolls the debit back.
     *
     * @throws IllegalStateException when the job is missing or no longer ANALYZING
     */
    public AnalysisJob applyCompletion(String jobId, InferenceResponse result) {
        AnalysisJob job = jobRepository.findById(jobId)
                .orElseThrow(() -> new IllegalStateException("Job disappeared before completion: " + jobId));
        if (!job.getStatus().canTransitionTo(JobStatus.COMPLETED)) {
            throw new IllegalStateException("Job " + jobId + " cannot complete from " + job.getStatus());
        }

        Instant now = now();
        job.setStatus(JobStatus.COMPLETED);
        job.setProductName(result.getProductName());
        job.setBrand(result.getBrand());
        job.setCategory(result.getCategory());
        job.setEstimatedValue(result.getPricing());
        job.setMarketplaceRecommendations(result.getMarketplaceRecommendations() != null
                ? new ArrayList<>(result.getMarketplaceRecommendations())
                : new ArrayList<>());
        job.setConfidenceScore(result.getConfidenceScore());
        job.setGeneratedTitle(result.getGeneratedTitle());
        job.setDescription(result.getDescription());
        job.setTags(result.getTags() != null ? new ArrayList<>(result.getTags()) : new ArrayList<>());
        job.setError(null);
        job.setUpdatedAt(now);
        job.setCompletedAt(now);
        return jobRepository.save(job);
    }

    private Optional<AnalysisJob> transition(String jobId, JobStatus next, Consumer<AnalysisJob> mutation) {
        Optional<AnalysisJob> found = jobRepository.findById(jobId);
        if (found.isEmpty()) {
            log.warn("[JOB] Job: {} not found for transition to {}", jobId, next);
            return Optional.empty();
        }

        AnalysisJob job = found.get();
        if (!job.getStatus().canTransitionTo(next)) {
            log.info("[JOB] Ignoring transition {} -> {} for job: {}", job.getStatus(), next, jobId);
            return Optional.empty();
        }

        job.setStatus(next);
        job.setUpdatedAt(now());
        mutation.accept(job);

        try {
            AnalysisJob saved = jobRepository.save(job);
            log.info("[JOB] Job: {} -> {}", jobId, next);
            return Optional.of(saved);
        } catch (OptimisticLockingFailureException e) {
            log.info("[JOB] Job: {} changed concurrently, transition to {} dropped", jobId, next);
            return Optional.empty();
        }
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
