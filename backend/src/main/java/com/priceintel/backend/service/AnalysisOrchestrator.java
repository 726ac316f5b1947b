package com.priceintel.backend.service;

import com.priceintel.backend.config.AsyncConfig;
import com.priceintel.backend.dto.InferenceResponse;
import com.priceintel.backend.exception.InferenceFailedException;
import com.priceintel.backend.exception.LedgerWriteFailedException;
import com.priceintel.backend.model.AnalysisJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Drives one job from PENDING to a terminal state with a single inference call.
 */
@Service
public class AnalysisOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(AnalysisOrchestrator.class);

    static final int CREDITS_PER_ANALYSIS = 1;
    static final String LEDGER_FAILURE_MESSAGE = "Analysis finished but credit usage could not be recorded. Please try again.";

    private final AnalysisJobService jobService;
    private final InferenceClient inferenceClient;
    private final MarketplaceFeeCalculator feeCalculator;
    private final CreditLedgerService ledgerService;

    public AnalysisOrchestrator(AnalysisJobService jobService,
            InferenceClient inferenceClient,
            MarketplaceFeeCalculator feeCalculator,
            CreditLedgerService ledgerService) {
        this.jobService = jobService;
        this.inferenceClient = inferenceClient;
        this.feeCalculator = feeCalculator;
        this.ledgerService = ledgerService;
    }

    /**
     * Process a job. Jobs already past PENDING are left alone.
     *
     * @throws LedgerWriteFailedException when the debit cannot be written; the job is failed first
     */
    @Async(AsyncConfig.ANALYSIS_EXECUTOR)
    public void process(String jobId) {
        Optional<AnalysisJob> claimed = jobService.markAnalyzing(jobId);
        if (claimed.isEmpty()) {
            return;
        }
        AnalysisJob job = claimed.get();

        InferenceResponse result;
        try {
            result = inferenceClient.analyze(job);
            feeCalculator.applyDefaults(result.getMarketplaceRecommendations(), result.getPricing(),
                    job.getEstimatedCost());
        } catch (InferenceFailedException e) {
            log.warn("[ORCHESTRATOR] Inference failed for job: {} - {}", jobId, e.getMessage());
            fail(job, e.getMessage());
            return;
        } catch (RuntimeException e) {
            log.error("[ORCHESTRATOR] Unexpected failure analyzing job: {}", jobId, e);
            fail(job, "Analysis failed: " + e.getMessage());
            return;
        }

        try {
            ledgerService.debit(job.getOwnerId(), CREDITS_PER_ANALYSIS, jobId,
                    () -> jobService.applyCompletion(jobId, result));
            log.info("[ORCHESTRATOR] Job: {} completed | Product: {}", jobId, result.getProductName());
        } catch (LedgerWriteFailedException e) {
            fail(job, LEDGER_FAILURE_MESSAGE);
            throw e;
        } catch (IllegalStateException e) {
            log.warn("[ORCHESTRATOR] Completion of job: {} dropped - {}", jobId, e.getMessage());
            releaseReservation(job);
        }
    }

    private void fail(AnalysisJob job, String error) {
        jobService.markFailed(job.getId(), error);
        releaseReservation(job);
    }

    private void releaseReservation(AnalysisJob job) {
        try {
            ledgerService.release(job.getOwnerId(), job.getId());
        } catch (LedgerWriteFailedException e) {
            log.error("[ORCHESTRATOR] Could not release reservation for job: {}, it will expire", job.getId(), e);
        }
    }
}
