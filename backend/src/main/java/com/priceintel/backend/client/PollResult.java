package com.priceintel.backend.client;

import com.priceintel.backend.dto.AnalysisJobResponse;

import java.time.Duration;

/**
 * Outcome of one polling session.
 *
 * @param job last state observed, null if no fetch succeeded
 */
public record PollResult(Outcome outcome, AnalysisJobResponse job, int attempts, Duration elapsed) {

    public enum Outcome {
        COMPLETED,
        FAILED,
        // Deadline passed; says nothing about the job itself
        TIMEOUT,
        CANCELLED
    }

    public boolean isTerminal() {
        return outcome == Outcome.COMPLETED || outcome == Outcome.FAILED;
    }
}
