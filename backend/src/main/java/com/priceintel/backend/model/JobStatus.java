package com.priceintel.backend.model;

/**
 * Status of a product analysis job.
 * Transitions only move forward: PENDING -> ANALYZING -> COMPLETED | FAILED.
 */
public enum JobStatus {
    PENDING,
    ANALYZING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(JobStatus next) {
        return switch (this) {
            case PENDING -> next == ANALYZING;
            case ANALYZING -> next == COMPLETED || next == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }
}
