package com.priceintel.backend.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Usage figures derived from the ledger and job history for the active period. Not persisted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Credit and analysis usage for the current subscription period")
public class UsageStats {

    @Schema(description = "All analyses ever submitted")
    private long totalAnalyses;

    @Schema(description = "Analyses submitted in the current period")
    private long analysesThisPeriod;

    @Schema(description = "Analysis debits recorded in the current period")
    private long creditsUsed;

    @Schema(description = "Current credit balance")
    private int creditsRemaining;

    @Schema(description = "Completed analyses charged in the current period")
    private long currentPeriodUsage;

    @Schema(description = "Monthly analysis allowance of the owner's tier")
    private int subscriptionLimit;

    @Schema(description = "Tier ID", example = "pro")
    private String subscriptionTier;

    @Schema(description = "Subscription status")
    private SubscriptionStatus subscriptionStatus;

    @Schema(description = "Whether another analysis may be submitted now")
    private boolean canAnalyze;

    @Schema(description = "Start of the current period")
    private Instant periodStart;

    @Schema(description = "When the allowance resets")
    private Instant resetDate;

    @Schema(description = "Mean estimated profit of the top recommendation across completed analyses")
    private double averageProfit;
}
