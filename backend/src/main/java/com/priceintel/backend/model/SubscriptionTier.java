package com.priceintel.backend.model;

/**
 * A subscription plan and its monthly analysis allowance. Loaded once from configuration.
 */
public record SubscriptionTier(String id, String name, String priceId, int monthlyAnalysisLimit, int priority) {
}
