package com.priceintel.backend.model;

public enum SubscriptionStatus {
    NONE,
    ACTIVE,
    PAST_DUE,
    CANCELED
}
