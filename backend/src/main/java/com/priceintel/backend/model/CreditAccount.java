package com.priceintel.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Per-owner credit account. The balance is a denormalized copy of the ledger fold and is only
 * written in the same transaction as a ledger entry. The version serializes writers for one owner.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "credit_accounts")
public class CreditAccount {

    // Owner ID
    @Id
    private String id;

    private String tierId;

    @Builder.Default
    private SubscriptionStatus subscriptionStatus = SubscriptionStatus.NONE;

    @Builder.Default
    private int balance = 0;

    private Instant periodStart;
    private Instant periodEnd;

    // jobId -> expiry of the quota claim taken at submission
    @Builder.Default
    private Map<String, Instant> reservations = new HashMap<>();

    private Instant updatedAt;

    @Version
    private Long version;

    public boolean hasActiveSubscription() {
        return subscriptionStatus == SubscriptionStatus.ACTIVE;
    }

    public long liveReservations(Instant now) {
        return reservations.values().stream()
                .filter(expiry -> expiry.isAfter(now))
                .count();
    }
}
