package com.priceintel.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Immutable record of one balance-affecting event. Entries are inserted, never updated.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "credit_ledger")
@CompoundIndex(name = "owner_reason_ts_idx", def = "{'ownerId': 1, 'reason': 1, 'timestamp': -1}")
public class CreditLedgerEntry {

    private static final String DEBIT_ID_PREFIX = "debit:";

    @Id
    private String id;

    @Indexed
    private String ownerId;

    private int amountDelta;

    private LedgerReason reason;

    @Indexed(sparse = true)
    private String relatedJobId;

    private String adminId;

    private int balanceAfter;

    private Instant timestamp;

    /**
     * Debit entries are keyed by job so the primary key rejects a second debit.
     */
    public static String debitIdFor(String jobId) {
        return DEBIT_ID_PREFIX + jobId;
    }
}
