package com.priceintel.backend.model;

/**
 * Why a credit ledger entry was written.
 */
public enum LedgerReason {
    ANALYSIS_DEBIT,
    ADMIN_CREDIT,
    SUBSCRIPTION_RESET
}
