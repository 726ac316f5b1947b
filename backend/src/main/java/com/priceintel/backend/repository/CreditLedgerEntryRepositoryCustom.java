package com.priceintel.backend.repository;

public interface CreditLedgerEntryRepositoryCustom {

    /**
     * Sum of every entry's delta for the owner, i.e. the balance as recorded by the log.
     */
    int sumAmountDeltaByOwnerId(String ownerId);
}
