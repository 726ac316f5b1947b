package com.priceintel.backend.repository;

import com.priceintel.backend.model.CreditLedgerEntry;
import com.priceintel.backend.model.LedgerReason;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface CreditLedgerEntryRepository
        extends MongoRepository<CreditLedgerEntry, String>, CreditLedgerEntryRepositoryCustom {

    List<CreditLedgerEntry> findTop100ByOwnerIdOrderByTimestampDesc(String ownerId);

    List<CreditLedgerEntry> findByRelatedJobIdAndReason(String relatedJobId, LedgerReason reason);

    long countByOwnerIdAndReasonAndTimestampGreaterThanEqual(String ownerId, LedgerReason reason, Instant since);
}
