package com.priceintel.backend.repository;

import com.priceintel.backend.model.AnalysisJob;
import com.priceintel.backend.model.JobStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface AnalysisJobRepository extends MongoRepository<AnalysisJob, String> {

    Optional<AnalysisJob> findByIdAndOwnerId(String id, String ownerId);

    Page<AnalysisJob> findByOwnerIdOrderByCreatedAtDesc(String ownerId, Pageable pageable);

    List<AnalysisJob> findByOwnerIdAndStatus(String ownerId, JobStatus status);

    long countByOwnerId(String ownerId);

    long countByOwnerIdAndCreatedAtGreaterThanEqual(String ownerId, Instant since);
}
