package com.priceintel.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Job document representing one product analysis request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "analysis_jobs")
@CompoundIndex(name = "owner_created_idx", def = "{'ownerId': 1, 'createdAt': -1}")
public class AnalysisJob {

    @Id
    private String id;

    @Indexed
    private String ownerId;

    @Builder.Default
    private JobStatus status = JobStatus.PENDING;

    // Input
    private String condition;
    private Double estimatedCost;
    private String notes;

    // Artifact
    private String artifactId;
    private String artifactUrl;
    private String originalFilename;
    private String contentType;

    // Results (only when COMPLETED)
    private String productName;
    private String brand;
    private String category;
    private PriceRange estimatedValue;

    @Builder.Default
    private List<MarketplaceRecommendation> marketplaceRecommendations = new ArrayList<>();

    private Double confidenceScore;
    private String generatedTitle;
    private String description;

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    // Only when FAILED
    private String error;

    // Timing
    private Instant createdAt;
    private Instant updatedAt;
    private Instant completedAt;

    @Version
    private Long version;
}
