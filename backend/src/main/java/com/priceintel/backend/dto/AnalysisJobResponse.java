package com.priceintel.backend.dto;

import com.priceintel.backend.model.AnalysisJob;
import com.priceintel.backend.model.JobStatus;
import com.priceintel.backend.model.MarketplaceRecommendation;
import com.priceintel.backend.model.PriceRange;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Response containing job details and, once completed, the analysis results.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Analysis job response")
public class AnalysisJobResponse {

    @Schema(description = "Job ID")
    private String id;

    @Schema(description = "Current job status")
    private JobStatus status;

    @Schema(description = "Item condition")
    private String condition;

    @Schema(description = "Seller's cost for the item")
    private Double estimatedCost;

    @Schema(description = "Seller notes")
    private String notes;

    @Schema(description = "Download path of the submitted image")
    private String imageUrl;

    @Schema(description = "Original image filename")
    private String originalFilename;

    @Schema(description = "Identified product name")
    private String productName;

    @Schema(description = "Identified brand")
    private String brand;

    @Schema(description = "Product category")
    private String category;

    @Schema(description = "Estimated resale value")
    private PriceRange estimatedValue;

    @Schema(description = "Marketplaces ranked for this product")
    private List<MarketplaceRecommendation> marketplaceRecommendations;

    @Schema(description = "Model confidence (0-1)")
    private Double confidenceScore;

    @Schema(description = "Suggested listing title")
    private String generatedTitle;

    @Schema(description = "Suggested listing description")
    private String description;

    @Schema(description = "Suggested listing tags")
    private List<String> tags;

    @Schema(description = "Error message if failed")
    private String error;

    @Schema(description = "Job creation timestamp")
    private Instant createdAt;

    @Schema(description = "Last status change")
    private Instant updatedAt;

    @Schema(description = "Job completion timestamp")
    private Instant completedAt;

    public static AnalysisJobResponse from(AnalysisJob job) {
        return AnalysisJobResponse.builder()
                .id(job.getId())
                .status(job.getStatus())
                .condition(job.getCondition())
                .estimatedCost(job.getEstimatedCost())
                .notes(job.getNotes())
                .imageUrl(job.getArtifactUrl())
                .originalFilename(job.getOriginalFilename())
                .productName(job.getProductName())
                .brand(job.getBrand())
                .category(job.getCategory())
                .estimatedValue(job.getEstimatedValue())
                .marketplaceRecommendations(job.getMarketplaceRecommendations())
                .confidenceScore(job.getConfidenceScore())
                .generatedTitle(job.getGeneratedTitle())
                .description(job.getDescription())
                .tags(job.getTags())
                .error(job.getError())
                .createdAt(job.getCreatedAt())
                .updatedAt(job.getUpdatedAt())
                .completedAt(job.getCompletedAt())
                .build();
    }
}
