package com.priceintel.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body sent to the inference service's analyze endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Request to analyze a product image")
public class InferenceRequest {

    @Schema(description = "Job ID")
    private String analysisId;

    @Schema(description = "Absolute URL the service downloads the image from")
    private String imageUrl;

    @Schema(description = "Item condition as entered by the seller")
    private String condition;

    @Schema(description = "What the seller paid for the item")
    private Double estimatedCost;

    @Schema(description = "Free-form seller notes")
    private String notes;
}
