package com.priceintel.backend.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.priceintel.backend.model.MarketplaceRecommendation;
import com.priceintel.backend.model.PriceRange;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Analysis result returned by the inference service.
 * Field names match the service's JSON payload.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class InferenceResponse {

    private String productName;
    private String brand;
    private String category;
    private PriceRange pricing;
    private List<MarketplaceRecommendation> marketplaceRecommendations;
    private Double confidenceScore;
    private String generatedTitle;
    private String description;
    private List<String> tags;

    // Set by the service instead of the fields above when the analysis failed
    private String error;
}
