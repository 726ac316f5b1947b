package com.priceintel.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A marketplace suggested for listing the analyzed product.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MarketplaceRecommendation {

    private String platform;

    // 1-10
    private Integer suitability;

    private String reasoning;

    private Double estimatedProfit;

    private Double fees;
}
