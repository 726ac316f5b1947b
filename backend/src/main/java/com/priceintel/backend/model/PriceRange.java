package com.priceintel.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Estimated resale value band.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PriceRange {

    private Double low;
    private Double median;
    private Double high;
}
