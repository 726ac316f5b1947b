package com.priceintel.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.web.multipart.MultipartFile;

/**
 * A product image plus the seller's description of it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubmitAnalysisRequest {

    private MultipartFile image;

    private String condition;

    private Double estimatedCost;

    private String notes;
}
