package com.priceintel.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Credits to add to an owner's balance")
public class GrantCreditsRequest {

    @Positive
    @Schema(description = "Number of credits", example = "10")
    private int amount;

    @Schema(description = "Admin performing the grant")
    private String adminId;
}
