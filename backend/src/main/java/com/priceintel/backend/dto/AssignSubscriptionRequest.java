package com.priceintel.backend.dto;

import com.priceintel.backend.model.SubscriptionStatus;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Subscription change, usually relayed from the payment provider")
public class AssignSubscriptionRequest {

    @NotBlank
    @Schema(description = "Tier ID", example = "pro")
    private String tierId;

    @Schema(description = "Subscription status, ACTIVE when omitted")
    private SubscriptionStatus status;
}
