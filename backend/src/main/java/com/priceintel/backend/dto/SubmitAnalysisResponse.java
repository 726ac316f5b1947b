package com.priceintel.backend.dto;

import com.priceintel.backend.model.JobStatus;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Accepted analysis job")
public class SubmitAnalysisResponse {

    @Schema(description = "Job ID to poll")
    private String jobId;

    @Schema(description = "Initial job status")
    private JobStatus status;
}
