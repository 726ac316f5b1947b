package com.priceintel.backend.controller;

import com.priceintel.backend.dto.AnalysisJobResponse;
import com.priceintel.backend.dto.SubmitAnalysisRequest;
import com.priceintel.backend.dto.SubmitAnalysisResponse;
import com.priceintel.backend.model.JobStatus;
import com.priceintel.backend.service.AnalysisJobService;
import com.priceintel.backend.service.AnalysisSubmissionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.core.user.OAuth2User;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/api/jobs")
@Tag(name = "Jobs", description = "Product Analysis Jobs")
public class AnalysisJobController {

    private final AnalysisSubmissionService submissionService;
    private final AnalysisJobService jobService;

    public AnalysisJobController(AnalysisSubmissionService submissionService, AnalysisJobService jobService) {
        this.submissionService = submissionService;
        this.jobService = jobService;
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Submit analysis", description = "Upload a product image and start an analysis job")
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "Job accepted, poll for the result"),
            @ApiResponse(responseCode = "400", description = "Missing image or condition"),
            @ApiResponse(responseCode = "401", description = "Unauthorized"),
            @ApiResponse(responseCode = "402", description = "No credits or allowance left"),
            @ApiResponse(responseCode = "502", description = "Image could not be stored"),
            @ApiResponse(responseCode = "503", description = "Analysis capacity exhausted, nothing was kept")
    })
    public ResponseEntity<SubmitAnalysisResponse> submit(
            @AuthenticationPrincipal OAuth2User principal,
            @Parameter(description = "Product image") @RequestParam("image") MultipartFile image,
            @Parameter(description = "Item condition") @RequestParam("condition") String condition,
            @Parameter(description = "What the seller paid") @RequestParam(value = "estimatedCost", required = false) Double estimatedCost,
            @Parameter(description = "Seller notes") @RequestParam(value = "notes", required = false) String notes) {

        SubmitAnalysisRequest request = SubmitAnalysisRequest.builder()
                .image(image)
                .condition(condition)
                .estimatedCost(estimatedCost)
                .notes(notes)
                .build();

        String jobId = submissionService.submit(request, PrincipalIds.ownerId(principal));
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(new SubmitAnalysisResponse(jobId, JobStatus.PENDING));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get job", description = "Get the current status and, once completed, the results of a job")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Job found"),
            @ApiResponse(responseCode = "404", description = "Job not found")
    })
    public ResponseEntity<AnalysisJobResponse> getJob(
            @AuthenticationPrincipal OAuth2User principal,
            @Parameter(description = "Job ID") @PathVariable String id) {

        return ResponseEntity.ok(AnalysisJobResponse.from(jobService.getJob(id, PrincipalIds.ownerId(principal))));
    }

    @GetMapping
    @Operation(summary = "List jobs", description = "Paginated analysis history of the authenticated user, newest first")
    public ResponseEntity<Page<AnalysisJobResponse>> listJobs(
            @AuthenticationPrincipal OAuth2User principal,
            Pageable pageable) {

        return ResponseEntity.ok(jobService.listJobs(PrincipalIds.ownerId(principal), pageable)
                .map(AnalysisJobResponse::from));
    }
}
