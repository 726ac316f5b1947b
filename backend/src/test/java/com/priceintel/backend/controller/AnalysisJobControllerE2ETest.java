package com.priceintel.backend.controller;

import com.priceintel.backend.BaseE2ETest;
import com.priceintel.backend.TestFixtures;
import com.priceintel.backend.dto.InferenceResponse;
import com.priceintel.backend.model.JobStatus;
import com.priceintel.backend.model.LedgerReason;
import com.priceintel.backend.model.PriceRange;
import com.priceintel.backend.repository.AnalysisJobRepository;
import com.priceintel.backend.repository.CreditAccountRepository;
import com.priceintel.backend.repository.CreditLedgerEntryRepository;
import com.priceintel.backend.service.CreditLedgerService;
import com.priceintel.backend.service.InferenceClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.OAuth2LoginRequestPostProcessor;
import org.springframework.test.web.servlet.MockMvc;

import java.util.ArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.oauth2Login;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@AutoConfigureMockMvc
class AnalysisJobControllerE2ETest extends BaseE2ETest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private AnalysisJobRepository jobRepository;

    @Autowired
    private CreditAccountRepository accountRepository;

    @Autowired
    private CreditLedgerEntryRepository ledgerRepository;

    @Autowired
    private CreditLedgerService ledgerService;

    @MockBean
    private InferenceClient inferenceClient;

    @BeforeEach
    void setUp() {
        jobRepository.deleteAll();
        accountRepository.deleteAll();
        ledgerRepository.deleteAll();
        when(inferenceClient.analyze(any())).thenAnswer(invocation -> InferenceResponse.builder()
                .productName("Canon AE-1")
                .pricing(PriceRange.builder().low(120.0).median(150.0).high(180.0).build())
                .marketplaceRecommendations(new ArrayList<>())
                .build());
    }

    private static OAuth2LoginRequestPostProcessor login(String ownerId) {
        return oauth2Login().attributes(attrs -> attrs.put("id", ownerId));
    }

    private static MockMultipartFile image() {
        return new MockMultipartFile("image", "camera.jpg", "image/jpeg", "jpeg bytes".getBytes());
    }

    @Test
    void shouldReturnUnauthorizedWithoutAuth() throws Exception {
        mockMvc.perform(get("/api/jobs"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void shouldAccessHealthEndpointWithoutAuth() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.service").value("priceintel-backend"));
    }

    @Test
    void shouldAccessSwaggerWithoutAuth() throws Exception {
        mockMvc.perform(get("/swagger-ui.html"))
                .andExpect(status().is3xxRedirection());
    }

    @Test
    void shouldListTiersWithoutAuth() throws Exception {
        mockMvc.perform(get("/api/subscription/tiers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("free_trial"))
                .andExpect(jsonPath("$[0].monthlyAnalysisLimit").value(2));
    }

    @Test
    void shouldAcceptSubmission() throws Exception {
        // When
        mockMvc.perform(multipart("/api/jobs")
                        .file(image())
                        .param("condition", "Good")
                        .param("estimatedCost", "10.0")
                        .with(login("owner-1")))
                // Then
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.jobId").isNotEmpty())
                .andExpect(jsonPath("$.status").value("PENDING"));

        assertThat(jobRepository.countByOwnerId("owner-1")).isEqualTo(1);
    }

    @Test
    void shouldRejectSubmissionWithoutCondition() throws Exception {
        mockMvc.perform(multipart("/api/jobs")
                        .file(image())
                        .with(login("owner-1")))
                .andExpect(status().isBadRequest());

        assertThat(jobRepository.count()).isZero();
    }

    @Test
    void shouldReturnPaymentRequiredWhenQuotaIsUsed() throws Exception {
        // Given an allowance already consumed this month
        ledgerService.debit("owner-1", 1, "job-a");
        ledgerService.debit("owner-1", 1, "job-b");

        // When / Then
        mockMvc.perform(multipart("/api/jobs")
                        .file(image())
                        .param("condition", "Good")
                        .with(login("owner-1")))
                .andExpect(status().isPaymentRequired());

        assertThat(jobRepository.count()).isZero();
        assertThat(ledgerRepository.findByRelatedJobIdAndReason("job-b", LedgerReason.ANALYSIS_DEBIT)).hasSize(1);
    }

    @Test
    void shouldGetOwnJob() throws Exception {
        jobRepository.save(TestFixtures.job("job-1", "owner-1", JobStatus.PENDING));

        mockMvc.perform(get("/api/jobs/job-1").with(login("owner-1")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("job-1"))
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andExpect(jsonPath("$.imageUrl").value("/api/files/65f0c0ffee0000000000abcd"));
    }

    @Test
    void shouldHideOtherOwnersJob() throws Exception {
        jobRepository.save(TestFixtures.job("job-2", "owner-2", JobStatus.PENDING));

        mockMvc.perform(get("/api/jobs/job-2").with(login("owner-1")))
                .andExpect(status().isNotFound());
    }

    @Test
    void shouldListOwnJobsOnly() throws Exception {
        jobRepository.save(TestFixtures.job("job-1", "owner-1", JobStatus.COMPLETED));
        jobRepository.save(TestFixtures.job("job-2", "owner-2", JobStatus.COMPLETED));

        mockMvc.perform(get("/api/jobs").with(login("owner-1")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalElements").value(1))
                .andExpect(jsonPath("$.content[0].id").value("job-1"));
    }

    @Test
    void shouldReportUsage() throws Exception {
        mockMvc.perform(get("/api/usage").with(login("owner-1")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.subscriptionTier").value("free_trial"))
                .andExpect(jsonPath("$.subscriptionLimit").value(2))
                .andExpect(jsonPath("$.creditsRemaining").value(0))
                .andExpect(jsonPath("$.canAnalyze").value(true));
    }
}
