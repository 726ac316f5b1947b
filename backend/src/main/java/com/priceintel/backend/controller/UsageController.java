package com.priceintel.backend.controller;

import com.priceintel.backend.dto.LedgerEntryResponse;
import com.priceintel.backend.model.UsageStats;
import com.priceintel.backend.service.CreditLedgerService;
import com.priceintel.backend.service.UsageStatsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.core.user.OAuth2User;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/usage")
@Tag(name = "Usage", description = "Credits and Analysis Usage")
public class UsageController {

    private final UsageStatsService usageStatsService;
    private final CreditLedgerService ledgerService;

    public UsageController(UsageStatsService usageStatsService, CreditLedgerService ledgerService) {
        this.usageStatsService = usageStatsService;
        this.ledgerService = ledgerService;
    }

    @GetMapping
    @Operation(summary = "Get usage", description = "Credits, allowance and analysis counts for the current period")
    public ResponseEntity<UsageStats> getUsage(@AuthenticationPrincipal OAuth2User principal) {
        return ResponseEntity.ok(usageStatsService.getUsageStats(PrincipalIds.ownerId(principal)));
    }

    @GetMapping("/credits")
    @Operation(summary = "Get credit history", description = "Latest 100 ledger entries, newest first")
    public ResponseEntity<List<LedgerEntryResponse>> getCreditHistory(@AuthenticationPrincipal OAuth2User principal) {
        return ResponseEntity.ok(ledgerService.getHistory(PrincipalIds.ownerId(principal)).stream()
                .map(LedgerEntryResponse::from)
                .toList());
    }
}
