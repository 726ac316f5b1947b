package com.priceintel.backend.controller;

import com.priceintel.backend.dto.AssignSubscriptionRequest;
import com.priceintel.backend.dto.GrantCreditsRequest;
import com.priceintel.backend.dto.LedgerEntryResponse;
import com.priceintel.backend.model.CreditAccount;
import com.priceintel.backend.model.LedgerReason;
import com.priceintel.backend.service.CreditLedgerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Credit administration. Requests are authenticated by {@code AdminApiKeyAuthFilter}.
 */
@RestController
@RequestMapping("/api/admin/credits")
@Tag(name = "Admin Credits", description = "Credit Ledger Administration (API key)")
public class AdminCreditController {

    private final CreditLedgerService ledgerService;

    public AdminCreditController(CreditLedgerService ledgerService) {
        this.ledgerService = ledgerService;
    }

    @PostMapping("/{ownerId}/grant")
    @Operation(summary = "Grant credits", description = "Add credits to an owner's balance")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Credits granted"),
            @ApiResponse(responseCode = "400", description = "Amount must be positive"),
            @ApiResponse(responseCode = "401", description = "Missing or invalid admin API key")
    })
    public ResponseEntity<LedgerEntryResponse> grant(
            @Parameter(description = "Owner ID") @PathVariable String ownerId,
            @Valid @RequestBody GrantCreditsRequest request) {

        var entry = ledgerService.grant(ownerId, request.getAmount(), LedgerReason.ADMIN_CREDIT, request.getAdminId());
        return ResponseEntity.status(HttpStatus.CREATED).body(LedgerEntryResponse.from(entry));
    }

    @PutMapping("/{ownerId}/subscription")
    @Operation(summary = "Assign subscription", description = "Set an owner's tier and subscription status")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Subscription updated"),
            @ApiResponse(responseCode = "400", description = "Unknown tier")
    })
    public ResponseEntity<CreditAccount> assignSubscription(
            @Parameter(description = "Owner ID") @PathVariable String ownerId,
            @Valid @RequestBody AssignSubscriptionRequest request) {

        return ResponseEntity.ok(ledgerService.assignSubscription(ownerId, request.getTierId(), request.getStatus()));
    }

    @PostMapping("/reset")
    @Operation(summary = "Run periodic reset", description = "Roll over every account whose period has ended")
    public ResponseEntity<Map<String, Integer>> periodicReset() {
        return ResponseEntity.ok(Map.of("accountsReset", ledgerService.periodicReset()));
    }

    @GetMapping("/{ownerId}/verify")
    @Operation(summary = "Verify balance", description = "Compare the stored balance with the sum of ledger entries")
    public ResponseEntity<CreditLedgerService.BalanceCheck> verifyBalance(
            @Parameter(description = "Owner ID") @PathVariable String ownerId) {

        return ResponseEntity.ok(ledgerService.verifyBalance(ownerId));
    }
}
