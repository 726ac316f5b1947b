package com.priceintel.backend.controller;

import com.priceintel.backend.model.SubscriptionTier;
import com.priceintel.backend.service.SubscriptionTierCatalog;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/subscription")
@Tag(name = "Subscription", description = "Subscription Plans")
public class SubscriptionController {

    private final SubscriptionTierCatalog tierCatalog;

    public SubscriptionController(SubscriptionTierCatalog tierCatalog) {
        this.tierCatalog = tierCatalog;
    }

    @GetMapping("/tiers")
    @Operation(summary = "List tiers", description = "All subscription tiers with their monthly analysis limits")
    public ResponseEntity<List<SubscriptionTier>> listTiers() {
        return ResponseEntity.ok(tierCatalog.findAll());
    }
}
