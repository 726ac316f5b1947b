package com.priceintel.backend.service;

import com.priceintel.backend.config.PriceIntelProperties;
import com.priceintel.backend.model.SubscriptionTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Process-wide, read-only catalog of subscription tiers loaded from configuration at startup.
 */
@Service
public class SubscriptionTierCatalog {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionTierCatalog.class);

    private final Map<String, SubscriptionTier> tiersById;
    private final SubscriptionTier defaultTier;

    public SubscriptionTierCatalog(PriceIntelProperties properties) {
        Map<String, SubscriptionTier> tiers = new LinkedHashMap<>();
        for (PriceIntelProperties.TierConfig config : properties.getSubscription().getTiers()) {
            if (config.getId() == null || config.getId().isBlank()) {
                throw new IllegalStateException("Subscription tier without id in configuration");
            }
            if (config.getMonthlyAnalysisLimit() < 0) {
                throw new IllegalStateException("Negative analysis limit for tier: " + config.getId());
            }
            tiers.put(config.getId(), new SubscriptionTier(
                    config.getId(),
                    config.getName() != null ? config.getName() : config.getId(),
                    config.getPriceId(),
                    config.getMonthlyAnalysisLimit(),
                    config.getPriority()));
        }

        String defaultTierId = properties.getSubscription().getDefaultTier();
        SubscriptionTier fallback = tiers.get(defaultTierId);
        if (fallback == null) {
            throw new IllegalStateException("Default subscription tier is not configured: " + defaultTierId);
        }

        this.tiersById = Map.copyOf(tiers);
        this.defaultTier = fallback;
        log.info("Loaded {} subscription tiers, default: {}", tiers.size(), defaultTierId);
    }

    public List<SubscriptionTier> findAll() {
        return tiersById.values().stream()
                .sorted(Comparator.comparingInt(SubscriptionTier::priority)
                        .thenComparingInt(SubscriptionTier::monthlyAnalysisLimit))
                .toList();
    }

    public Optional<SubscriptionTier> findById(String tierId) {
        return Optional.ofNullable(tierId).map(tiersById::get);
    }

    public Optional<SubscriptionTier> findByPriceId(String priceId) {
        if (priceId == null) {
            return Optional.empty();
        }
        return tiersById.values().stream()
                .filter(tier -> priceId.equals(tier.priceId()))
                .findFirst();
    }

    public SubscriptionTier getDefaultTier() {
        return defaultTier;
    }

    /**
     * Tier that governs the allowance: the assigned tier, or the default when unknown.
     */
    public SubscriptionTier resolve(String tierId) {
        return findById(tierId).orElse(defaultTier);
    }
}
