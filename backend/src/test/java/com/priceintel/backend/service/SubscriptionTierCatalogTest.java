package com.priceintel.backend.service;

import com.priceintel.backend.TestFixtures;
import com.priceintel.backend.config.PriceIntelProperties;
import com.priceintel.backend.model.SubscriptionTier;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SubscriptionTierCatalogTest {

    private final SubscriptionTierCatalog catalog = new SubscriptionTierCatalog(TestFixtures.properties());

    @Test
    void shouldListTiersByPriority() {
        List<String> ids = catalog.findAll().stream().map(SubscriptionTier::id).toList();

        assertEquals(List.of("free_trial", "basic", "pro", "business", "enterprise"), ids);
    }

    @Test
    void shouldLookUpByPriceId() {
        var tier = catalog.findByPriceId("price_pro_monthly");

        assertTrue(tier.isPresent());
        assertEquals("pro", tier.get().id());
        assertEquals(200, tier.get().monthlyAnalysisLimit());
        assertTrue(catalog.findByPriceId("price_unknown").isEmpty());
    }

    @Test
    void shouldResolveUnknownTierToDefault() {
        assertEquals("free_trial", catalog.getDefaultTier().id());
        assertEquals(2, catalog.resolve("platinum").monthlyAnalysisLimit());
        assertEquals(5000, catalog.resolve("enterprise").monthlyAnalysisLimit());
    }

    @Test
    void shouldRejectMissingDefaultTier() {
        PriceIntelProperties properties = TestFixtures.properties();
        properties.getSubscription().setDefaultTier("starter");

        assertThrows(IllegalStateException.class, () -> new SubscriptionTierCatalog(properties));
    }
}
