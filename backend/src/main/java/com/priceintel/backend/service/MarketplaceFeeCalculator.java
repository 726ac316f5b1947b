package com.priceintel.backend.service;

import com.priceintel.backend.model.MarketplaceRecommendation;
import com.priceintel.backend.model.PriceRange;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Seller fee schedule for the supported marketplaces, used to fill in fees and profit the
 * inference service left out.
 */
@Component
public class MarketplaceFeeCalculator {

    /**
     * Combined selling and payment processing fees per platform.
     */
    enum Platform {
        EBAY(0.159, 0.0),
        AMAZON(0.15, 3.00),
        ETSY(0.095, 0.45),
        FACEBOOK_MARKETPLACE(0.079, 0.30),
        MERCARI(0.129, 0.30),
        // Flat 2.95 below 15, 20% from 15 up
        POSHMARK(0.20, 0.0),
        DEPOP(0.129, 0.30),
        // Buyer pays
        VINTED(0.0, 0.0);

        private static final double POSHMARK_FLAT_FEE = 2.95;
        private static final double POSHMARK_FLAT_FEE_CEILING = 15.0;

        private final double percentage;
        private final double fixedFee;

        Platform(double percentage, double fixedFee) {
            this.percentage = percentage;
            this.fixedFee = fixedFee;
        }

        double feeFor(double salePrice) {
            if (this == POSHMARK && salePrice < POSHMARK_FLAT_FEE_CEILING) {
                return POSHMARK_FLAT_FEE;
            }
            return salePrice * percentage + fixedFee;
        }

        static Optional<Platform> fromName(String name) {
            if (name == null || name.isBlank()) {
                return Optional.empty();
            }
            String key = name.trim().toUpperCase(Locale.ROOT).replaceAll("[\\s-]+", "_");
            if (key.equals("FACEBOOK")) {
                return Optional.of(FACEBOOK_MARKETPLACE);
            }
            for (Platform platform : values()) {
                if (platform.name().equals(key)) {
                    return Optional.of(platform);
                }
            }
            return Optional.empty();
        }
    }

    /**
     * Fees for selling at {@code salePrice}. Unknown platforms and non-positive prices cost nothing.
     */
    public double calculateFees(String platform, double salePrice) {
        if (salePrice <= 0) {
            return 0.0;
        }
        return Platform.fromName(platform)
                .map(p -> round(p.feeFor(salePrice)))
                .orElse(0.0);
    }

    public boolean isSupported(String platform) {
        return Platform.fromName(platform).isPresent();
    }

    /**
     * Fill missing {@code fees} and {@code estimatedProfit} from the median price.
     */
    public void applyDefaults(List<MarketplaceRecommendation> recommendations, PriceRange pricing,
            Double estimatedCost) {
        if (recommendations == null || pricing == null || pricing.getMedian() == null) {
            return;
        }
        double median = pricing.getMedian();
        double cost = estimatedCost != null ? estimatedCost : 0.0;

        for (MarketplaceRecommendation recommendation : recommendations) {
            if (recommendation.getFees() == null) {
                recommendation.setFees(calculateFees(recommendation.getPlatform(), median));
            }
            if (recommendation.getEstimatedProfit() == null) {
                recommendation.setEstimatedProfit(round(median - recommendation.getFees() - cost));
            }
        }
    }

    private static double round(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
