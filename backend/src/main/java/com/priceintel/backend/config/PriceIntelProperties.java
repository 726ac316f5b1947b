package com.priceintel.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Strongly-typed binding for {@code priceintel.*} properties.
 *
 * <pre>
 * priceintel:
 *   subscription:
 *     default-tier: free_trial
 *     tiers:
 *       - id: pro
 *         name: Pro
 *         price-id: price_pro_monthly
 *         monthly-analysis-limit: 200
 *         priority: 2
 *   credits:
 *     reservation-ttl: 15m
 *     max-write-attempts: 5
 *   analysis:
 *     executor:
 *       core-pool-size: 4
 *   poller:
 *     interval: 2s
 *     max-wait: 5m
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "priceintel")
public class PriceIntelProperties {

    @NestedConfigurationProperty
    private SubscriptionConfig subscription = new SubscriptionConfig();

    @NestedConfigurationProperty
    private CreditsConfig credits = new CreditsConfig();

    @NestedConfigurationProperty
    private AnalysisConfig analysis = new AnalysisConfig();

    @NestedConfigurationProperty
    private PollerConfig poller = new PollerConfig();

    @Data
    public static class SubscriptionConfig {
        /** Tier applied to owners without an active subscription. */
        private String defaultTier = "free_trial";
        private List<TierConfig> tiers = new ArrayList<>();
    }

    @Data
    public static class TierConfig {
        private String id;
        private String name;
        private String priceId;
        private int monthlyAnalysisLimit;
        private int priority;
    }

    @Data
    public static class CreditsConfig {
        /** How long a submission's quota claim survives without a debit or release. */
        private Duration reservationTtl = Duration.ofMinutes(15);
        private int maxWriteAttempts = 5;
    }

    @Data
    public static class AnalysisConfig {
        @NestedConfigurationProperty
        private ExecutorConfig executor = new ExecutorConfig();
    }

    @Data
    public static class ExecutorConfig {
        private int corePoolSize = 4;
        private int maxPoolSize = 16;
        private int queueCapacity = 500;
    }

    @Data
    public static class PollerConfig {
        private Duration interval = Duration.ofSeconds(2);
        private Duration maxWait = Duration.ofMinutes(5);
    }
}
