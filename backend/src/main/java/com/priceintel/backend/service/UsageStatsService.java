package com.priceintel.backend.service;

import com.priceintel.backend.model.AnalysisJob;
import com.priceintel.backend.model.CreditAccount;
import com.priceintel.backend.model.JobStatus;
import com.priceintel.backend.model.MarketplaceRecommendation;
import com.priceintel.backend.model.SubscriptionTier;
import com.priceintel.backend.model.UsageStats;
import com.priceintel.backend.repository.AnalysisJobRepository;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;

@Service
public class UsageStatsService {

    private final CreditLedgerService ledgerService;
    private final AnalysisJobRepository jobRepository;

    public UsageStatsService(CreditLedgerService ledgerService, AnalysisJobRepository jobRepository) {
        this.ledgerService = ledgerService;
        this.jobRepository = jobRepository;
    }

    public UsageStats getUsageStats(String ownerId) {
        CreditAccount account = ledgerService.loadAccount(ownerId);
        SubscriptionTier tier = ledgerService.tierFor(account);
        CreditLedgerService.BillingPeriod period = ledgerService.currentPeriod(account);
        long periodUsage = ledgerService.periodUsage(account);

        return UsageStats.builder()
                .totalAnalyses(jobRepository.countByOwnerId(ownerId))
                .analysesThisPeriod(jobRepository.countByOwnerIdAndCreatedAtGreaterThanEqual(
                        ownerId, period.start()))
                .creditsUsed(periodUsage)
                .creditsRemaining(account.getBalance())
                .currentPeriodUsage(periodUsage)
                .subscriptionLimit(tier.monthlyAnalysisLimit())
                .subscriptionTier(tier.id())
                .subscriptionStatus(account.getSubscriptionStatus())
                .canAnalyze(ledgerService.canConsume(ownerId))
                .periodStart(period.start())
                .resetDate(period.end())
                .averageProfit(averageProfit(ownerId))
                .build();
    }

    /**
     * Mean estimated profit of each completed job's most suitable marketplace, positive profits only.
     */
    double averageProfit(String ownerId) {
        double average = jobRepository.findByOwnerIdAndStatus(ownerId, JobStatus.COMPLETED).stream()
                .map(UsageStatsService::topRecommendation)
                .flatMap(Optional::stream)
                .map(MarketplaceRecommendation::getEstimatedProfit)
                .filter(Objects::nonNull)
                .filter(profit -> profit > 0)
                .mapToDouble(Double::doubleValue)
                .average()
                .orElse(0.0);
        return BigDecimal.valueOf(average).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    private static Optional<MarketplaceRecommendation> topRecommendation(AnalysisJob job) {
        if (job.getMarketplaceRecommendations() == null) {
            return Optional.empty();
        }
        return job.getMarketplaceRecommendations().stream()
                .max(Comparator.comparing(
                        (MarketplaceRecommendation r) -> r.getSuitability() != null ? r.getSuitability() : 0));
    }
}
