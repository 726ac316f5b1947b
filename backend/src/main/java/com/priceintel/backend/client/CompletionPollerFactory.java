package com.priceintel.backend.client;

import com.priceintel.backend.config.PriceIntelProperties;
import com.priceintel.backend.dto.AnalysisJobResponse;
import com.priceintel.backend.service.AnalysisJobService;
import org.springframework.stereotype.Component;

/**
 * Builds pollers with the configured interval and maximum wait.
 */
@Component
public class CompletionPollerFactory {

    private final AnalysisJobService jobService;
    private final PriceIntelProperties.PollerConfig config;

    public CompletionPollerFactory(AnalysisJobService jobService, PriceIntelProperties properties) {
        this.jobService = jobService;
        this.config = properties.getPoller();
    }

    /**
     * Poller reading the owner's job straight from the job service.
     */
    public CompletionPoller forOwner(String ownerId) {
        return create(jobId -> AnalysisJobResponse.from(jobService.getJob(jobId, ownerId)));
    }

    public CompletionPoller create(JobStateFetcher fetcher) {
        return new CompletionPoller(fetcher, config.getInterval(), config.getMaxWait());
    }
}
