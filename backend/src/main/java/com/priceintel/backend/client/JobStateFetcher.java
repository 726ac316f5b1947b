package com.priceintel.backend.client;

import com.priceintel.backend.dto.AnalysisJobResponse;

/**
 * Source of the current state of one job, either in-process or over HTTP.
 */
@FunctionalInterface
public interface JobStateFetcher {

    AnalysisJobResponse fetch(String jobId) throws Exception;
}
