package com.priceintel.backend.client;

import com.priceintel.backend.dto.AnalysisJobResponse;
import com.priceintel.backend.model.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Fetches a job at a fixed interval until it is terminal or the maximum wait has passed.
 * Giving up never touches the job; it keeps running server side.
 */
public class CompletionPoller {

    private static final Logger log = LoggerFactory.getLogger(CompletionPoller.class);

    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(2);
    public static final Duration DEFAULT_MAX_WAIT = Duration.ofMinutes(5);

    private final JobStateFetcher fetcher;
    private final Duration interval;
    private final Duration maxWait;
    private final Clock clock;
    private final Sleeper sleeper;

    public CompletionPoller(JobStateFetcher fetcher) {
        this(fetcher, DEFAULT_INTERVAL, DEFAULT_MAX_WAIT);
    }

    public CompletionPoller(JobStateFetcher fetcher, Duration interval, Duration maxWait) {
        this(fetcher, interval, maxWait, Clock.systemUTC(), Sleeper.SYSTEM);
    }

    public CompletionPoller(JobStateFetcher fetcher, Duration interval, Duration maxWait, Clock clock,
            Sleeper sleeper) {
        if (interval == null || interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("Poll interval must be positive");
        }
        if (maxWait == null || maxWait.isNegative()) {
            throw new IllegalArgumentException("Maximum wait must not be negative");
        }
        this.fetcher = fetcher;
        this.interval = interval;
        this.maxWait = maxWait;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Block until the job is terminal, the deadline passes, or the thread is interrupted.
     */
    public PollResult poll(String jobId) {
        Instant start = clock.instant();
        Instant deadline = start.plus(maxWait);
        AnalysisJobResponse last = null;
        int attempts = 0;

        while (true) {
            if (Thread.currentThread().isInterrupted()) {
                return finish(jobId, PollResult.Outcome.CANCELLED, last, attempts, start);
            }

            attempts++;
            try {
                AnalysisJobResponse current = fetcher.fetch(jobId);
                if (current != null) {
                    last = current;
                    if (current.getStatus() == JobStatus.COMPLETED) {
                        return finish(jobId, PollResult.Outcome.COMPLETED, current, attempts, start);
                    }
                    if (current.getStatus() == JobStatus.FAILED) {
                        return finish(jobId, PollResult.Outcome.FAILED, current, attempts, start);
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return finish(jobId, PollResult.Outcome.CANCELLED, last, attempts, start);
            } catch (Exception e) {
                log.warn("[POLLER] Fetch {} for job: {} failed, retrying - {}", attempts, jobId, e.getMessage());
            }

            Instant now = clock.instant();
            if (!now.isBefore(deadline)) {
                return finish(jobId, PollResult.Outcome.TIMEOUT, last, attempts, start);
            }

            Duration remaining = Duration.between(now, deadline);
            try {
                sleeper.sleep(remaining.compareTo(interval) < 0 ? remaining : interval);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return finish(jobId, PollResult.Outcome.CANCELLED, last, attempts, start);
            }

            if (!clock.instant().isBefore(deadline)) {
                return finish(jobId, PollResult.Outcome.TIMEOUT, last, attempts, start);
            }
        }
    }

    /**
     * Run {@link #poll} on {@code executor}. Cancelling the future with interruption stops the loop.
     */
    public Future<PollResult> pollAsync(String jobId, ExecutorService executor) {
        return executor.submit(() -> poll(jobId));
    }

    private PollResult finish(String jobId, PollResult.Outcome outcome, AnalysisJobResponse last,
            int attempts, Instant start) {
        Duration elapsed = Duration.between(start, clock.instant());
        if (outcome == PollResult.Outcome.TIMEOUT) {
            log.warn("[POLLER] Gave up on job: {} after {} ({} fetches)", jobId, elapsed, attempts);
        } else {
            log.info("[POLLER] Job: {} -> {} after {} ({} fetches)", jobId, outcome, elapsed, attempts);
        }
        return new PollResult(outcome, last, attempts, elapsed);
    }
}
