package com.purchasingpower.pipelinehealth.analysis;

import com.purchasingpower.pipelinehealth.ci.CiProvider;
import com.purchasingpower.pipelinehealth.ci.PipelineJob;
import com.purchasingpower.pipelinehealth.ci.PipelineRun;
import com.purchasingpower.pipelinehealth.ci.RunOutcome;
import com.purchasingpower.pipelinehealth.configuration.AppProperties;
import com.purchasingpower.pipelinehealth.exception.CiProviderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Collects the failed jobs of failed runs.
 *
 * <p>Job listings of different runs are independent, so they are fetched
 * concurrently on the bounded {@code jobFetchExecutor} and joined before
 * returning. A run whose listing fails at the provider or times out is
 * skipped: it contributes no records and is counted in
 * {@link FailureInspection#skippedRuns()}. The timeout of a listing starts
 * when a worker picks it up, so time spent queued behind the concurrency
 * limit never counts against it. Any other exception, such as malformed job
 * data, fails the whole inspection.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class FailureInspector {

    private final CiProvider ciProvider;
    private final Executor executor;
    private final Duration fetchTimeout;

    public FailureInspector(CiProvider ciProvider,
                            @Qualifier("jobFetchExecutor") Executor executor,
                            AppProperties props) {
        this.ciProvider = ciProvider;
        this.executor = executor;
        this.fetchTimeout = props.getAnalysis().getJobFetchTimeout();
    }

    /**
     * @param runs Analyzed runs
     * @param failedRuns Number of runs with a failure outcome; zero skips all provider calls
     */
    public FailureInspection inspect(List<PipelineRun> runs, int failedRuns) {
        if (failedRuns == 0) {
            return FailureInspection.empty();
        }

        List<PipelineRun> failed = runs.stream()
            .filter(run -> run.outcome() == RunOutcome.FAILURE)
            .toList();

        log.debug("Fetching jobs of {} failed runs", failed.size());

        List<CompletableFuture<List<FailureRecord>>> fetches = failed.stream()
            .map(this::fetchFailedJobs)
            .toList();

        List<FailureRecord> failures = new ArrayList<>();
        int skipped = 0;
        for (CompletableFuture<List<FailureRecord>> fetch : fetches) {
            List<FailureRecord> records = join(fetch);
            if (records == null) {
                skipped++;
            } else {
                failures.addAll(records);
            }
        }

        if (skipped > 0) {
            log.warn("Failure inspection degraded: {} of {} failed runs skipped", skipped, failed.size());
        }
        return new FailureInspection(failures, skipped);
    }

    /**
     * Completes with the run's failed jobs, or with null when the run has to be skipped.
     */
    private CompletableFuture<List<FailureRecord>> fetchFailedJobs(PipelineRun run) {
        CompletableFuture<List<FailureRecord>> listing = new CompletableFuture<>();
        executor.execute(() -> {
            listing.orTimeout(fetchTimeout.toMillis(), TimeUnit.MILLISECONDS);
            try {
                listing.complete(failedJobsOf(run));
            } catch (RuntimeException e) {
                listing.completeExceptionally(e);
            }
        });

        return listing.handle((records, ex) -> {
            if (ex == null) {
                return records;
            }
            Throwable cause = unwrap(ex);
            if (cause instanceof TimeoutException) {
                log.warn("Skipping run {}: job listing timed out after {}", run.id(), fetchTimeout);
                return null;
            }
            if (cause instanceof CiProviderException) {
                log.warn("Skipping run {}: job listing failed: {}", run.id(), cause.getMessage());
                return null;
            }
            throw new CompletionException(cause);
        });
    }

    private static List<FailureRecord> join(CompletableFuture<List<FailureRecord>> fetch) {
        try {
            return fetch.join();
        } catch (CompletionException e) {
            Throwable cause = unwrap(e);
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }
    }

    private static Throwable unwrap(Throwable ex) {
        Throwable cause = ex;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    private List<FailureRecord> failedJobsOf(PipelineRun run) {
        List<PipelineJob> jobs = ciProvider.listJobs(run);
        return jobs.stream()
            .filter(job -> job.outcome() == RunOutcome.FAILURE)
            .map(job -> new FailureRecord(job.name(), job.completedAt()))
            .toList();
    }
}
