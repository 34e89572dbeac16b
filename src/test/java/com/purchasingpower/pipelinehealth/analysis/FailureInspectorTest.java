package com.purchasingpower.pipelinehealth.analysis;

import com.purchasingpower.pipelinehealth.ci.PipelineJob;
import com.purchasingpower.pipelinehealth.ci.PipelineRun;
import com.purchasingpower.pipelinehealth.ci.RunOutcome;
import com.purchasingpower.pipelinehealth.configuration.AppProperties;
import com.purchasingpower.pipelinehealth.configuration.AsyncConfig;
import com.purchasingpower.pipelinehealth.exception.MalformedRunDataException;
import com.purchasingpower.pipelinehealth.support.FakeCiProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static com.purchasingpower.pipelinehealth.support.TestRuns.failedJob;
import static com.purchasingpower.pipelinehealth.support.TestRuns.passedJob;
import static com.purchasingpower.pipelinehealth.support.TestRuns.run;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Failure inspector")
class FailureInspectorTest {

    private final AppProperties props = new AppProperties();
    private ThreadPoolTaskExecutor executor;

    @AfterEach
    void shutdown() {
        if (executor != null) {
            executor.shutdown();
        }
    }

    private FailureInspector inspector(FakeCiProvider provider) {
        executor = new AsyncConfig().jobFetchExecutor(props);
        executor.initialize();
        return new FailureInspector(provider, executor, props);
    }

    @Test
    @DisplayName("Should not call the provider when no run failed")
    void inspect_noFailedRuns() {
        FakeCiProvider provider = new FakeCiProvider()
            .withRun(run("s1", RunOutcome.SUCCESS, 5), failedJob("flaky"));

        FailureInspection inspection = inspector(provider).inspect(List.of(run("s1", RunOutcome.SUCCESS, 5)), 0);

        assertThat(inspection.failures()).isEmpty();
        assertThat(inspection.skippedRuns()).isZero();
        assertThat(provider.getJobListings()).isZero();
    }

    @Test
    @DisplayName("Should record failed jobs of failed runs only, in run order")
    void inspect_collectsFailedJobs() {
        PipelineRun f1 = run("f1", RunOutcome.FAILURE, 5);
        PipelineRun s1 = run("s1", RunOutcome.SUCCESS, 5);
        PipelineRun f2 = run("f2", RunOutcome.FAILURE, 5);
        FakeCiProvider provider = new FakeCiProvider()
            .withRun(f1, failedJob("build"), failedJob("lint"), passedJob("test"))
            .withRun(s1, failedJob("ignored"))
            .withRun(f2, failedJob("build"));

        FailureInspection inspection = inspector(provider).inspect(List.of(f1, s1, f2), 2);

        assertThat(inspection.failures()).extracting(FailureRecord::jobName)
            .containsExactly("build", "lint", "build");
        assertThat(inspection.failures()).allSatisfy(failure -> assertThat(failure.failedAt()).isNotNull());
        assertThat(inspection.isDegraded()).isFalse();
        assertThat(provider.getJobListings()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should skip a run whose job listing fails and keep going")
    void inspect_skipsFailedListing() {
        PipelineRun f1 = run("f1", RunOutcome.FAILURE, 5);
        PipelineRun f2 = run("f2", RunOutcome.FAILURE, 5);
        PipelineRun f3 = run("f3", RunOutcome.FAILURE, 5);
        FakeCiProvider provider = new FakeCiProvider()
            .withRun(f1, failedJob("build"))
            .withRun(f2, failedJob("deploy"))
            .withRun(f3, failedJob("build"))
            .failJobListing("f2");

        FailureInspection inspection = inspector(provider).inspect(List.of(f1, f2, f3), 3);

        assertThat(inspection.failures()).extracting(FailureRecord::jobName).containsExactly("build", "build");
        assertThat(inspection.skippedRuns()).isEqualTo(1);
        assertThat(inspection.isDegraded()).isTrue();
    }

    @Test
    @DisplayName("Should skip a run whose job listing exceeds the timeout")
    void inspect_skipsSlowListing() {
        props.getAnalysis().setJobFetchTimeout(Duration.ofMillis(100));
        PipelineRun fast = run("fast", RunOutcome.FAILURE, 5);
        PipelineRun slow = run("slow", RunOutcome.FAILURE, 5);
        FakeCiProvider provider = new FakeCiProvider() {
            @Override
            public List<PipelineJob> listJobs(PipelineRun run) {
                if (run.id().equals("slow")) {
                    sleep(2000);
                }
                return super.listJobs(run);
            }
        }
            .withRun(fast, failedJob("build"))
            .withRun(slow, failedJob("build"));

        FailureInspection inspection = inspector(provider).inspect(List.of(fast, slow), 2);

        assertThat(inspection.failures()).extracting(FailureRecord::jobName).containsExactly("build");
        assertThat(inspection.skippedRuns()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should never have more job listings in flight than the configured concurrency")
    void inspect_boundedConcurrency() {
        props.getAnalysis().setJobFetchConcurrency(2);
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        FakeCiProvider provider = new FakeCiProvider() {
            @Override
            public List<PipelineJob> listJobs(PipelineRun run) {
                int now = inFlight.incrementAndGet();
                maxInFlight.accumulateAndGet(now, Math::max);
                try {
                    sleep(50);
                    return super.listJobs(run);
                } finally {
                    inFlight.decrementAndGet();
                }
            }
        };
        List<PipelineRun> failed = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            PipelineRun run = run("f" + i, RunOutcome.FAILURE, 5);
            provider.withRun(run, failedJob("job-" + i));
            failed.add(run);
        }

        FailureInspection inspection = inspector(provider).inspect(failed, failed.size());

        assertThat(inspection.failures()).hasSize(8);
        assertThat(inspection.failures()).extracting(FailureRecord::jobName)
            .containsExactly("job-0", "job-1", "job-2", "job-3", "job-4", "job-5", "job-6", "job-7");
        assertThat(maxInFlight.get()).isLessThanOrEqualTo(2);
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Test
    @DisplayName("Should not count time spent queued behind busy workers against the timeout")
    void inspect_queuedListingsAreNotTimedOut() {
        // Given - one worker, eight 100ms listings: 800ms in total, 350ms allowed per listing
        props.getAnalysis().setJobFetchConcurrency(1);
        props.getAnalysis().setJobFetchTimeout(Duration.ofMillis(350));
        FakeCiProvider provider = new FakeCiProvider() {
            @Override
            public List<PipelineJob> listJobs(PipelineRun run) {
                sleep(100);
                return super.listJobs(run);
            }
        };
        List<PipelineRun> failed = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            PipelineRun run = run("f" + i, RunOutcome.FAILURE, 5);
            provider.withRun(run, failedJob("build"));
            failed.add(run);
        }

        // When
        FailureInspection inspection = inspector(provider).inspect(failed, failed.size());

        // Then
        assertThat(inspection.skippedRuns()).isZero();
        assertThat(inspection.failures()).hasSize(8);
        assertThat(provider.getJobListings()).isEqualTo(8);
    }

    @Test
    @DisplayName("Should fail the inspection on malformed job data instead of skipping the run")
    void inspect_malformedJobDataIsFatal() {
        PipelineRun f1 = run("f1", RunOutcome.FAILURE, 5);
        PipelineRun f2 = run("f2", RunOutcome.FAILURE, 5);
        FakeCiProvider provider = new FakeCiProvider() {
            @Override
            public List<PipelineJob> listJobs(PipelineRun run) {
                if (run.id().equals("f2")) {
                    throw new MalformedRunDataException("completed_at", "soon", null);
                }
                return super.listJobs(run);
            }
        }
            .withRun(f1, failedJob("build"))
            .withRun(f2, failedJob("build"));

        assertThatThrownBy(() -> inspector(provider).inspect(List.of(f1, f2), 2))
            .isInstanceOf(MalformedRunDataException.class)
            .hasMessage("Unparseable completed_at: 'soon'");
    }
}
