package com.purchasingpower.pipelinehealth.configuration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executor used to fan out job listings for failed runs.
 *
 * Sized from {@code app.analysis.job-fetch-concurrency} so a single analysis
 * never has more than that many requests in flight against the CI provider.
 */
@Slf4j
@Configuration
public class AsyncConfig {

    @Bean(name = "jobFetchExecutor")
    public ThreadPoolTaskExecutor jobFetchExecutor(AppProperties props) {
        int concurrency = props.getAnalysis().getJobFetchConcurrency();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(concurrency);
        executor.setMaxPoolSize(concurrency);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("job-fetch-");

        // Saturated pool: the analysing thread fetches the jobs itself
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);

        log.info("Job fetch executor configured: core={}, max={}, queue={}",
                executor.getCorePoolSize(),
                executor.getMaxPoolSize(),
                executor.getQueueCapacity());

        return executor;
    }
}
