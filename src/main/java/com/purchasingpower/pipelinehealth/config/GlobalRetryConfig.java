package com.purchasingpower.pipelinehealth.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Retry configuration for transient failures of outbound CI provider calls.
 *
 * <p>Retries happen inside the transport layer only. The analysis engine itself
 * never retries: a call that still fails after these attempts is reported to
 * the caller as it is.
 *
 * <p>Properties are loaded from the {@code app.retry} namespace in application.yml.
 * Example configuration:
 * <pre>
 * app:
 *   retry:
 *     max-attempts: 2
 *     backoff-ms: 500
 *     max-backoff-ms: 5000
 * </pre>
 *
 * <p><b>Exponential Backoff Calculation:</b>
 * For retry N (starting at 0), the delay is roughly:
 * <pre>
 *   delay = min(backoff-ms * 2^N, max-backoff-ms)  (plus jitter)
 * </pre>
 *
 * @since 1.0.0
 */
@ConfigurationProperties(prefix = "app.retry")
@Data
public class GlobalRetryConfig {

    /**
     * Number of retries after the initial attempt. Zero disables retrying.
     */
    private int maxAttempts = 2;

    /**
     * Initial backoff delay in milliseconds before the first retry.
     */
    private long backoffMs = 500;

    /**
     * Maximum backoff delay in milliseconds between any two attempts.
     */
    private long maxBackoffMs = 5000;
}
