package com.purchasingpower.pipelinehealth.client;

import org.slf4j.Logger;

import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Log trail of one outbound CI provider call.
 *
 * <p>Every line carries the provider, the operation and a short call id, so
 * the start, retries and outcome of one call can be matched in the log.
 * Bodies are only logged at DEBUG, truncated.
 */
final class ProviderCall {

    private static final int MAX_BODY_LOG_CHARS = 200;

    private final String callId = UUID.randomUUID().toString().substring(0, 8);
    private final long startNanos = System.nanoTime();
    private final String provider;
    private final String operation;
    private final String target;
    private final Logger logger;
    private int retries;

    private ProviderCall(String provider, String operation, String target, Logger logger) {
        this.provider = provider;
        this.operation = operation;
        this.target = target;
        this.logger = logger;
    }

    static ProviderCall start(String provider, String operation, String target, Logger logger) {
        ProviderCall call = new ProviderCall(provider, operation, target, logger);
        logger.info("{} → {} {} [{}]", provider, operation, target, call.callId);
        return call;
    }

    void retrying(long attempt, Throwable failure) {
        retries++;
        logger.warn("{} ↻ {} {} [{}] retry #{} after: {}",
            provider, operation, target, callId, attempt + 1, failure.getMessage());
    }

    void succeeded(Object body) {
        logger.info("{} ← {} [{}] ({}ms, {} retries)", provider, operation, callId, elapsedMs(), retries);
        if (logger.isDebugEnabled()) {
            logger.debug("  Response: {}", body == null ? "(empty)" : truncate(body.toString()));
        }
    }

    void failed(String reason, Throwable ex) {
        logger.warn("{} ✖ {} {} [{}] ({}ms, {} retries) - {}",
            provider, operation, target, callId, elapsedMs(), retries, reason);
        logger.debug("  Error details:", ex);
    }


    long elapsedMs() {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    static String truncate(String text) {
        if (text.length() <= MAX_BODY_LOG_CHARS) {
            return text;
        }
        return text.substring(0, MAX_BODY_LOG_CHARS) + "... [+" + (text.length() - MAX_BODY_LOG_CHARS) + " chars]";
    }
}
