package com.purchasingpower.pipelinehealth.exception;

import lombok.Getter;

/**
 * A call to the CI provider failed: transport error, rejected credentials,
 * rate limiting, or a resource that does not exist.
 */
@Getter
public class CiProviderException extends RuntimeException {

    /**
     * HTTP status returned by the provider, or 0 when no response was received.
     */
    private final int statusCode;

    public CiProviderException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public CiProviderException(String message, Throwable cause) {
        this(message, 0, cause);
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }
}
