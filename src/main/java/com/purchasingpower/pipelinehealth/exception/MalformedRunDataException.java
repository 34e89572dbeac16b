package com.purchasingpower.pipelinehealth.exception;

import lombok.Getter;

/**
 * The CI provider returned a record that breaks its own contract, such as a
 * timestamp outside the expected wire format.
 */
@Getter
public class MalformedRunDataException extends RuntimeException {

    private final String field;

    public MalformedRunDataException(String field, String value, Throwable cause) {
        super("Unparseable " + field + ": '" + value + "'", cause);
        this.field = field;
    }
}
