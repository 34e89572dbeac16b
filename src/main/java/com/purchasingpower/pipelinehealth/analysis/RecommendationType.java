package com.purchasingpower.pipelinehealth.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RecommendationType {
    SUCCESS_RATE("success_rate"),
    DURATION("duration"),
    FAILURE_PATTERN("failure_pattern");

    private final String value;

    RecommendationType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
