package com.purchasingpower.pipelinehealth.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RecommendationPriority {
    HIGH("high"),
    MEDIUM("medium");

    private final String value;

    RecommendationPriority(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
