package com.tenacy.labpulse.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum HealthStatus {
    EXCELLENT("excellent"),
    GOOD("good"),
    FAIR("fair"),
    POOR("poor"),
    CRITICAL("critical"),
    UNKNOWN("unknown");

    private final String label;

    HealthStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
