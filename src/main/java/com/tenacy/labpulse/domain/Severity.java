package com.tenacy.labpulse.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 알림 심각도 및 진단 긴급도. 선언 순서가 곧 우선순위이다 (LOW &lt; MEDIUM &lt; HIGH &lt; CRITICAL).
 */
public enum Severity {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    CRITICAL("critical");

    private final String label;

    Severity(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public static Severity max(Severity a, Severity b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    @JsonCreator
    public static Severity fromLabel(String label) {
        if (label == null) {
            throw new IllegalArgumentException("Severity must not be null");
        }
        for (Severity severity : values()) {
            if (severity.label.equals(label.trim().toLowerCase(Locale.ROOT))) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown severity: " + label);
    }
}
