package com.tenacy.labpulse.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum LogLevel {
    INFO("info"),
    WARNING("warning"),
    ERROR("error"),
    DEBUG("debug");

    private final String label;

    LogLevel(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * 계측기 로그 레벨 문자열 변환. "warn" 은 WARNING 으로 취급한다.
     */
    @JsonCreator
    public static LogLevel fromLabel(String label) {
        if (label == null) {
            throw new IllegalArgumentException("Log level must not be null");
        }

        return switch (label.trim().toLowerCase(Locale.ROOT)) {
            case "info" -> INFO;
            case "warning", "warn" -> WARNING;
            case "error" -> ERROR;
            case "debug" -> DEBUG;
            default -> throw new IllegalArgumentException("Unknown log level: " + label);
        };
    }
}
