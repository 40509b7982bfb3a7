package com.tenacy.labpulse.detection;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 지원하는 이상 감지 방식. 선언 순서대로 실행된다.
 */
public enum DetectionMethod {
    TEMPERATURE("temperature"),
    ERROR_BURST("error_burst"),
    RAPID_CHANGE("rapid_change");

    private final String id;

    DetectionMethod(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    @JsonCreator
    public static DetectionMethod fromId(String id) {
        if (id != null) {
            String normalized = id.trim().toLowerCase(Locale.ROOT);
            for (DetectionMethod method : values()) {
                if (method.id.equals(normalized)) {
                    return method;
                }
            }
        }
        throw new IllegalArgumentException("Unknown detection method: " + id);
    }
}
