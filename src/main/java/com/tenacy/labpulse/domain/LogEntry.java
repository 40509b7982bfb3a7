package com.tenacy.labpulse.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * 계측기에서 수집된 단일 로그 항목. 분석 엔진은 이 값을 읽기만 한다.
 */
@Value
@Builder(toBuilder = true)
public class LogEntry {
    String id;
    String instrumentId;
    LocalDateTime timestamp;
    LogLevel level;
    String message;

    @Singular("metric")
    Map<String, Object> metadata;

    /**
     * 메타데이터에서 숫자형 지표 값을 꺼낸다. 값이 없거나 숫자가 아니면 비어 있다.
     */
    public OptionalDouble numericMetric(String name) {
        Object value = metadata.get(name);
        if (!(value instanceof Number)) {
            return OptionalDouble.empty();
        }

        double number = ((Number) value).doubleValue();
        return Double.isFinite(number) ? OptionalDouble.of(number) : OptionalDouble.empty();
    }

    public boolean hasLevel(LogLevel expected) {
        return level == expected;
    }

    public String getMessage() {
        return message != null ? message : "";
    }
}
