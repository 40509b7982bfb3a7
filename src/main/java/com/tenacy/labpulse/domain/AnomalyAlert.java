package com.tenacy.labpulse.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class AnomalyAlert {
    String id;
    String instrumentId;
    LocalDateTime timestamp;
    Severity severity;
    String description;
    double confidence;

    @Singular
    List<String> suggestedActions;

    String anomalyType;

    @Singular
    Map<String, Object> metrics;
}
