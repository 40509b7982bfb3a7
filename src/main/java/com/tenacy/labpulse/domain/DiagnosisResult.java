package com.tenacy.labpulse.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;

@Value
@Builder
public class DiagnosisResult {
    String id;
    String instrumentId;
    LocalDateTime timestamp;

    /** 확률 내림차순, 최대 5개 */
    @Singular
    List<ProbableCause> probableCauses;

    /** 중복 제거된 조치 목록, 최대 8개 */
    @Singular
    List<String> recommendedActions;

    double confidence;
    Severity urgency;

    @Singular
    List<String> matchedRules;

    LogSummary logSummary;
}
