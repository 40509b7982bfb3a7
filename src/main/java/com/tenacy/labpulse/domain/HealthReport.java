package com.tenacy.labpulse.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class HealthReport {
    HealthStatus status;
    double score;
    int totalLogs;
    int errorCount;
    int warningCount;
    /** 백분율, 소수점 둘째 자리 */
    double errorRatio;
    /** 백분율, 소수점 둘째 자리 */
    double warningRatio;
    String message;
}
