package com.tenacy.labpulse.detection;

import com.tenacy.labpulse.domain.HealthReport;
import com.tenacy.labpulse.domain.HealthStatus;
import com.tenacy.labpulse.domain.LogEntry;
import com.tenacy.labpulse.domain.LogLevel;

import java.util.List;
import java.util.Locale;

/**
 * 로그 레벨 분포로 계측기 건강 점수(0~100)와 상태를 계산한다.
 */
public class HealthScorer {

    private static final double ERROR_PENALTY = 50.0;
    private static final double WARNING_PENALTY = 20.0;

    public HealthReport score(List<LogEntry> window) {
        if (window == null || window.isEmpty()) {
            return HealthReport.builder()
                    .status(HealthStatus.UNKNOWN)
                    .score(0.0)
                    .message("No logs available")
                    .build();
        }

        int total = window.size();
        int errors = 0;
        int warnings = 0;
        for (LogEntry entry : window) {
            if (entry.hasLevel(LogLevel.ERROR)) {
                errors++;
            } else if (entry.hasLevel(LogLevel.WARNING)) {
                warnings++;
            }
        }

        double errorRatio = (double) errors / total;
        double warningRatio = (double) warnings / total;
        double score = 100.0 - ERROR_PENALTY * errorRatio - WARNING_PENALTY * warningRatio;
        score = Math.max(0.0, Math.min(100.0, score));

        HealthStatus status = statusFor(score);

        return HealthReport.builder()
                .status(status)
                .score(round(score, 10.0))
                .totalLogs(total)
                .errorCount(errors)
                .warningCount(warnings)
                .errorRatio(round(errorRatio * 100.0, 100.0))
                .warningRatio(round(warningRatio * 100.0, 100.0))
                .message(String.format(Locale.ROOT, "Instrument health is %s (%.1f/100)", status.getLabel(), score))
                .build();
    }

    static HealthStatus statusFor(double score) {
        if (score >= 90) {
            return HealthStatus.EXCELLENT;
        } else if (score >= 75) {
            return HealthStatus.GOOD;
        } else if (score >= 50) {
            return HealthStatus.FAIR;
        } else if (score >= 25) {
            return HealthStatus.POOR;
        }
        return HealthStatus.CRITICAL;
    }

    private static double round(double value, double scale) {
        return Math.round(value * scale) / scale;
    }
}
