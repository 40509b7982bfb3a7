package com.tenacy.labpulse.detection;

import com.tenacy.labpulse.domain.HealthReport;
import com.tenacy.labpulse.domain.HealthStatus;
import com.tenacy.labpulse.domain.LogEntry;
import com.tenacy.labpulse.domain.LogLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.tenacy.labpulse.util.LogFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class HealthScorerTest {

    private final HealthScorer healthScorer = new HealthScorer();

    private static List<LogEntry> window(int errors, int warnings, int infos) {
        List<LogEntry> logs = new ArrayList<>();
        for (int i = 0; i < errors; i++) {
            logs.add(entry(REFERENCE_TIME.minusMinutes(i), LogLevel.ERROR, "error"));
        }
        for (int i = 0; i < warnings; i++) {
            logs.add(entry(REFERENCE_TIME.minusMinutes(i), LogLevel.WARNING, "warning"));
        }
        for (int i = 0; i < infos; i++) {
            logs.add(entry(REFERENCE_TIME.minusMinutes(i), LogLevel.INFO, "info"));
        }
        return logs;
    }

    @Test
    @DisplayName("ERROR 10%, WARNING 20% - 91점 excellent")
    void score_ShouldApplyLevelPenalties() {
        HealthReport report = healthScorer.score(window(1, 2, 7));

        assertEquals(HealthStatus.EXCELLENT, report.getStatus());
        assertEquals(91.0, report.getScore());
        assertEquals(10, report.getTotalLogs());
        assertEquals(1, report.getErrorCount());
        assertEquals(2, report.getWarningCount());
        assertEquals(10.0, report.getErrorRatio());
        assertEquals(20.0, report.getWarningRatio());
        assertEquals("Instrument health is excellent (91.0/100)", report.getMessage());
    }

    @Test
    @DisplayName("ERROR 40%, WARNING 60% - 68점 fair")
    void score_ShouldReportFair() {
        HealthReport report = healthScorer.score(window(4, 6, 0));

        assertEquals(HealthStatus.FAIR, report.getStatus());
        assertEquals(68.0, report.getScore());
    }

    @Test
    @DisplayName("DEBUG 로그는 감점 대상이 아님")
    void score_ShouldIgnoreDebugLevel() {
        List<LogEntry> logs = window(0, 1, 0);
        logs.add(entry(REFERENCE_TIME, LogLevel.DEBUG, "trace"));
        logs.add(entry(REFERENCE_TIME, LogLevel.DEBUG, "trace"));
        logs.add(entry(REFERENCE_TIME, LogLevel.DEBUG, "trace"));

        HealthReport report = healthScorer.score(logs);

        assertEquals(95.0, report.getScore());
        assertEquals(HealthStatus.EXCELLENT, report.getStatus());
    }

    @Test
    @DisplayName("빈 윈도우 - unknown, 0점, 별도 메시지")
    void score_ShouldReportUnknownForEmptyWindow() {
        HealthReport report = healthScorer.score(List.of());

        assertEquals(HealthStatus.UNKNOWN, report.getStatus());
        assertEquals(0.0, report.getScore());
        assertEquals("No logs available", report.getMessage());
    }

    @Test
    @DisplayName("점수 구간별 상태 경계")
    void statusFor_ShouldMapScoreBands() {
        assertEquals(HealthStatus.EXCELLENT, HealthScorer.statusFor(90.0));
        assertEquals(HealthStatus.GOOD, HealthScorer.statusFor(89.9));
        assertEquals(HealthStatus.GOOD, HealthScorer.statusFor(75.0));
        assertEquals(HealthStatus.FAIR, HealthScorer.statusFor(50.0));
        assertEquals(HealthStatus.POOR, HealthScorer.statusFor(25.0));
        assertEquals(HealthStatus.CRITICAL, HealthScorer.statusFor(24.9));
    }
}
