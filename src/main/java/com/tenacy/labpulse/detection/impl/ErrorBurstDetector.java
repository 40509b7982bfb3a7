package com.tenacy.labpulse.detection.impl;

import com.tenacy.labpulse.detection.AbstractAnomalyDetector;
import com.tenacy.labpulse.detection.DetectionMethod;
import com.tenacy.labpulse.domain.AnomalyAlert;
import com.tenacy.labpulse.domain.LogEntry;
import com.tenacy.labpulse.domain.LogLevel;
import com.tenacy.labpulse.domain.Severity;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 기준 시각 이전 일정 시간 동안 ERROR 로그가 몰려 발생하는 패턴 감지
 */
@Slf4j
@Getter
public class ErrorBurstDetector extends AbstractAnomalyDetector {

    public static final Duration DEFAULT_WINDOW = Duration.ofMinutes(10);
    public static final int DEFAULT_THRESHOLD = 5;
    private static final int MAX_REPORTED_MESSAGES = 5;

    private final Duration timeWindow;
    private final int thresholdCount;

    public ErrorBurstDetector() {
        this(DEFAULT_WINDOW, DEFAULT_THRESHOLD);
    }

    public ErrorBurstDetector(Duration timeWindow, int thresholdCount) {
        super(DetectionMethod.ERROR_BURST);
        if (thresholdCount <= 0) {
            throw new IllegalArgumentException("thresholdCount must be positive: " + thresholdCount);
        }
        this.timeWindow = timeWindow;
        this.thresholdCount = thresholdCount;
    }

    @Override
    public Optional<AnomalyAlert> detect(List<LogEntry> window, LocalDateTime referenceTime) {
        if (window.isEmpty()) {
            return Optional.empty();
        }

        List<LogEntry> recentErrors = window.stream()
                .filter(entry -> entry.hasLevel(LogLevel.ERROR))
                .filter(entry -> isWithinWindow(entry, referenceTime, timeWindow))
                .collect(Collectors.toList());

        int errorCount = recentErrors.size();
        if (errorCount < thresholdCount) {
            return Optional.empty();
        }

        Set<String> uniqueMessages = new LinkedHashSet<>();
        recentErrors.forEach(entry -> uniqueMessages.add(entry.getMessage()));
        List<String> reportedMessages = new ArrayList<>(uniqueMessages).subList(0,
                Math.min(uniqueMessages.size(), MAX_REPORTED_MESSAGES));

        long windowMinutes = timeWindow.toMinutes();
        log.debug("Error burst on {}: {} errors in {} minutes",
                window.get(window.size() - 1).getInstrumentId(), errorCount, windowMinutes);

        return Optional.of(newAlert(window, referenceTime)
                .severity(severityFor(errorCount))
                .description(String.format("Error burst detected: %d errors in %d minutes",
                        errorCount, windowMinutes))
                .confidence(cappedRatio(errorCount, thresholdCount * 3.0))
                .suggestedAction("Review error logs for patterns")
                .suggestedAction("Check instrument connectivity")
                .suggestedAction("Restart instrument if safe to do so")
                .suggestedAction("Contact technical support if errors persist")
                .suggestedAction("Document error sequence for diagnostics")
                .anomalyType("error_burst")
                .metric("error_count", errorCount)
                .metric("time_window_minutes", windowMinutes)
                .metric("unique_errors", uniqueMessages.size())
                .metric("error_messages", List.copyOf(reportedMessages))
                .build());
    }

    Severity severityFor(int errorCount) {
        if (errorCount >= thresholdCount * 3) {
            return Severity.CRITICAL;
        } else if (errorCount >= thresholdCount * 2) {
            return Severity.HIGH;
        }
        return Severity.MEDIUM;
    }
}
