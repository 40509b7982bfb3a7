package com.tenacy.labpulse.detection.impl;

import com.tenacy.labpulse.detection.AbstractAnomalyDetector;
import com.tenacy.labpulse.detection.DetectionMethod;
import com.tenacy.labpulse.domain.AnomalyAlert;
import com.tenacy.labpulse.domain.LogEntry;
import com.tenacy.labpulse.domain.Severity;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.stream.Collectors;

/**
 * 시간 윈도우 내 첫 값과 마지막 값 사이의 변화율로 지표 급변을 감지한다.
 */
@Slf4j
@Getter
public class RapidMetricChangeDetector extends AbstractAnomalyDetector {

    public static final String DEFAULT_METRIC = "temperature";
    public static final Duration DEFAULT_WINDOW = Duration.ofMinutes(5);
    public static final double DEFAULT_THRESHOLD_PERCENT = 30.0;

    private final String metricName;
    private final Duration timeWindow;
    private final double thresholdPercent;

    public RapidMetricChangeDetector() {
        this(DEFAULT_METRIC, DEFAULT_WINDOW, DEFAULT_THRESHOLD_PERCENT);
    }

    public RapidMetricChangeDetector(String metricName, Duration timeWindow, double thresholdPercent) {
        super(DetectionMethod.RAPID_CHANGE);
        if (thresholdPercent <= 0.0) {
            throw new IllegalArgumentException("thresholdPercent must be positive: " + thresholdPercent);
        }
        this.metricName = metricName;
        this.timeWindow = timeWindow;
        this.thresholdPercent = thresholdPercent;
    }

    @Override
    public Optional<AnomalyAlert> detect(List<LogEntry> window, LocalDateTime referenceTime) {
        if (window.size() < 2) {
            return Optional.empty();
        }

        List<Double> values = window.stream()
                .filter(entry -> isWithinWindow(entry, referenceTime, timeWindow))
                .map(entry -> entry.numericMetric(metricName))
                .filter(OptionalDouble::isPresent)
                .map(OptionalDouble::getAsDouble)
                .collect(Collectors.toList());

        if (values.size() < 2) {
            return Optional.empty();
        }

        double first = values.get(0);
        double last = values.get(values.size() - 1);

        // 0 에서 출발한 변화율은 정의되지 않음
        if (first == 0.0) {
            return Optional.empty();
        }

        double percentChange = Math.abs((last - first) / first * 100.0);
        if (percentChange < thresholdPercent) {
            return Optional.empty();
        }

        Severity severity = percentChange >= thresholdPercent * 2 ? Severity.HIGH : Severity.MEDIUM;
        String direction = last > first ? "increased" : "decreased";
        long windowMinutes = timeWindow.toMinutes();

        log.debug("Rapid {} change on {}: {}% ({} -> {})",
                metricName, window.get(window.size() - 1).getInstrumentId(), percentChange, first, last);

        return Optional.of(newAlert(window, referenceTime)
                .severity(severity)
                .description(String.format(Locale.ROOT, "Rapid %s change: %s %.1f%% in %d minutes",
                        metricName, direction, percentChange, windowMinutes))
                .confidence(cappedRatio(percentChange, thresholdPercent * 2))
                .suggestedAction("Monitor " + metricName + " closely")
                .suggestedAction("Check for environmental factors")
                .suggestedAction("Verify instrument stability")
                .suggestedAction("Review recent configuration changes")
                .anomalyType("rapid_" + metricName + "_change")
                .metric("metric_name", metricName)
                .metric("initial_value", first)
                .metric("current_value", last)
                .metric("percent_change", percentChange)
                .metric("time_window_minutes", windowMinutes)
                .build());
    }
}
