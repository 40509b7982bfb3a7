package com.tenacy.labpulse.detection.impl;

import com.tenacy.labpulse.detection.AbstractAnomalyDetector;
import com.tenacy.labpulse.detection.DetectionMethod;
import com.tenacy.labpulse.domain.AnomalyAlert;
import com.tenacy.labpulse.domain.LogEntry;
import com.tenacy.labpulse.domain.Severity;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.stream.Collectors;

/**
 * 가장 최근 온도 값의 z-score 로 급등/급락을 감지한다.
 * 평균과 표본 표준편차는 최신 값을 포함한 윈도우 전체 온도로 계산한다.
 */
@Slf4j
@Getter
public class TemperatureZScoreDetector extends AbstractAnomalyDetector {

    public static final String METRIC = "temperature";
    public static final double DEFAULT_Z_THRESHOLD = 3.0;
    static final int MIN_SAMPLES = 5;

    private final double zThreshold;

    public TemperatureZScoreDetector() {
        this(DEFAULT_Z_THRESHOLD);
    }

    public TemperatureZScoreDetector(double zThreshold) {
        super(DetectionMethod.TEMPERATURE);
        this.zThreshold = zThreshold;
    }

    @Override
    public Optional<AnomalyAlert> detect(List<LogEntry> window, LocalDateTime referenceTime) {
        List<Double> readings = window.stream()
                .map(entry -> entry.numericMetric(METRIC))
                .filter(OptionalDouble::isPresent)
                .map(OptionalDouble::getAsDouble)
                .collect(Collectors.toList());

        if (readings.size() < MIN_SAMPLES) {
            return Optional.empty();
        }

        double mean = mean(readings);
        double std = sampleStdDev(readings, mean);
        double latest = readings.get(readings.size() - 1);
        double z = zScore(latest, mean, std);

        // 합계 overflow 시 z 가 NaN 이 될 수 있음
        if (!(z > zThreshold)) {
            return Optional.empty();
        }

        Severity severity = severityFor(z);
        String direction = latest > mean ? "spike" : "drop";

        log.debug("Temperature {} on {}: latest={}, mean={}, z={}",
                direction, window.get(window.size() - 1).getInstrumentId(), latest, mean, z);

        return Optional.of(newAlert(window, referenceTime)
                .severity(severity)
                .description(String.format(Locale.ROOT,
                        "Temperature %s detected: %.2f°C (mean: %.2f°C, z-score: %.2f)",
                        direction, latest, mean, z))
                .confidence(cappedRatio(z, 5.0))
                .suggestedAction("Check temperature sensor calibration")
                .suggestedAction("Verify HVAC system operation")
                .suggestedAction("spike".equals(direction)
                        ? "Inspect instrument cooling system"
                        : "Check heating element")
                .suggestedAction("Review recent maintenance logs")
                .anomalyType("temperature_" + direction)
                .metric("current_temp", latest)
                .metric("mean_temp", mean)
                .metric("std_temp", std)
                .metric("z_score", z)
                .build());
    }

    /**
     * z &gt; 5 CRITICAL, z &gt; 4 HIGH, z &gt; 3 MEDIUM, 그 외 LOW.
     * 기본 임계값(3.0)에서는 LOW 가 나올 수 없지만 임계값을 낮추면 도달한다.
     */
    static Severity severityFor(double z) {
        if (z > 5.0) {
            return Severity.CRITICAL;
        } else if (z > 4.0) {
            return Severity.HIGH;
        } else if (z > 3.0) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }

    static double zScore(double value, double mean, double std) {
        if (std == 0.0) {
            return 0.0;
        }
        return Math.abs(value - mean) / std;
    }

    private static double mean(List<Double> values) {
        double sum = 0.0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.size();
    }

    private static double sampleStdDev(List<Double> values, double mean) {
        if (values.size() < 2) {
            return 0.0;
        }

        double squares = 0.0;
        for (double value : values) {
            squares += (value - mean) * (value - mean);
        }
        return Math.sqrt(squares / (values.size() - 1));
    }
}
