package com.tenacy.labpulse.detection;

import com.tenacy.labpulse.detection.impl.ErrorBurstDetector;
import com.tenacy.labpulse.detection.impl.RapidMetricChangeDetector;
import com.tenacy.labpulse.detection.impl.TemperatureZScoreDetector;
import com.tenacy.labpulse.domain.AnomalyAlert;
import com.tenacy.labpulse.domain.LogEntry;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 같은 로그 윈도우에 선택된 감지기를 모두 실행하고 발생한 알림을 모은다.
 * 감지기끼리는 독립적이며 결과를 병합하거나 중복 제거하지 않는다.
 */
@Slf4j
public class AnomalyAggregator {

    private final Map<DetectionMethod, AnomalyDetector> detectors = new EnumMap<>(DetectionMethod.class);

    public AnomalyAggregator(List<AnomalyDetector> detectorList) {
        for (AnomalyDetector detector : detectorList) {
            AnomalyDetector previous = detectors.put(detector.getMethod(), detector);
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate detector for method " + detector.getMethod());
            }
        }
        log.info("Initialized AnomalyAggregator with detectors {}", detectors.keySet());
    }

    public static AnomalyAggregator withDefaults() {
        return new AnomalyAggregator(List.of(
                new TemperatureZScoreDetector(),
                new ErrorBurstDetector(),
                new RapidMetricChangeDetector()));
    }

    public List<AnomalyAlert> detect(List<LogEntry> window, LocalDateTime referenceTime) {
        return detect(window, EnumSet.allOf(DetectionMethod.class), referenceTime);
    }

    public List<AnomalyAlert> detect(List<LogEntry> window, Set<DetectionMethod> methods, LocalDateTime referenceTime) {
        if (window == null || window.isEmpty()) {
            return Collections.emptyList();
        }

        List<AnomalyAlert> alerts = new ArrayList<>();

        // EnumMap 순회 순서 = DetectionMethod 선언 순서
        for (Map.Entry<DetectionMethod, AnomalyDetector> entry : detectors.entrySet()) {
            if (!methods.contains(entry.getKey())) {
                continue;
            }

            entry.getValue().detect(window, referenceTime).ifPresent(alert -> {
                log.debug("Detector {} fired: {} ({})", entry.getKey().getId(), alert.getAnomalyType(), alert.getSeverity());
                alerts.add(alert);
            });
        }

        return alerts;
    }

    public Set<DetectionMethod> getAvailableMethods() {
        return Collections.unmodifiableSet(detectors.keySet());
    }
}
