package com.tenacy.labpulse.detection;

import com.tenacy.labpulse.domain.AnomalyAlert;
import com.tenacy.labpulse.domain.LogEntry;
import lombok.Getter;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Getter
public abstract class AbstractAnomalyDetector implements AnomalyDetector {

    private final DetectionMethod method;

    protected AbstractAnomalyDetector(DetectionMethod method) {
        this.method = method;
    }

    /**
     * 공통 필드가 채워진 알림 빌더. 계측기 ID 는 윈도우의 마지막 로그에서 가져온다.
     */
    protected AnomalyAlert.AnomalyAlertBuilder newAlert(List<LogEntry> window, LocalDateTime referenceTime) {
        LogEntry latest = window.get(window.size() - 1);

        return AnomalyAlert.builder()
                .id(UUID.randomUUID().toString())
                .instrumentId(latest.getInstrumentId())
                .timestamp(referenceTime);
    }

    protected static boolean isWithinWindow(LogEntry entry, LocalDateTime referenceTime, Duration window) {
        LocalDateTime cutoff = referenceTime.minus(window);
        return entry.getTimestamp() != null && entry.getTimestamp().isAfter(cutoff);
    }

    protected static double cappedRatio(double value, double denominator) {
        return Math.min(value / denominator, 1.0);
    }
}
