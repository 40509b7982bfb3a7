package com.tenacy.labpulse.service;

import com.tenacy.labpulse.api.dto.DetectionResponse;
import com.tenacy.labpulse.detection.AnomalyAggregator;
import com.tenacy.labpulse.detection.DetectionMethod;
import com.tenacy.labpulse.detection.HealthScorer;
import com.tenacy.labpulse.domain.AnomalyAlert;
import com.tenacy.labpulse.domain.HealthReport;
import com.tenacy.labpulse.domain.LogEntry;
import com.tenacy.labpulse.store.AlertSink;
import com.tenacy.labpulse.store.LogStore;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Service
@Slf4j
public class AnomalyDetectionService {

    private final LogStore logStore;
    private final AlertSink alertSink;
    private final AnomalyAggregator aggregator;
    private final HealthScorer healthScorer;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final int logLimit;

    public AnomalyDetectionService(LogStore logStore,
                                   AlertSink alertSink,
                                   AnomalyAggregator aggregator,
                                   HealthScorer healthScorer,
                                   MeterRegistry meterRegistry,
                                   Clock clock,
                                   @Value("${labpulse.detection.log-limit:200}") int logLimit) {
        this.logStore = logStore;
        this.alertSink = alertSink;
        this.aggregator = aggregator;
        this.healthScorer = healthScorer;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.logLimit = logLimit;
    }

    /**
     * 지정한 계측기(없으면 로그가 있는 모든 계측기)의 최근 로그로 이상 감지와 건강 점수를 계산한다.
     */
    public DetectionResponse detect(String instrumentId, Set<DetectionMethod> methods) {
        Set<DetectionMethod> selected = methods == null || methods.isEmpty()
                ? EnumSet.allOf(DetectionMethod.class)
                : EnumSet.copyOf(methods);
        LocalDateTime referenceTime = LocalDateTime.now(clock);

        List<String> instrumentIds = StringUtils.hasText(instrumentId)
                ? List.of(instrumentId)
                : logStore.instrumentIds();

        List<AnomalyAlert> allAlerts = new ArrayList<>();
        Map<String, HealthReport> healthReports = new LinkedHashMap<>();

        for (String id : instrumentIds) {
            List<LogEntry> logs;
            try {
                logs = logStore.getRecent(id, null, logLimit);
            } catch (RuntimeException e) {
                log.error("Failed to load logs for instrument {}: {}", id, e.getMessage(), e);
                continue;
            }

            if (logs.isEmpty()) {
                continue;
            }

            List<AnomalyAlert> alerts = aggregator.detect(logs, selected, referenceTime);
            for (AnomalyAlert alert : alerts) {
                meterRegistry.counter("labpulse.anomaly.detected",
                        "type", alert.getAnomalyType(),
                        "severity", alert.getSeverity().getLabel()).increment();
                publish(alert);
                allAlerts.add(alert);
            }

            healthReports.put(id, healthScorer.score(logs));
        }

        log.info("Anomaly detection finished: {} instruments, {} alerts", instrumentIds.size(), allAlerts.size());

        return DetectionResponse.builder()
                .instrumentsAnalyzed(instrumentIds.size())
                .anomaliesDetected(allAlerts.size())
                .alerts(allAlerts)
                .healthReports(healthReports)
                .detectionMethods(new ArrayList<>(selected))
                .timestamp(referenceTime)
                .build();
    }

    public List<AnomalyAlert> recentAlerts(int limit) {
        return alertSink.recentAlerts(limit);
    }

    private void publish(AnomalyAlert alert) {
        try {
            alertSink.accept(alert);
        } catch (RuntimeException e) {
            log.error("Failed to publish alert {}: {}", alert.getId(), e.getMessage(), e);
        }
    }
}
