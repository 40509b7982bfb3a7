package com.tenacy.labpulse.detection;

import com.tenacy.labpulse.detection.impl.ErrorBurstDetector;
import com.tenacy.labpulse.detection.impl.TemperatureZScoreDetector;
import com.tenacy.labpulse.domain.AnomalyAlert;
import com.tenacy.labpulse.domain.LogEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.stream.Collectors;

import static com.tenacy.labpulse.util.LogFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class AnomalyAggregatorTest {

    private final AnomalyAggregator aggregator = AnomalyAggregator.withDefaults();

    /** 온도 급등(z=3.015), 5분 내 100% 상승, ERROR 5건이 모두 포함된 윈도우 */
    private List<LogEntry> windowWithAllAnomalies() {
        double[] values = {20, 20, 20, 20, 20, 20, 20, 20, 20, 20, 40};
        List<LogEntry> window = new ArrayList<>(temperatures(values));
        window.addAll(errors(5, REFERENCE_TIME));
        return window;
    }

    @Test
    @DisplayName("독립 감지기들이 동시에 발생하면 병합 없이 모두 반환")
    void detect_ShouldReturnEveryFiredAlertInMethodOrder() {
        List<AnomalyAlert> alerts = aggregator.detect(windowWithAllAnomalies(), REFERENCE_TIME);

        List<String> types = alerts.stream().map(AnomalyAlert::getAnomalyType).collect(Collectors.toList());
        assertThat(types).containsExactly("temperature_spike", "error_burst", "rapid_temperature_change");
        alerts.forEach(alert -> assertTrue(alert.getConfidence() >= 0.0 && alert.getConfidence() <= 1.0));
    }

    @Test
    @DisplayName("선택한 감지 방식만 실행")
    void detect_ShouldRunOnlySelectedMethods() {
        List<AnomalyAlert> alerts = aggregator.detect(windowWithAllAnomalies(),
                EnumSet.of(DetectionMethod.ERROR_BURST), REFERENCE_TIME);

        assertEquals(1, alerts.size());
        assertEquals("error_burst", alerts.get(0).getAnomalyType());
    }

    @Test
    @DisplayName("빈 윈도우는 오류 없이 빈 결과")
    void detect_ShouldReturnEmptyForEmptyWindow() {
        assertTrue(aggregator.detect(List.of(), REFERENCE_TIME).isEmpty());
        assertTrue(aggregator.detect(null, REFERENCE_TIME).isEmpty());
    }

    @Test
    @DisplayName("같은 감지 방식을 두 번 등록할 수 없음")
    void constructor_ShouldRejectDuplicateMethods() {
        assertThrows(IllegalArgumentException.class, () -> new AnomalyAggregator(List.of(
                new TemperatureZScoreDetector(), new TemperatureZScoreDetector(4.0), new ErrorBurstDetector())));
    }

    @Test
    @DisplayName("등록되지 않은 감지 방식은 건너뜀")
    void detect_ShouldSkipMethodsWithoutDetector() {
        AnomalyAggregator burstOnly = new AnomalyAggregator(List.of(new ErrorBurstDetector()));

        List<AnomalyAlert> alerts = burstOnly.detect(windowWithAllAnomalies(), REFERENCE_TIME);

        assertEquals(1, alerts.size());
        assertEquals(EnumSet.of(DetectionMethod.ERROR_BURST), burstOnly.getAvailableMethods());
    }
}
