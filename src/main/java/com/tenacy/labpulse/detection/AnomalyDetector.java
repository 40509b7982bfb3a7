package com.tenacy.labpulse.detection;

import com.tenacy.labpulse.domain.AnomalyAlert;
import com.tenacy.labpulse.domain.LogEntry;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface AnomalyDetector {
    DetectionMethod getMethod();

    /**
     * 시간순(오름차순)으로 정렬된 로그 윈도우를 분석한다.
     *
     * @param window        분석 대상 로그, 타임스탬프 오름차순
     * @param referenceTime 후행 시간 윈도우의 기준 시각
     * @return 감지된 경우 알림, 아니면 빈 값
     */
    Optional<AnomalyAlert> detect(List<LogEntry> window, LocalDateTime referenceTime);
}
