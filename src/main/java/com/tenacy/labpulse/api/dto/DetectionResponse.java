package com.tenacy.labpulse.api.dto;

import com.tenacy.labpulse.detection.DetectionMethod;
import com.tenacy.labpulse.domain.AnomalyAlert;
import com.tenacy.labpulse.domain.HealthReport;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DetectionResponse {
    private int instrumentsAnalyzed;
    private int anomaliesDetected;
    private List<AnomalyAlert> alerts;
    private Map<String, HealthReport> healthReports;
    private List<DetectionMethod> detectionMethods;
    private LocalDateTime timestamp;
}
