package com.tenacy.labpulse.api;

import com.tenacy.labpulse.api.dto.DetectionRequest;
import com.tenacy.labpulse.api.dto.DetectionResponse;
import com.tenacy.labpulse.detection.DetectionMethod;
import com.tenacy.labpulse.domain.AnomalyAlert;
import com.tenacy.labpulse.service.AnomalyDetectionService;
import com.tenacy.labpulse.service.InvalidRequestException;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

@RestController
@RequestMapping("/api/v1/anomaly")
@RequiredArgsConstructor
public class AnomalyController {

    private final AnomalyDetectionService anomalyDetectionService;

    @PostMapping("/detect")
    public ResponseEntity<DetectionResponse> detect(@RequestBody(required = false) DetectionRequest request) {
        String instrumentId = request != null ? request.getInstrumentId() : null;
        Set<DetectionMethod> methods = request != null ? parseMethods(request.getMethods()) : null;

        return ResponseEntity.ok(anomalyDetectionService.detect(instrumentId, methods));
    }

    @GetMapping("/alerts")
    public ResponseEntity<List<AnomalyAlert>> getRecentAlerts(
            @RequestParam(value = "limit", defaultValue = "50") int limit) {
        return ResponseEntity.ok(anomalyDetectionService.recentAlerts(limit));
    }

    private static Set<DetectionMethod> parseMethods(List<String> methods) {
        if (methods == null || methods.isEmpty()) {
            return null;
        }

        Set<DetectionMethod> parsed = EnumSet.noneOf(DetectionMethod.class);
        for (String method : methods) {
            try {
                parsed.add(DetectionMethod.fromId(method));
            } catch (IllegalArgumentException e) {
                throw new InvalidRequestException(e.getMessage());
            }
        }
        return parsed;
    }
}
