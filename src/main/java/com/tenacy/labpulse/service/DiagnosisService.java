package com.tenacy.labpulse.service;

import com.tenacy.labpulse.api.dto.DiagnosisRequest;
import com.tenacy.labpulse.diagnosis.DiagnosisEngine;
import com.tenacy.labpulse.domain.DiagnosisResult;
import com.tenacy.labpulse.domain.LogEntry;
import com.tenacy.labpulse.store.LogStore;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

@Service
@Slf4j
public class DiagnosisService {

    private final LogStore logStore;
    private final DiagnosisEngine diagnosisEngine;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final int logLimit;

    public DiagnosisService(LogStore logStore,
                            DiagnosisEngine diagnosisEngine,
                            MeterRegistry meterRegistry,
                            Clock clock,
                            @Value("${labpulse.diagnosis.log-limit:50}") int logLimit) {
        this.logStore = logStore;
        this.diagnosisEngine = diagnosisEngine;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.logLimit = logLimit;
    }

    public DiagnosisResult diagnose(DiagnosisRequest request) {
        validate(request);

        List<LogEntry> recentLogs;
        try {
            recentLogs = logStore.getRecent(request.getInstrumentId(), null, logLimit);
        } catch (RuntimeException e) {
            // 로그 없이 증상/에러 코드만으로 진단을 계속한다
            log.warn("Failed to load logs for instrument {}, diagnosing without logs: {}",
                    request.getInstrumentId(), e.getMessage());
            recentLogs = List.of();
        }

        DiagnosisResult result = diagnosisEngine.diagnose(
                request.getInstrumentId(),
                request.getSymptoms(),
                request.getErrorCodes(),
                recentLogs,
                LocalDateTime.now(clock));

        meterRegistry.counter("labpulse.diagnosis.requests", "urgency", result.getUrgency().getLabel()).increment();
        log.info("Diagnosis {} for {}: urgency={}, confidence={}, rules={}",
                result.getId(), result.getInstrumentId(), result.getUrgency(), result.getConfidence(), result.getMatchedRules());

        return result;
    }

    private static void validate(DiagnosisRequest request) {
        if (request == null || !StringUtils.hasText(request.getInstrumentId())) {
            throw new InvalidRequestException("instrument_id is required");
        }
        if (CollectionUtils.isEmpty(request.getSymptoms()) && CollectionUtils.isEmpty(request.getErrorCodes())) {
            throw new InvalidRequestException("At least one symptom or error code is required");
        }
    }
}
