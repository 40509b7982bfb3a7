package com.tenacy.labpulse.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenacy.labpulse.api.dto.DetectionRequest;
import com.tenacy.labpulse.api.dto.DiagnosisRequest;
import com.tenacy.labpulse.api.dto.LogBatchRequest;
import com.tenacy.labpulse.api.dto.LogEntryRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
public class LabPulseApiIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private String instrumentId;

    @BeforeEach
    void setUp() {
        // 저장소가 컨텍스트 간에 공유되므로 테스트마다 새 계측기 ID 사용
        instrumentId = "hplc-" + UUID.randomUUID();
    }

    @Test
    @DisplayName("진단 API - 과열 증상과 E001 로 온도 급등 진단")
    void analyze_ShouldReturnTemperatureSpikeDiagnosis() throws Exception {
        // given
        DiagnosisRequest request = DiagnosisRequest.builder()
                .instrumentId(instrumentId)
                .symptoms(List.of("overheating"))
                .errorCodes(List.of("E001"))
                .build();

        // when & then
        mockMvc.perform(post("/api/v1/diagnosis/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.instrument_id", is(instrumentId)))
                .andExpect(jsonPath("$.urgency", is("high")))
                .andExpect(jsonPath("$.confidence", is(0.6)))
                .andExpect(jsonPath("$.matched_rules[0]", is("rule_temp_spike")))
                .andExpect(jsonPath("$.probable_causes", hasSize(3)))
                .andExpect(jsonPath("$.id", startsWith("diag_")));
    }

    @Test
    @DisplayName("진단 API - 계측기 ID 누락 시 400")
    void analyze_ShouldRejectMissingInstrumentId() throws Exception {
        mockMvc.perform(post("/api/v1/diagnosis/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"symptoms\": [\"overheating\"]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", is("instrument_id is required")));
    }

    @Test
    @DisplayName("로그 배치 수집 후 이상 감지 - 에러 급증 알림과 건강 상태 반환")
    void detect_ShouldFindErrorBurstAfterBatchCollect() throws Exception {
        // given
        List<LogEntryRequest> logs = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            logs.add(LogEntryRequest.builder()
                    .instrumentId(instrumentId)
                    .level("error")
                    .message("Injection valve fault #" + i)
                    .build());
        }

        mockMvc.perform(post("/api/v1/logs/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new LogBatchRequest(logs))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.received_logs", is(6)))
                .andExpect(jsonPath("$.inserted_logs", is(6)));

        DetectionRequest request = DetectionRequest.builder()
                .instrumentId(instrumentId)
                .build();

        // when & then
        mockMvc.perform(post("/api/v1/anomaly/detect")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.instruments_analyzed", is(1)))
                .andExpect(jsonPath("$.anomalies_detected", is(1)))
                .andExpect(jsonPath("$.alerts[0].anomaly_type", is("error_burst")))
                .andExpect(jsonPath("$.health_reports['" + instrumentId + "'].status", is("fair")));

        mockMvc.perform(get("/api/v1/logs")
                        .param("instrument_id", instrumentId)
                        .param("level", "error"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(6)));
    }

    @Test
    @DisplayName("이상 감지 API - 알 수 없는 감지 방식은 400")
    void detect_ShouldRejectUnknownMethod() throws Exception {
        mockMvc.perform(post("/api/v1/anomaly/detect")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"methods\": [\"isolation_forest\"]}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("알림 조회 API - 숫자가 아닌 limit 은 400")
    void getRecentAlerts_ShouldRejectNonNumericLimit() throws Exception {
        mockMvc.perform(get("/api/v1/anomaly/alerts")
                        .param("limit", "abc"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", is("Invalid value for parameter 'limit'")));
    }

    @Test
    @DisplayName("로그 수집 API - 잘못된 JSON 은 400")
    void collectLog_ShouldRejectMalformedBody() throws Exception {
        mockMvc.perform(post("/api/v1/logs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", is("Malformed request body")));
    }
}
