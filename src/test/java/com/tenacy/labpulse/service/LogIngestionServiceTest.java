package com.tenacy.labpulse.service;

import com.tenacy.labpulse.api.dto.LogCollectResponse;
import com.tenacy.labpulse.api.dto.LogEntryRequest;
import com.tenacy.labpulse.domain.LogEntry;
import com.tenacy.labpulse.domain.LogLevel;
import com.tenacy.labpulse.store.LogStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static com.tenacy.labpulse.util.LogFixtures.INSTRUMENT_ID;
import static com.tenacy.labpulse.util.LogFixtures.REFERENCE_TIME;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LogIngestionServiceTest {

    @Mock
    private LogStore logStore;

    private LogIngestionService logIngestionService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(REFERENCE_TIME.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        logIngestionService = new LogIngestionService(logStore, clock);
    }

    @Test
    @DisplayName("로그 변환 - 누락된 ID, 타임스탬프, 레벨은 기본값으로 채움")
    void toEntry_ShouldApplyDefaults() {
        LogEntryRequest request = LogEntryRequest.builder()
                .instrumentId(INSTRUMENT_ID)
                .message("Status ok")
                .metadata(Map.of("temperature", 37.2))
                .build();

        LogEntry entry = logIngestionService.toEntry(request);

        assertNotNull(entry.getId());
        assertEquals(REFERENCE_TIME, entry.getTimestamp());
        assertEquals(LogLevel.INFO, entry.getLevel());
        assertEquals(37.2, entry.numericMetric("temperature").getAsDouble());
    }

    @Test
    @DisplayName("로그 수집 - 'warn' 레벨 허용, 저장 건수 반환")
    void collect_ShouldStoreEntries() {
        // given
        when(logStore.saveAll(anyCollection())).thenReturn(2);
        List<LogEntryRequest> requests = List.of(
                LogEntryRequest.builder().instrumentId(INSTRUMENT_ID).level("warn").message("Pressure drifting").build(),
                LogEntryRequest.builder().instrumentId(INSTRUMENT_ID).level("ERROR").message("Pump stalled").build());

        // when
        LogCollectResponse response = logIngestionService.collect(requests);

        // then
        assertEquals(2, response.getReceivedLogs());
        assertEquals(2, response.getInsertedLogs());
        assertEquals(REFERENCE_TIME, response.getTimestamp());
    }

    @Test
    @DisplayName("알 수 없는 레벨이나 빈 배치는 요청 거부")
    void collect_ShouldRejectInvalidInput() {
        List<LogEntryRequest> badLevel = List.of(
                LogEntryRequest.builder().instrumentId(INSTRUMENT_ID).level("fatal").message("x").build());

        assertThrows(InvalidRequestException.class, () -> logIngestionService.collect(badLevel));
        assertThrows(InvalidRequestException.class, () -> logIngestionService.collect(List.of()));
        verifyNoInteractions(logStore);
    }
}
