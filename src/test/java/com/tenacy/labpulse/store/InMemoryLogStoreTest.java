package com.tenacy.labpulse.store;

import com.tenacy.labpulse.domain.LogEntry;
import com.tenacy.labpulse.domain.LogLevel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static com.tenacy.labpulse.util.LogFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class InMemoryLogStoreTest {

    private InMemoryLogStore logStore;

    @BeforeEach
    void setUp() {
        logStore = new InMemoryLogStore(100);
    }

    private static List<String> messages(List<LogEntry> entries) {
        return entries.stream().map(LogEntry::getMessage).collect(Collectors.toList());
    }

    @Test
    @DisplayName("최근 로그 조회 - 가장 최근 N건을 시간 오름차순으로 반환")
    void getRecent_ShouldReturnLatestEntriesAscending() {
        // 저장 순서와 무관하게 타임스탬프 기준 정렬
        logStore.save(entry(REFERENCE_TIME.minusMinutes(1), LogLevel.INFO, "third"));
        logStore.save(entry(REFERENCE_TIME.minusMinutes(3), LogLevel.INFO, "first"));
        logStore.save(entry(REFERENCE_TIME.minusMinutes(2), LogLevel.ERROR, "second"));

        assertThat(messages(logStore.getRecent(INSTRUMENT_ID, null, 2))).containsExactly("second", "third");
        assertThat(messages(logStore.getRecent(INSTRUMENT_ID, null, 10))).containsExactly("first", "second", "third");
        assertThat(messages(logStore.getRecent(INSTRUMENT_ID, LogLevel.ERROR, 10))).containsExactly("second");
        assertTrue(logStore.getRecent("unknown", null, 10).isEmpty());
        assertTrue(logStore.getRecent(INSTRUMENT_ID, null, 0).isEmpty());
    }

    @Test
    @DisplayName("기간 조회 - 시작/종료 시각 포함")
    void getRange_ShouldIncludeBoundaries() {
        logStore.saveAll(List.of(
                entry(REFERENCE_TIME.minusMinutes(10), LogLevel.INFO, "before"),
                entry(REFERENCE_TIME.minusMinutes(5), LogLevel.INFO, "start"),
                entry(REFERENCE_TIME, LogLevel.INFO, "end"),
                entry(REFERENCE_TIME.plusMinutes(1), LogLevel.INFO, "after")));

        List<LogEntry> range = logStore.getRange(INSTRUMENT_ID, REFERENCE_TIME.minusMinutes(5), REFERENCE_TIME);

        assertThat(messages(range)).containsExactly("start", "end");
    }

    @Test
    @DisplayName("보관 한도를 넘으면 가장 오래된 로그부터 제거")
    void save_ShouldEvictOldestBeyondCapacity() {
        InMemoryLogStore small = new InMemoryLogStore(3);
        for (int i = 0; i < 5; i++) {
            small.save(entry(REFERENCE_TIME.plusMinutes(i), LogLevel.INFO, "log-" + i));
        }

        assertThat(messages(small.getRecent(INSTRUMENT_ID, null, 10))).containsExactly("log-2", "log-3", "log-4");
    }

    @Test
    @DisplayName("계측기 ID 목록은 정렬되어 반환")
    void instrumentIds_ShouldBeSorted() {
        logStore.save(entry(REFERENCE_TIME, LogLevel.INFO, "a").toBuilder().instrumentId("hplc-02").build());
        logStore.save(entry(REFERENCE_TIME, LogLevel.INFO, "b").toBuilder().instrumentId("centrifuge-01").build());

        assertThat(logStore.instrumentIds()).containsExactly("centrifuge-01", "hplc-02");
        assertEquals(1, logStore.getRecent(null, null, 1).size());
    }

    @Test
    @DisplayName("계측기 ID 나 타임스탬프가 없는 로그는 저장하지 않음")
    void save_ShouldRejectIncompleteEntries() {
        LogEntry noTimestamp = entry(null, LogLevel.INFO, "x");

        assertThrows(NullPointerException.class, () -> logStore.save(noTimestamp));
        assertTrue(logStore.instrumentIds().isEmpty());
    }
}
