package com.tenacy.labpulse.store;

import com.tenacy.labpulse.domain.LogEntry;
import com.tenacy.labpulse.domain.LogLevel;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

/**
 * 계측기 로그 저장소. 조회 결과는 항상 타임스탬프 오름차순이다.
 */
public interface LogStore {

    /**
     * 조건에 맞는 가장 최근 로그 {@code limit} 개.
     *
     * @param instrumentId null 이면 전체 계측기
     * @param level        null 이면 전체 레벨
     */
    List<LogEntry> getRecent(String instrumentId, LogLevel level, int limit);

    List<LogEntry> getRange(String instrumentId, LocalDateTime start, LocalDateTime end);

    void save(LogEntry entry);

    int saveAll(Collection<LogEntry> entries);

    List<String> instrumentIds();
}
