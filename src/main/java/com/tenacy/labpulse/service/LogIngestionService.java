package com.tenacy.labpulse.service;

import com.tenacy.labpulse.api.dto.LogCollectResponse;
import com.tenacy.labpulse.api.dto.LogEntryRequest;
import com.tenacy.labpulse.domain.LogEntry;
import com.tenacy.labpulse.domain.LogLevel;
import com.tenacy.labpulse.store.LogStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class LogIngestionService {

    private final LogStore logStore;
    private final Clock clock;

    public LogCollectResponse collect(List<LogEntryRequest> requests) {
        if (requests == null || requests.isEmpty()) {
            throw new InvalidRequestException("Expected at least one log entry");
        }

        List<LogEntry> entries = new ArrayList<>(requests.size());
        for (LogEntryRequest request : requests) {
            entries.add(toEntry(request));
        }

        int inserted = logStore.saveAll(entries);
        log.debug("로그 {}건 수집, {}건 저장", requests.size(), inserted);

        return LogCollectResponse.builder()
                .receivedLogs(requests.size())
                .insertedLogs(inserted)
                .timestamp(LocalDateTime.now(clock))
                .build();
    }

    public List<LogEntry> retrieveLogs(String instrumentId, String level, int limit) {
        LogLevel logLevel = StringUtils.hasText(level) ? parseLevel(level) : null;
        return logStore.getRecent(StringUtils.hasText(instrumentId) ? instrumentId : null, logLevel, limit);
    }

    LogEntry toEntry(LogEntryRequest request) {
        if (request == null || !StringUtils.hasText(request.getInstrumentId())) {
            throw new InvalidRequestException("instrument_id is required for every log entry");
        }

        LogEntry.LogEntryBuilder builder = LogEntry.builder()
                .id(StringUtils.hasText(request.getId()) ? request.getId() : UUID.randomUUID().toString())
                .instrumentId(request.getInstrumentId())
                .timestamp(request.getTimestamp() != null ? request.getTimestamp() : LocalDateTime.now(clock))
                .level(StringUtils.hasText(request.getLevel()) ? parseLevel(request.getLevel()) : LogLevel.INFO)
                .message(request.getMessage());

        if (request.getMetadata() != null) {
            builder.metadata(request.getMetadata());
        }
        return builder.build();
    }

    private static LogLevel parseLevel(String level) {
        try {
            return LogLevel.fromLabel(level);
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException(e.getMessage());
        }
    }
}
