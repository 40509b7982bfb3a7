package com.tenacy.labpulse.store;

import com.tenacy.labpulse.domain.LogEntry;
import com.tenacy.labpulse.domain.LogLevel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Component
@Slf4j
public class InMemoryLogStore implements LogStore {

    private static final Comparator<LogEntry> BY_TIMESTAMP = Comparator.comparing(LogEntry::getTimestamp);

    private final Map<String, List<LogEntry>> logsByInstrument = new ConcurrentHashMap<>();
    private final int maxEntriesPerInstrument;

    public InMemoryLogStore(@Value("${labpulse.store.max-entries-per-instrument:5000}") int maxEntriesPerInstrument) {
        this.maxEntriesPerInstrument = maxEntriesPerInstrument;
    }

    @Override
    public List<LogEntry> getRecent(String instrumentId, LogLevel level, int limit) {
        if (limit <= 0) {
            return List.of();
        }

        List<LogEntry> matching = entries(instrumentId)
                .filter(entry -> level == null || entry.getLevel() == level)
                .sorted(BY_TIMESTAMP)
                .collect(Collectors.toList());

        int from = Math.max(0, matching.size() - limit);
        return List.copyOf(matching.subList(from, matching.size()));
    }

    @Override
    public List<LogEntry> getRange(String instrumentId, LocalDateTime start, LocalDateTime end) {
        return entries(instrumentId)
                .filter(entry -> !entry.getTimestamp().isBefore(start) && !entry.getTimestamp().isAfter(end))
                .sorted(BY_TIMESTAMP)
                .collect(Collectors.toUnmodifiableList());
    }

    @Override
    public void save(LogEntry entry) {
        Objects.requireNonNull(entry.getInstrumentId(), "instrumentId");
        Objects.requireNonNull(entry.getTimestamp(), "timestamp");

        List<LogEntry> logs = logsByInstrument.computeIfAbsent(entry.getInstrumentId(), k -> new ArrayList<>());
        synchronized (logs) {
            logs.add(entry);

            // 보관 한도 초과 시 가장 오래된 로그부터 제거
            if (logs.size() > maxEntriesPerInstrument) {
                logs.sort(BY_TIMESTAMP);
                int overflow = logs.size() - maxEntriesPerInstrument;
                logs.subList(0, overflow).clear();
                log.debug("Evicted {} old logs for instrument {}", overflow, entry.getInstrumentId());
            }
        }
    }

    @Override
    public int saveAll(Collection<LogEntry> entries) {
        int saved = 0;
        for (LogEntry entry : entries) {
            save(entry);
            saved++;
        }
        return saved;
    }

    @Override
    public List<String> instrumentIds() {
        return logsByInstrument.keySet().stream()
                .sorted()
                .collect(Collectors.toList());
    }

    private Stream<LogEntry> entries(String instrumentId) {
        if (instrumentId != null) {
            List<LogEntry> logs = logsByInstrument.get(instrumentId);
            return logs == null ? Stream.empty() : snapshot(logs).stream();
        }

        return logsByInstrument.values().stream()
                .flatMap(logs -> snapshot(logs).stream());
    }

    private static List<LogEntry> snapshot(List<LogEntry> logs) {
        synchronized (logs) {
            return new ArrayList<>(logs);
        }
    }
}
