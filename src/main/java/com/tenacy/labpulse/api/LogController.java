package com.tenacy.labpulse.api;

import com.tenacy.labpulse.api.dto.LogBatchRequest;
import com.tenacy.labpulse.api.dto.LogCollectResponse;
import com.tenacy.labpulse.api.dto.LogEntryRequest;
import com.tenacy.labpulse.domain.LogEntry;
import com.tenacy.labpulse.service.LogIngestionService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/logs")
@RequiredArgsConstructor
public class LogController {

    private final LogIngestionService logIngestionService;

    @PostMapping
    public ResponseEntity<LogCollectResponse> collectLog(@RequestBody LogEntryRequest request) {
        return ResponseEntity.ok(logIngestionService.collect(List.of(request)));
    }

    @PostMapping("/batch")
    public ResponseEntity<LogCollectResponse> collectLogs(@RequestBody LogBatchRequest request) {
        return ResponseEntity.ok(logIngestionService.collect(request.getLogs()));
    }

    @GetMapping
    public ResponseEntity<List<LogEntry>> getLogs(
            @RequestParam(value = "instrument_id", required = false) String instrumentId,
            @RequestParam(value = "level", required = false) String level,
            @RequestParam(value = "limit", defaultValue = "100") int limit) {
        return ResponseEntity.ok(logIngestionService.retrieveLogs(instrumentId, level, limit));
    }
}
