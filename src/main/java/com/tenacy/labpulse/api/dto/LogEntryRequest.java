package com.tenacy.labpulse.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LogEntryRequest {
    private String id;
    private String instrumentId;
    private LocalDateTime timestamp;
    private String level;
    private String message;
    private Map<String, Object> metadata;
}
