package com.tenacy.labpulse.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LogCollectResponse {
    private int receivedLogs;
    private int insertedLogs;
    private LocalDateTime timestamp;
}
