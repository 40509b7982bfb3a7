package com.tenacy.labpulse.diagnosis;

import com.tenacy.labpulse.domain.LogLevel;
import lombok.Value;

import java.time.LocalDateTime;

@Value
public class PatternHit {
    String ruleId;
    String pattern;
    String logMessage;
    LogLevel logLevel;
    LocalDateTime timestamp;
}
