package com.tenacy.labpulse.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class LogSummary {
    int totalLogsAnalyzed;
    double errorFrequency;
    double warningFrequency;
    int patternsFound;

    @Singular
    List<String> recentErrors;
}
