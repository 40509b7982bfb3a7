package com.tenacy.labpulse.diagnosis;

import com.tenacy.labpulse.domain.LogEntry;
import com.tenacy.labpulse.domain.LogLevel;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 로그 메시지를 각 규칙의 (미리 컴파일된) 패턴으로 검색하고 ERROR/WARNING 빈도를 계산한다.
 */
@RequiredArgsConstructor
public class LogPatternAnalyzer {

    static final int RECENT_ERROR_LIMIT = 5;

    private final RuleCatalog catalog;

    public LogAnalysis analyze(List<LogEntry> logs) {
        if (logs == null || logs.isEmpty()) {
            return LogAnalysis.empty();
        }

        LogAnalysis.LogAnalysisBuilder analysis = LogAnalysis.builder();
        List<String> errorMessages = new ArrayList<>();
        int warningCount = 0;

        for (LogEntry entry : logs) {
            String message = entry.getMessage();

            if (entry.hasLevel(LogLevel.ERROR)) {
                errorMessages.add(message);
            } else if (entry.hasLevel(LogLevel.WARNING)) {
                warningCount++;
            }

            for (DiagnosisRule rule : catalog.getRules()) {
                for (Pattern pattern : rule.getLogPatterns()) {
                    if (pattern.matcher(message).find()) {
                        analysis.patternFound(new PatternHit(
                                rule.getId(), pattern.pattern(), message, entry.getLevel(), entry.getTimestamp()));
                    }
                }
            }
        }

        int total = logs.size();

        return analysis
                .errorFrequency((double) errorMessages.size() / total)
                .warningFrequency((double) warningCount / total)
                .recentErrors(errorMessages.subList(Math.max(0, errorMessages.size() - RECENT_ERROR_LIMIT), errorMessages.size()))
                .totalLogsAnalyzed(total)
                .build();
    }
}
