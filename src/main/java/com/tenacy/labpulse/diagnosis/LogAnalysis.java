package com.tenacy.labpulse.diagnosis;

import com.tenacy.labpulse.domain.LogSummary;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Value
@Builder
public class LogAnalysis {

    @Singular("patternFound")
    List<PatternHit> patternsFound;

    double errorFrequency;
    double warningFrequency;

    /** 가장 최근 ERROR 메시지 최대 5개, 시간순 */
    @Singular
    List<String> recentErrors;

    int totalLogsAnalyzed;

    public static LogAnalysis empty() {
        return LogAnalysis.builder().build();
    }

    public Set<String> patternRuleIds() {
        Set<String> ruleIds = new LinkedHashSet<>();
        patternsFound.forEach(hit -> ruleIds.add(hit.getRuleId()));
        return ruleIds;
    }

    public int getPatternHitCount() {
        return patternsFound.size();
    }

    public LogSummary toSummary() {
        return LogSummary.builder()
                .totalLogsAnalyzed(totalLogsAnalyzed)
                .errorFrequency(errorFrequency)
                .warningFrequency(warningFrequency)
                .patternsFound(patternsFound.size())
                .recentErrors(recentErrors)
                .build();
    }
}
