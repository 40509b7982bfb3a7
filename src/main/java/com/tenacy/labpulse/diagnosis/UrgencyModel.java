package com.tenacy.labpulse.diagnosis;

import com.tenacy.labpulse.domain.Severity;

import java.util.List;

public class UrgencyModel {

    private static final double ESCALATION_ERROR_FREQUENCY = 0.5;

    /**
     * 상위 규칙들의 긴급도 중 최댓값. ERROR 비율이 50% 를 넘으면 최소 HIGH.
     */
    public Severity urgency(List<RuleMatch> topMatches, LogAnalysis analysis) {
        if (topMatches.isEmpty()) {
            return Severity.LOW;
        }

        Severity urgency = Severity.LOW;
        for (RuleMatch match : topMatches) {
            urgency = Severity.max(urgency, match.getRule().getUrgency());
        }

        if (analysis.getErrorFrequency() > ESCALATION_ERROR_FREQUENCY) {
            urgency = Severity.max(urgency, Severity.HIGH);
        }

        return urgency;
    }
}
