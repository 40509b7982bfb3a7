package com.tenacy.labpulse.diagnosis;

import lombok.Value;

import java.util.Collections;
import java.util.List;

@Value
public class RuleMatch {

    /** 로그 패턴으로만 매칭된 규칙에 부여하는 점수 */
    public static final double PATTERN_ONLY_SCORE = 0.5;

    DiagnosisRule rule;
    double score;
    List<String> symptomMatches;
    List<String> errorMatches;

    public static RuleMatch patternOnly(DiagnosisRule rule) {
        return new RuleMatch(rule, PATTERN_ONLY_SCORE, Collections.emptyList(), Collections.emptyList());
    }

    public String getRuleId() {
        return rule.getId();
    }
}
