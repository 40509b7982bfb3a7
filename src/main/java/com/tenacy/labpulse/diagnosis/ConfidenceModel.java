package com.tenacy.labpulse.diagnosis;

import java.util.List;

/**
 * 진단 신뢰도 = 최고 점수 기반 신뢰도 + 패턴 가산 + 에러 빈도 가산, 최대 1.0.
 */
public class ConfidenceModel {

    private static final double SCORE_NORMALIZER = 5.0;
    private static final double PATTERN_BOOST_PER_HIT = 0.1;
    private static final double MAX_PATTERN_BOOST = 0.3;
    private static final double ERROR_FREQUENCY_THRESHOLD = 0.2;
    private static final double ERROR_BOOST = 0.1;

    public double confidence(List<RuleMatch> rankedMatches, LogAnalysis analysis) {
        if (rankedMatches.isEmpty()) {
            return 0.0;
        }

        double matchConfidence = Math.min(rankedMatches.get(0).getScore() / SCORE_NORMALIZER, 1.0);
        double patternBoost = Math.min(analysis.getPatternHitCount() * PATTERN_BOOST_PER_HIT, MAX_PATTERN_BOOST);
        double errorBoost = analysis.getErrorFrequency() > ERROR_FREQUENCY_THRESHOLD ? ERROR_BOOST : 0.0;

        double total = Math.min(matchConfidence + patternBoost + errorBoost, 1.0);
        return Math.round(total * 100.0) / 100.0;
    }
}
