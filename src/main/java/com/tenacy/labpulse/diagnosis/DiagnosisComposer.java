package com.tenacy.labpulse.diagnosis;

import com.tenacy.labpulse.domain.DiagnosisResult;
import com.tenacy.labpulse.domain.ProbableCause;
import com.tenacy.labpulse.domain.Severity;
import lombok.RequiredArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * 증상 매칭 결과와 로그 패턴 분석 결과를 합쳐 최종 진단을 만든다.
 */
@RequiredArgsConstructor
public class DiagnosisComposer {

    static final int TOP_RULES = 3;
    static final int MAX_CAUSES = 5;
    static final int MAX_ACTIONS = 8;

    static final String UNKNOWN_CAUSE = "Unable to determine cause";

    private final RuleCatalog catalog;
    private final ConfidenceModel confidenceModel;
    private final UrgencyModel urgencyModel;

    public DiagnosisComposer(RuleCatalog catalog) {
        this(catalog, new ConfidenceModel(), new UrgencyModel());
    }

    public DiagnosisResult compose(String instrumentId, List<RuleMatch> symptomMatches,
                                   LogAnalysis analysis, LocalDateTime referenceTime) {
        List<RuleMatch> ranked = mergeWithPatternHits(symptomMatches, analysis);

        if (ranked.isEmpty()) {
            return unknownCause(instrumentId, analysis, referenceTime);
        }

        List<RuleMatch> top = ranked.subList(0, Math.min(TOP_RULES, ranked.size()));

        // 규칙 간 중복 원인은 그대로 둔다
        List<ProbableCause> causes = top.stream()
                .flatMap(match -> match.getRule().getProbableCauses().stream())
                .sorted(Comparator.comparingDouble(ProbableCause::getProbability).reversed())
                .limit(MAX_CAUSES)
                .collect(Collectors.toList());

        Set<String> actions = new LinkedHashSet<>();
        top.forEach(match -> actions.addAll(match.getRule().getRecommendedActions()));

        return DiagnosisResult.builder()
                .id(newDiagnosisId())
                .instrumentId(instrumentId)
                .timestamp(referenceTime)
                .probableCauses(causes)
                .recommendedActions(actions.stream().limit(MAX_ACTIONS).collect(Collectors.toList()))
                .confidence(confidenceModel.confidence(ranked, analysis))
                .urgency(urgencyModel.urgency(top, analysis))
                .matchedRules(top.stream().map(RuleMatch::getRuleId).collect(Collectors.toList()))
                .logSummary(analysis.toSummary())
                .build();
    }

    /**
     * 증상 매칭에 없던 규칙이 로그 패턴에 걸렸으면 고정 점수로 추가한 뒤 다시 정렬한다.
     */
    List<RuleMatch> mergeWithPatternHits(List<RuleMatch> symptomMatches, LogAnalysis analysis) {
        List<RuleMatch> merged = new ArrayList<>(symptomMatches);
        Set<String> matchedIds = symptomMatches.stream()
                .map(RuleMatch::getRuleId)
                .collect(Collectors.toSet());
        Set<String> patternRuleIds = analysis.patternRuleIds();

        for (DiagnosisRule rule : catalog.getRules()) {
            if (patternRuleIds.contains(rule.getId()) && !matchedIds.contains(rule.getId())) {
                merged.add(RuleMatch.patternOnly(rule));
            }
        }

        merged.sort(SymptomMatcher.ranking(catalog));
        return merged;
    }

    private DiagnosisResult unknownCause(String instrumentId, LogAnalysis analysis, LocalDateTime referenceTime) {
        return DiagnosisResult.builder()
                .id(newDiagnosisId())
                .instrumentId(instrumentId)
                .timestamp(referenceTime)
                .probableCause(new ProbableCause(UNKNOWN_CAUSE, 0.0,
                        "No matching diagnosis rules found for the provided symptoms"))
                .recommendedAction("Review instrument logs for error patterns")
                .recommendedAction("Check instrument documentation")
                .recommendedAction("Contact technical support with detailed symptoms")
                .confidence(0.0)
                .urgency(Severity.LOW)
                .logSummary(analysis.toSummary())
                .build();
    }

    private static String newDiagnosisId() {
        return "diag_" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }
}
