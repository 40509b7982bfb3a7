package com.tenacy.labpulse.diagnosis;

import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 자유 텍스트 증상과 에러 코드로 규칙별 점수를 매긴다.
 * 증상 키워드 일치 1.0, 에러 코드 일치 2.0.
 */
@RequiredArgsConstructor
public class SymptomMatcher {

    public static final double SYMPTOM_WEIGHT = 1.0;
    public static final double ERROR_CODE_WEIGHT = 2.0;

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9 ]");

    private final RuleCatalog catalog;

    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return NON_ALPHANUMERIC.matcher(text.toLowerCase(Locale.ROOT).trim()).replaceAll("");
    }

    public List<RuleMatch> match(Collection<String> symptoms, Collection<String> errorCodes) {
        List<String> normalizedSymptoms = symptoms == null ? List.of() : symptoms.stream()
                .map(SymptomMatcher::normalize)
                .filter(symptom -> !symptom.isBlank())
                .collect(Collectors.toList());
        List<String> normalizedCodes = errorCodes == null ? List.of() : errorCodes.stream()
                .filter(code -> code != null && !code.isBlank())
                .map(code -> code.trim().toUpperCase(Locale.ROOT))
                .collect(Collectors.toList());

        List<RuleMatch> matches = new ArrayList<>();

        for (DiagnosisRule rule : catalog.getRules()) {
            double score = 0.0;
            List<String> symptomMatches = new ArrayList<>();
            List<String> errorMatches = new ArrayList<>();

            for (String symptom : normalizedSymptoms) {
                List<String> keywords = rule.getSymptomKeywords();
                List<String> normalizedKeywords = rule.normalizedKeywords();
                for (int i = 0; i < keywords.size(); i++) {
                    String keyword = normalizedKeywords.get(i);
                    if (symptom.contains(keyword) || keyword.contains(symptom)) {
                        score += SYMPTOM_WEIGHT;
                        symptomMatches.add(keywords.get(i));
                    }
                }
            }

            for (String code : normalizedCodes) {
                for (String ruleCode : rule.upperCaseErrorCodes()) {
                    if (code.equals(ruleCode)) {
                        score += ERROR_CODE_WEIGHT;
                        errorMatches.add(code);
                    }
                }
            }

            if (score > 0) {
                matches.add(new RuleMatch(rule, score, List.copyOf(symptomMatches), List.copyOf(errorMatches)));
            }
        }

        matches.sort(ranking(catalog));
        return matches;
    }

    /**
     * 점수 내림차순, 동점이면 카탈로그 선언 순서.
     */
    static Comparator<RuleMatch> ranking(RuleCatalog catalog) {
        return Comparator.comparingDouble(RuleMatch::getScore).reversed()
                .thenComparingInt(match -> catalog.indexOf(match.getRule()));
    }
}
