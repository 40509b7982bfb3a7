package com.tenacy.labpulse.diagnosis;

import com.tenacy.labpulse.domain.ProbableCause;
import com.tenacy.labpulse.domain.Severity;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 증상 키워드, 에러 코드, 로그 패턴을 원인 후보와 조치로 연결하는 진단 규칙.
 * 로그 패턴은 규칙 생성 시 한 번만 컴파일된다.
 */
@Getter
@EqualsAndHashCode(of = "id")
@ToString(of = {"id", "urgency"})
public final class DiagnosisRule {

    private final String id;
    private final List<String> symptomKeywords;
    private final List<String> errorCodes;
    private final List<Pattern> logPatterns;
    private final List<ProbableCause> probableCauses;
    private final List<String> recommendedActions;
    private final Severity urgency;

    @Getter(lombok.AccessLevel.NONE)
    private final List<String> normalizedKeywords;

    @Getter(lombok.AccessLevel.NONE)
    private final List<String> upperCaseErrorCodes;

    @Builder
    private DiagnosisRule(String id,
                          @Singular List<String> symptomKeywords,
                          @Singular List<String> errorCodes,
                          @Singular List<String> logPatterns,
                          @Singular List<ProbableCause> probableCauses,
                          @Singular List<String> recommendedActions,
                          Severity urgency) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Rule id must not be blank");
        }
        this.id = id;
        this.symptomKeywords = List.copyOf(symptomKeywords);
        this.errorCodes = List.copyOf(errorCodes);
        this.logPatterns = logPatterns.stream()
                .map(regex -> Pattern.compile(regex, Pattern.CASE_INSENSITIVE))
                .collect(Collectors.toUnmodifiableList());
        this.probableCauses = List.copyOf(probableCauses);
        this.recommendedActions = List.copyOf(recommendedActions);
        this.urgency = urgency != null ? urgency : Severity.LOW;
        this.normalizedKeywords = this.symptomKeywords.stream()
                .map(SymptomMatcher::normalize)
                .collect(Collectors.toUnmodifiableList());
        this.upperCaseErrorCodes = this.errorCodes.stream()
                .map(code -> code.toUpperCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableList());
    }

    List<String> normalizedKeywords() {
        return normalizedKeywords;
    }

    List<String> upperCaseErrorCodes() {
        return upperCaseErrorCodes;
    }
}
