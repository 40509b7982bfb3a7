package com.tenacy.labpulse.diagnosis;

import com.tenacy.labpulse.domain.DiagnosisResult;
import com.tenacy.labpulse.domain.LogEntry;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

/**
 * 규칙 기반 진단 파이프라인: 증상 매칭 → 로그 패턴 분석 → 결과 조합.
 * 상태를 갖지 않으므로 여러 요청에서 동시에 사용해도 된다.
 */
@Slf4j
public class DiagnosisEngine {

    private final SymptomMatcher symptomMatcher;
    private final LogPatternAnalyzer patternAnalyzer;
    private final DiagnosisComposer composer;

    public DiagnosisEngine(RuleCatalog catalog) {
        this.symptomMatcher = new SymptomMatcher(catalog);
        this.patternAnalyzer = new LogPatternAnalyzer(catalog);
        this.composer = new DiagnosisComposer(catalog);
    }

    public DiagnosisResult diagnose(String instrumentId,
                                    Collection<String> symptoms,
                                    Collection<String> errorCodes,
                                    List<LogEntry> recentLogs,
                                    LocalDateTime referenceTime) {
        List<RuleMatch> matches = symptomMatcher.match(symptoms, errorCodes);
        LogAnalysis analysis = patternAnalyzer.analyze(recentLogs);

        log.debug("Diagnosis for {}: {} symptom matches, {} pattern hits over {} logs",
                instrumentId, matches.size(), analysis.getPatternHitCount(), analysis.getTotalLogsAnalyzed());

        return composer.compose(instrumentId, matches, analysis, referenceTime);
    }
}
