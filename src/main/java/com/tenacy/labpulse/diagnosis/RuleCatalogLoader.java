package com.tenacy.labpulse.diagnosis;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenacy.labpulse.domain.ProbableCause;
import com.tenacy.labpulse.domain.Severity;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.PatternSyntaxException;

/**
 * JSON 규칙 카탈로그 로더. 로딩 시 검증과 정규식 컴파일을 모두 끝낸다.
 */
@Slf4j
@RequiredArgsConstructor
public class RuleCatalogLoader {

    private final ObjectMapper objectMapper;

    public RuleCatalog load(Resource resource) {
        try (InputStream in = resource.getInputStream()) {
            CatalogDocument document = objectMapper.readValue(in, CatalogDocument.class);
            RuleCatalog catalog = toCatalog(document);
            log.info("Loaded diagnosis rule catalog {} ({} rules) from {}",
                    catalog.getVersion(), catalog.size(), resource.getDescription());
            return catalog;
        } catch (IOException e) {
            throw new RuleCatalogException("Failed to read rule catalog from " + resource.getDescription(), e);
        }
    }

    RuleCatalog toCatalog(CatalogDocument document) {
        if (document.getVersion() == null || document.getVersion().isBlank()) {
            throw new RuleCatalogException("Rule catalog version is missing");
        }
        if (document.getRules() == null || document.getRules().isEmpty()) {
            throw new RuleCatalogException("Rule catalog " + document.getVersion() + " has no rules");
        }

        List<DiagnosisRule> rules = new ArrayList<>();
        for (RuleDocument rule : document.getRules()) {
            rules.add(toRule(rule));
        }

        try {
            return new RuleCatalog(document.getVersion(), rules);
        } catch (IllegalArgumentException e) {
            throw new RuleCatalogException(e.getMessage(), e);
        }
    }

    private DiagnosisRule toRule(RuleDocument document) {
        try {
            DiagnosisRule.DiagnosisRuleBuilder builder = DiagnosisRule.builder()
                    .id(document.getId())
                    .symptomKeywords(orEmpty(document.getSymptoms()))
                    .errorCodes(orEmpty(document.getErrorCodes()))
                    .logPatterns(orEmpty(document.getLogPatterns()))
                    .recommendedActions(orEmpty(document.getRecommendedActions()))
                    .urgency(Severity.fromLabel(document.getUrgency()));

            for (CauseDocument cause : orEmpty(document.getProbableCauses())) {
                builder.probableCause(new ProbableCause(cause.getCause(), cause.getProbability(), cause.getDescription()));
            }

            DiagnosisRule rule = builder.build();
            // 정규화 후 빈 키워드는 모든 증상에 포함되므로 허용하지 않는다
            for (int i = 0; i < rule.getSymptomKeywords().size(); i++) {
                if (rule.normalizedKeywords().get(i).isBlank()) {
                    throw new IllegalArgumentException(
                            "symptom keyword '" + rule.getSymptomKeywords().get(i) + "' is blank after normalization");
                }
            }
            return rule;
        } catch (PatternSyntaxException e) {
            throw new RuleCatalogException("Invalid log pattern in rule " + document.getId() + ": " + e.getPattern(), e);
        } catch (IllegalArgumentException e) {
            throw new RuleCatalogException("Invalid rule " + document.getId() + ": " + e.getMessage(), e);
        }
    }

    private static <T> List<T> orEmpty(List<T> values) {
        return values != null ? values : Collections.emptyList();
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class CatalogDocument {
        private String version;
        private List<RuleDocument> rules = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class RuleDocument {
        private String id;
        private List<String> symptoms = new ArrayList<>();
        @JsonProperty("error_codes")
        private List<String> errorCodes = new ArrayList<>();
        @JsonProperty("log_patterns")
        private List<String> logPatterns = new ArrayList<>();
        @JsonProperty("probable_causes")
        private List<CauseDocument> probableCauses = new ArrayList<>();
        @JsonProperty("recommended_actions")
        private List<String> recommendedActions = new ArrayList<>();
        private String urgency = "low";
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class CauseDocument {
        private String cause;
        private double probability;
        private String description;
    }
}
