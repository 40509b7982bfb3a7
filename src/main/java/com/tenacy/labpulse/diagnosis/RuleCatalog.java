package com.tenacy.labpulse.diagnosis;

import lombok.Getter;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 버전이 지정된 불변 진단 규칙 집합. 선언 순서는 동점 규칙의 순위를 결정한다.
 */
public final class RuleCatalog {

    @Getter
    private final String version;

    @Getter
    private final List<DiagnosisRule> rules;

    private final Map<String, Integer> declarationOrder;

    public RuleCatalog(String version, List<DiagnosisRule> rules) {
        this.version = version;
        this.rules = List.copyOf(rules);

        Map<String, Integer> order = new HashMap<>();
        for (int i = 0; i < this.rules.size(); i++) {
            String ruleId = this.rules.get(i).getId();
            if (order.putIfAbsent(ruleId, i) != null) {
                throw new IllegalArgumentException("Duplicate rule id in catalog " + version + ": " + ruleId);
            }
        }
        this.declarationOrder = Map.copyOf(order);
    }

    public Optional<DiagnosisRule> findById(String ruleId) {
        Integer index = declarationOrder.get(ruleId);
        return index != null ? Optional.of(rules.get(index)) : Optional.empty();
    }

    public int indexOf(DiagnosisRule rule) {
        Integer index = declarationOrder.get(rule.getId());
        if (index == null) {
            throw new IllegalArgumentException("Rule " + rule.getId() + " is not part of catalog " + version);
        }
        return index;
    }

    public int size() {
        return rules.size();
    }
}
