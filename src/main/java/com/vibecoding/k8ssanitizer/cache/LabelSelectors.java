package com.vibecoding.k8ssanitizer.cache;

import io.fabric8.kubernetes.api.model.LabelSelector;
import io.fabric8.kubernetes.api.model.LabelSelectorRequirement;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * LabelSelector 매칭 (matchLabels + matchExpressions)
 */
public final class LabelSelectors {

    private LabelSelectors() {
    }

    /**
     * 셀렉터가 라벨과 일치하는지 확인. null 또는 빈 셀렉터는 아무것도 선택하지 않는다.
     *
     * @throws IllegalArgumentException 알 수 없는 operator
     */
    public static boolean matches(LabelSelector selector, Map<String, String> labels) {
        if (isEmpty(selector)) {
            return false;
        }
        Map<String, String> actual = labels != null ? labels : Collections.emptyMap();

        Map<String, String> matchLabels = selector.getMatchLabels();
        if (matchLabels != null) {
            for (Map.Entry<String, String> entry : matchLabels.entrySet()) {
                if (!Objects.equals(entry.getValue(), actual.get(entry.getKey()))) {
                    return false;
                }
            }
        }

        List<LabelSelectorRequirement> expressions = selector.getMatchExpressions();
        if (expressions != null) {
            for (LabelSelectorRequirement requirement : expressions) {
                if (!matches(requirement, actual)) {
                    return false;
                }
            }
        }
        return true;
    }

    private static boolean matches(LabelSelectorRequirement requirement, Map<String, String> labels) {
        String key = requirement.getKey();
        List<String> values = requirement.getValues() != null ? requirement.getValues() : Collections.emptyList();
        String operator = requirement.getOperator() != null ? requirement.getOperator() : "";

        switch (operator) {
            case "In":
                return labels.containsKey(key) && values.contains(labels.get(key));
            case "NotIn":
                return !labels.containsKey(key) || !values.contains(labels.get(key));
            case "Exists":
                return labels.containsKey(key);
            case "DoesNotExist":
                return !labels.containsKey(key);
            default:
                throw new IllegalArgumentException("Unsupported selector operator: " + operator);
        }
    }

    private static boolean isEmpty(LabelSelector selector) {
        if (selector == null) {
            return true;
        }
        boolean noLabels = selector.getMatchLabels() == null || selector.getMatchLabels().isEmpty();
        boolean noExpressions = selector.getMatchExpressions() == null || selector.getMatchExpressions().isEmpty();
        return noLabels && noExpressions;
    }
}
