package com.vibecoding.k8ssanitizer.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 새니타이즈 결과 (리소스 FQN -> 이슈 목록)
 * 생성 이후 변경되지 않으므로 여러 스레드에서 읽어도 안전하다.
 */
public final class Outcome {

    private static final Outcome EMPTY = new Outcome(Collections.emptyMap());

    private final Map<String, List<Issue>> issues;

    private Outcome(Map<String, List<Issue>> issues) {
        this.issues = issues;
    }

    public static Outcome empty() {
        return EMPTY;
    }

    /**
     * 주어진 맵을 복사해 불변 결과를 만든다. 키 순서는 유지된다.
     */
    public static Outcome of(Map<String, List<Issue>> source) {
        Map<String, List<Issue>> copy = new LinkedHashMap<>();
        source.forEach((fqn, list) -> copy.put(fqn, List.copyOf(list)));
        return new Outcome(Collections.unmodifiableMap(copy));
    }

    /**
     * FQN의 이슈 목록, 새니타이즈되지 않은 리소스면 null
     */
    public List<Issue> get(String fqn) {
        return issues.get(fqn);
    }

    public List<Issue> issues(String fqn) {
        return issues.getOrDefault(fqn, List.of());
    }

    public boolean contains(String fqn) {
        return issues.containsKey(fqn);
    }

    public Set<String> fqns() {
        return issues.keySet();
    }

    public int size() {
        return issues.size();
    }

    public boolean isEmpty() {
        return issues.isEmpty();
    }

    /**
     * 리소스의 가장 높은 심각도, 이슈가 없으면 OK
     */
    public Severity maxSeverity(String fqn) {
        return maxSeverity(issues(fqn));
    }

    public static Severity maxSeverity(List<Issue> list) {
        Severity max = Severity.OK;
        for (Issue issue : list) {
            max = Severity.max(max, issue.getLevel());
        }
        return max;
    }

    /**
     * minLevel 이상인 이슈만 남긴 결과. 모든 FQN 키는 유지된다.
     */
    public Outcome filter(Severity minLevel) {
        Map<String, List<Issue>> filtered = new LinkedHashMap<>();
        issues.forEach((fqn, list) -> filtered.put(fqn, list.stream()
                .filter(issue -> issue.getLevel().isAtLeast(minLevel))
                .collect(Collectors.toList())));
        return of(filtered);
    }

    /**
     * 심각도별 이슈 개수
     */
    public Map<Severity, Long> countBySeverity() {
        Map<Severity, Long> counts = new EnumMap<>(Severity.class);
        issues.values().stream()
                .flatMap(List::stream)
                .forEach(issue -> counts.merge(issue.getLevel(), 1L, Long::sum));
        return counts;
    }

    @Override
    public String toString() {
        return "Outcome" + issues;
    }
}
