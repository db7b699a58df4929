package com.vibecoding.k8ssanitizer.collector;

import com.vibecoding.k8ssanitizer.model.Issue;
import com.vibecoding.k8ssanitizer.model.Outcome;
import com.vibecoding.k8ssanitizer.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 리소스별 이슈 수집기 (인메모리)
 * 여러 새니타이저가 동시에 기록할 수 있으며, 결과 조회는 모든 새니타이저가 끝난 뒤에 한다.
 */
public class IssueCollector {

    private static final Logger log = LoggerFactory.getLogger(IssueCollector.class);

    // FQN -> 이슈 목록 (처음 기록된 순서 유지)
    private final Map<String, List<Issue>> outcome = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * 이슈가 하나도 없어도 결과에 항목이 생기도록 보장
     */
    public void initOutcome(String fqn) {
        lock.writeLock().lock();
        try {
            outcome.computeIfAbsent(fqn, k -> new ArrayList<>());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 이슈 추가 (중복 제거하지 않음)
     */
    public void addIssue(String fqn, Issue issue) {
        lock.writeLock().lock();
        try {
            outcome.computeIfAbsent(fqn, k -> new ArrayList<>()).add(issue);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void addIssuef(String fqn, String group, Severity level, String pattern, Object... args) {
        addIssue(fqn, Issue.format(group, level, pattern, args));
    }

    /**
     * 한 리소스의 검사 결과를 한 번에 기록
     */
    public void commit(String fqn, List<Issue> issues) {
        lock.writeLock().lock();
        try {
            outcome.computeIfAbsent(fqn, k -> new ArrayList<>()).addAll(issues);
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Committed {} issues for {}", issues.size(), fqn);
    }

    /**
     * 현재까지의 결과 스냅샷
     */
    public Outcome outcome() {
        lock.readLock().lock();
        try {
            return Outcome.of(outcome);
        } finally {
            lock.readLock().unlock();
        }
    }
}
