package com.vibecoding.k8ssanitizer.service;

import com.vibecoding.k8ssanitizer.cache.ClusterCache;
import com.vibecoding.k8ssanitizer.cache.ClusterSnapshotLoader;
import com.vibecoding.k8ssanitizer.collector.IssueCollector;
import com.vibecoding.k8ssanitizer.config.SanitizerProperties;
import com.vibecoding.k8ssanitizer.model.Outcome;
import com.vibecoding.k8ssanitizer.model.SanitizeRequest;
import com.vibecoding.k8ssanitizer.sanitizer.DeploymentSanitizer;
import com.vibecoding.k8ssanitizer.sanitizer.PodSanitizer;
import com.vibecoding.k8ssanitizer.sanitizer.Sanitizer;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * 새니타이즈 서비스 - 리소스 종류별 새니타이저를 병렬로 실행하고 결과를 합친다
 */
@Service
@RequiredArgsConstructor
public class SanitizeService {

    private static final Logger log = LoggerFactory.getLogger(SanitizeService.class);

    private final ClusterSnapshotLoader snapshotLoader;
    private final SanitizerProperties properties;

    /**
     * 클러스터 스냅샷을 읽어 전체 새니타이즈
     */
    public Outcome sanitizeCluster(SanitizeRequest request) {
        return sanitize(snapshotLoader.load(), request);
    }

    /**
     * 주어진 스냅샷에 대해 모든 새니타이저 실행
     */
    public Outcome sanitize(ClusterCache cache, SanitizeRequest request) {
        IssueCollector collector = new IssueCollector();
        List<Sanitizer> sanitizers = List.of(
                new DeploymentSanitizer(collector, cache),
                new PodSanitizer(collector, cache));

        run(sanitizers, request);

        Outcome outcome = collector.outcome();
        log.info("Sanitized {} resources: {}", outcome.size(), outcome.countBySeverity());
        return outcome;
    }

    /**
     * 모든 새니타이저가 끝날 때까지 기다린 뒤 첫 번째 실패를 다시 던진다
     */
    private void run(List<Sanitizer> sanitizers, SanitizeRequest request) {
        int threads = Math.min(properties.getWorkerThreads(), sanitizers.size());
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (Sanitizer sanitizer : sanitizers) {
                futures.add(executor.submit(() -> sanitizer.sanitize(request)));
            }

            RuntimeException failure = null;
            for (int i = 0; i < futures.size(); i++) {
                try {
                    futures.get(i).get();
                } catch (ExecutionException e) {
                    log.error("{} sanitizer failed: {}", sanitizers.get(i).getResourceKind(), e.getCause().getMessage(), e.getCause());
                    if (failure == null) {
                        failure = unwrap(e);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Interrupted while waiting for sanitizers", e);
                }
            }

            if (failure != null) {
                throw failure;
            }
        } finally {
            executor.shutdown();
        }
    }

    private static RuntimeException unwrap(ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        return new IllegalStateException("Sanitizer failed", cause);
    }
}
