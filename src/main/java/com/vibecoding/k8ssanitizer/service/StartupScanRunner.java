package com.vibecoding.k8ssanitizer.service;

import com.vibecoding.k8ssanitizer.config.SanitizerProperties;
import com.vibecoding.k8ssanitizer.model.Issue;
import com.vibecoding.k8ssanitizer.model.Outcome;
import com.vibecoding.k8ssanitizer.model.SanitizeRequest;
import com.vibecoding.k8ssanitizer.model.Severity;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 애플리케이션 시작 시 한 번 스캔하고 결과 요약을 로그로 남긴다
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "sanitizer", name = "scan-on-startup", havingValue = "true", matchIfMissing = true)
public class StartupScanRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(StartupScanRunner.class);

    private final SanitizeService sanitizeService;
    private final SanitizerProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        SanitizeRequest request = SanitizeRequest.builder()
                .overAllocs(properties.isOverAllocs())
                .build();

        Outcome outcome = sanitizeService.sanitizeCluster(request);

        for (String fqn : outcome.fqns()) {
            Severity max = outcome.maxSeverity(fqn);
            if (max == Severity.OK) {
                continue;
            }
            List<Issue> issues = outcome.issues(fqn);
            log.info("[{}] {} ({} issues)", max.getDisplayName(), fqn, issues.size());
            for (Issue issue : issues) {
                String group = issue.isRoot() ? "" : "[" + issue.getGroup() + "] ";
                log.info("    {} {}{}", issue.getLevel().getDisplayName(), group, issue.getMessage());
            }
        }
        log.info("Scan completed: {} resources, {}", outcome.size(), outcome.countBySeverity());
    }
}
