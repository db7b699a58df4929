package com.vibecoding.k8ssanitizer.config;

import com.vibecoding.k8ssanitizer.model.Allocations;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * 새니타이저 임계값 설정
 */
@Configuration
@ConfigurationProperties(prefix = "sanitizer")
@Data
public class SanitizerProperties {

    private static final Logger log = LoggerFactory.getLogger(SanitizerProperties.class);

    private Allocations cpu = new Allocations(200, 50);
    private Allocations memory = new Allocations(200, 50);
    private int restartsLimit = 3;
    private double podCpuLimit = 80;
    private double podMemLimit = 80;

    // 메트릭 기반 할당 분석 (비용이 커서 기본 비활성)
    private boolean overAllocs = false;

    // 비어 있으면 전체 네임스페이스
    private String namespace;

    private boolean scanOnStartup = true;
    private int workerThreads = 4;

    @PostConstruct
    public void validate() {
        checkAllocations("cpu", cpu);
        checkAllocations("memory", memory);
        if (restartsLimit < 0) {
            throw new IllegalStateException("sanitizer.restarts-limit must not be negative: " + restartsLimit);
        }
        if (podCpuLimit < 0 || podMemLimit < 0) {
            throw new IllegalStateException(String.format(
                    "sanitizer pod limits must not be negative (cpu=%s, memory=%s)", podCpuLimit, podMemLimit));
        }
        if (workerThreads < 1) {
            throw new IllegalStateException("sanitizer.worker-threads must be at least 1: " + workerThreads);
        }

        log.info("Sanitizer configuration validated");
        log.info("  - CPU allocations: under {}% / over {}%", cpu.getUnderPerc(), cpu.getOverPerc());
        log.info("  - Memory allocations: under {}% / over {}%", memory.getUnderPerc(), memory.getOverPerc());
        log.info("  - Restarts limit: {}", restartsLimit);
        log.info("  - Over allocation analysis: {}", overAllocs);
    }

    private static void checkAllocations(String dimension, Allocations allocations) {
        if (allocations == null) {
            throw new IllegalStateException("sanitizer." + dimension + " allocations are not configured");
        }
        if (allocations.getUnderPerc() < 0 || allocations.getOverPerc() < 0) {
            throw new IllegalStateException(String.format(
                    "sanitizer.%s allocations must not be negative (under=%d, over=%d)",
                    dimension, allocations.getUnderPerc(), allocations.getOverPerc()));
        }
    }

    public boolean hasNamespace() {
        return namespace != null && !namespace.isBlank();
    }
}
