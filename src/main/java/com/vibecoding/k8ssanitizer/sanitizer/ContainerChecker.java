package com.vibecoding.k8ssanitizer.sanitizer;

import com.vibecoding.k8ssanitizer.cache.PodLimiter;
import com.vibecoding.k8ssanitizer.model.ContainerMetrics;
import com.vibecoding.k8ssanitizer.model.Issue;
import com.vibecoding.k8ssanitizer.model.Qos;
import com.vibecoding.k8ssanitizer.model.Severity;
import com.vibecoding.k8ssanitizer.util.Quantities;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.Quantity;
import io.fabric8.kubernetes.api.model.ResourceRequirements;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 컨테이너 단위 검사 (그룹 = 컨테이너 이름)
 */
public class ContainerChecker {

    static final String NO_RESOURCES = "No resources defined";
    static final String NO_LIMITS = "No resource limits defined";
    static final String CPU_THRESHOLD = "CPU threshold (%.0f%%) reached %.0f%%";
    static final String MEM_THRESHOLD = "Memory threshold (%.0f%%) reached %.0f%%";

    /**
     * requests/limits 선언 여부 검사
     */
    public void checkResources(Container co, List<Issue> issues) {
        Map<String, Quantity> requests = requests(co);
        Map<String, Quantity> limits = limits(co);

        // ephemeral-storage, GPU 등은 CPU/Memory 선언으로 치지 않음
        if (!declaresCpuOrMem(requests) && !declaresCpuOrMem(limits)) {
            issues.add(Issue.of(co.getName(), Severity.WARN, NO_RESOURCES));
            return;
        }
        if (!declaresCpuOrMem(limits)) {
            issues.add(Issue.of(co.getName(), Severity.INFO, NO_LIMITS));
        }
    }

    /**
     * 선언된 limit 대비 현재 사용량이 상한을 넘었는지 검사
     */
    public void checkUtilization(Container co, ContainerMetrics mx, PodLimiter limiter, List<Issue> issues) {
        Map<String, Quantity> limits = limits(co);

        BigDecimal cpuLimit = Quantities.cpu(limits);
        if (cpuLimit.signum() > 0) {
            double perc = percentage(mx.getCurrentCpu(), cpuLimit);
            if (perc > limiter.podCpuLimit()) {
                issues.add(Issue.format(co.getName(), Severity.ERROR, CPU_THRESHOLD, limiter.podCpuLimit(), perc));
            }
        }

        BigDecimal memLimit = Quantities.memory(limits);
        if (memLimit.signum() > 0) {
            double perc = percentage(mx.getCurrentMem(), memLimit);
            if (perc > limiter.podMemLimit()) {
                issues.add(Issue.format(co.getName(), Severity.ERROR, MEM_THRESHOLD, limiter.podMemLimit(), perc));
            }
        }
    }

    /**
     * 스케줄링 기준 CPU 요청량. request가 없고 limit만 있으면 API 서버 기본값처럼 limit을 사용한다.
     */
    public static BigDecimal requestedCpu(Container co) {
        Map<String, Quantity> requests = requests(co);
        if (requests.containsKey(Quantities.CPU)) {
            return Quantities.cpu(requests);
        }
        return Quantities.cpu(limits(co));
    }

    public static BigDecimal requestedMem(Container co) {
        Map<String, Quantity> requests = requests(co);
        if (requests.containsKey(Quantities.MEMORY)) {
            return Quantities.memory(requests);
        }
        return Quantities.memory(limits(co));
    }

    public static Qos qos(Container co) {
        Map<String, Quantity> requests = requests(co);
        Map<String, Quantity> limits = limits(co);

        if (!declaresCpuOrMem(requests) && !declaresCpuOrMem(limits)) {
            return Qos.BEST_EFFORT;
        }
        boolean cpuEqual = requestedCpu(co).compareTo(Quantities.cpu(limits)) == 0;
        boolean memEqual = requestedMem(co).compareTo(Quantities.memory(limits)) == 0;
        if (limits.containsKey(Quantities.CPU) && limits.containsKey(Quantities.MEMORY) && cpuEqual && memEqual) {
            return Qos.GUARANTEED;
        }
        return Qos.BURSTABLE;
    }

    private static boolean declaresCpuOrMem(Map<String, Quantity> resources) {
        return resources.containsKey(Quantities.CPU) || resources.containsKey(Quantities.MEMORY);
    }

    private static Map<String, Quantity> requests(Container co) {
        ResourceRequirements resources = co.getResources();
        if (resources == null || resources.getRequests() == null) {
            return Collections.emptyMap();
        }
        return resources.getRequests();
    }

    private static Map<String, Quantity> limits(Container co) {
        ResourceRequirements resources = co.getResources();
        if (resources == null || resources.getLimits() == null) {
            return Collections.emptyMap();
        }
        return resources.getLimits();
    }

    private static double percentage(BigDecimal current, BigDecimal limit) {
        return current.doubleValue() / limit.doubleValue() * 100;
    }
}
