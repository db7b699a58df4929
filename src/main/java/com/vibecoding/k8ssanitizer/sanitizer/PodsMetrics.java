package com.vibecoding.k8ssanitizer.sanitizer;

import com.vibecoding.k8ssanitizer.exception.MalformedResourceException;
import com.vibecoding.k8ssanitizer.model.ContainerMetrics;
import com.vibecoding.k8ssanitizer.util.Quantities;
import io.fabric8.kubernetes.api.model.metrics.v1beta1.PodMetrics;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pod 메트릭을 컨테이너 단위 사용량으로 변환
 */
final class PodsMetrics {

    private PodsMetrics() {
    }

    /**
     * Pod FQN -> (컨테이너 이름 -> 사용량)
     */
    static Map<String, Map<String, ContainerMetrics>> index(Map<String, PodMetrics> podsMetrics) {
        Map<String, Map<String, ContainerMetrics>> indexed = new LinkedHashMap<>();
        podsMetrics.forEach((fqn, pmx) -> {
            try {
                indexed.put(fqn, containers(pmx));
            } catch (IllegalArgumentException e) {
                throw new MalformedResourceException(fqn, "Malformed pod metrics", e);
            }
        });
        return indexed;
    }

    private static Map<String, ContainerMetrics> containers(PodMetrics pmx) {
        if (pmx.getContainers() == null) {
            return Collections.emptyMap();
        }
        Map<String, ContainerMetrics> containers = new LinkedHashMap<>();
        for (io.fabric8.kubernetes.api.model.metrics.v1beta1.ContainerMetrics cx : pmx.getContainers()) {
            containers.put(cx.getName(), new ContainerMetrics(
                    Quantities.cpu(cx.getUsage()),
                    Quantities.memory(cx.getUsage())));
        }
        return containers;
    }

    /**
     * Pod 전체 사용량 합계, 메트릭이 없으면 0
     */
    static ContainerMetrics total(Map<String, ContainerMetrics> containers) {
        if (containers == null) {
            return ContainerMetrics.ZERO;
        }
        BigDecimal cpu = BigDecimal.ZERO;
        BigDecimal mem = BigDecimal.ZERO;
        for (ContainerMetrics mx : containers.values()) {
            cpu = cpu.add(mx.getCurrentCpu());
            mem = mem.add(mx.getCurrentMem());
        }
        return new ContainerMetrics(cpu, mem);
    }
}
