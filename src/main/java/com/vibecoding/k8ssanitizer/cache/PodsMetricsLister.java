package com.vibecoding.k8ssanitizer.cache;

import io.fabric8.kubernetes.api.model.metrics.v1beta1.PodMetrics;

import java.util.Map;

/**
 * Pod 현재 사용량 조회
 */
public interface PodsMetricsLister {

    /**
     * Pod FQN -> 메트릭. 메트릭이 아직 수집되지 않은 Pod은 포함되지 않는다.
     */
    Map<String, PodMetrics> listPodsMetrics();
}
