package com.vibecoding.k8ssanitizer.cache;

import io.fabric8.kubernetes.api.model.Pod;

import java.util.Map;

/**
 * Pod 새니타이저가 필요로 하는 데이터 접근 기능
 */
public interface PodLister extends PodsMetricsLister, PodLimiter {

    Map<String, Pod> listPods();
}
