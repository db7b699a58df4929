package com.vibecoding.k8ssanitizer.cache;

import io.fabric8.kubernetes.api.model.apps.Deployment;

import java.util.Map;

/**
 * Deployment 새니타이저가 필요로 하는 데이터 접근 기능
 */
public interface DeploymentLister extends PodSelectorLister, PodsMetricsLister, ResourceLimiter, PodLimiter {

    Map<String, Deployment> listDeployments();
}
