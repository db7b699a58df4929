package com.vibecoding.k8ssanitizer.cache;

import com.vibecoding.k8ssanitizer.config.SanitizerProperties;
import com.vibecoding.k8ssanitizer.model.Allocations;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.LabelSelector;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.metrics.v1beta1.PodMetrics;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 한 시점의 클러스터 스냅샷 (FQN으로 인덱싱)
 * 모든 조회는 메모리 안에서 끝나며 로딩 이후 변경되지 않는다.
 */
public class ClusterCache implements DeploymentLister, PodLister {

    private final Map<String, Deployment> deployments;
    private final Map<String, Pod> pods;
    private final Map<String, PodMetrics> podsMetrics;
    private final SanitizerProperties properties;

    public ClusterCache(Collection<Deployment> deployments,
                        Collection<Pod> pods,
                        Collection<PodMetrics> podsMetrics,
                        SanitizerProperties properties) {
        this.deployments = index(deployments);
        this.pods = index(pods);
        this.podsMetrics = index(podsMetrics);
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    public static ClusterCache empty(SanitizerProperties properties) {
        return new ClusterCache(List.of(), List.of(), List.of(), properties);
    }

    private static <T extends HasMetadata> Map<String, T> index(Collection<T> items) {
        Map<String, T> indexed = new LinkedHashMap<>();
        for (T item : items) {
            indexed.put(Fqn.of(item), item);
        }
        return Collections.unmodifiableMap(indexed);
    }

    @Override
    public Map<String, Deployment> listDeployments() {
        return deployments;
    }

    @Override
    public Map<String, Pod> listPods() {
        return pods;
    }

    @Override
    public Map<String, PodMetrics> listPodsMetrics() {
        return podsMetrics;
    }

    @Override
    public Map<String, Pod> listPodsBySelector(String namespace, LabelSelector selector) {
        Map<String, Pod> selected = new LinkedHashMap<>();
        pods.forEach((fqn, pod) -> {
            if (Objects.equals(namespace, pod.getMetadata().getNamespace())
                    && LabelSelectors.matches(selector, pod.getMetadata().getLabels())) {
                selected.put(fqn, pod);
            }
        });
        return selected;
    }

    @Override
    public Allocations cpuResourceLimits() {
        return properties.getCpu();
    }

    @Override
    public Allocations memResourceLimits() {
        return properties.getMemory();
    }

    @Override
    public int restartsLimit() {
        return properties.getRestartsLimit();
    }

    @Override
    public double podCpuLimit() {
        return properties.getPodCpuLimit();
    }

    @Override
    public double podMemLimit() {
        return properties.getPodMemLimit();
    }
}
