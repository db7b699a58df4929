package com.vibecoding.k8ssanitizer.cache;

import com.vibecoding.k8ssanitizer.config.SanitizerProperties;
import com.vibecoding.k8ssanitizer.exception.K8sApiException;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.metrics.v1beta1.PodMetrics;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Kubernetes API에서 새니타이즈용 스냅샷을 읽어 온다
 */
@Component
@RequiredArgsConstructor
public class ClusterSnapshotLoader {

    private static final Logger log = LoggerFactory.getLogger(ClusterSnapshotLoader.class);

    private final KubernetesClient client;
    private final SanitizerProperties properties;

    public ClusterCache load() {
        String namespace = properties.hasNamespace() ? properties.getNamespace() : null;
        log.info("Loading cluster snapshot (namespace: {})", namespace != null ? namespace : "<all>");

        List<Deployment> deployments = listDeployments(namespace);
        List<Pod> pods = listPods(namespace);
        List<PodMetrics> metrics = listPodsMetrics(namespace, pods);

        log.info("Loaded {} deployments, {} pods, {} pod metrics", deployments.size(), pods.size(), metrics.size());
        return new ClusterCache(deployments, pods, metrics, properties);
    }

    // ========== Deployment ==========

    private List<Deployment> listDeployments(String namespace) {
        try {
            if (namespace != null) {
                return client.apps().deployments().inNamespace(namespace).list().getItems();
            }
            return client.apps().deployments().inAnyNamespace().list().getItems();
        } catch (KubernetesClientException e) {
            log.error("Failed to list deployments (namespace: {})", namespace, e);
            throw new K8sApiException("Deployment", "Failed to list deployments", e);
        }
    }

    // ========== Pod ==========

    private List<Pod> listPods(String namespace) {
        try {
            if (namespace != null) {
                return client.pods().inNamespace(namespace).list().getItems();
            }
            return client.pods().inAnyNamespace().list().getItems();
        } catch (KubernetesClientException e) {
            log.error("Failed to list pods (namespace: {})", namespace, e);
            throw new K8sApiException("Pod", "Failed to list pods", e);
        }
    }

    // ========== Metrics ==========

    /**
     * metrics-server가 없거나 응답하지 않는 namespace는 건너뛴다 (사용량 0으로 취급)
     */
    private List<PodMetrics> listPodsMetrics(String namespace, List<Pod> pods) {
        Set<String> namespaces = new TreeSet<>();
        if (namespace != null) {
            namespaces.add(namespace);
        } else {
            pods.stream()
                    .map(pod -> pod.getMetadata().getNamespace())
                    .filter(Objects::nonNull)
                    .forEach(namespaces::add);
        }
        return collectPodsMetrics(namespaces,
                ns -> client.top().pods().inNamespace(ns).metrics().getItems());
    }

    static List<PodMetrics> collectPodsMetrics(Set<String> namespaces, Function<String, List<PodMetrics>> fetch) {
        List<PodMetrics> metrics = new ArrayList<>();
        for (String ns : namespaces) {
            try {
                metrics.addAll(fetch.apply(ns));
            } catch (KubernetesClientException e) {
                log.warn("Pod metrics unavailable in namespace {}: {}", ns, e.getMessage());
            }
        }
        return metrics;
    }
}
