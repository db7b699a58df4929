package com.vibecoding.k8ssanitizer.cache;

import io.fabric8.kubernetes.api.model.metrics.v1beta1.PodMetrics;
import io.fabric8.kubernetes.api.model.metrics.v1beta1.PodMetricsBuilder;
import io.fabric8.kubernetes.client.KubernetesClientException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;

class ClusterSnapshotLoaderTest {

    @Test
    void failingNamespaceKeepsOtherMetrics() {
        Set<String> namespaces = new TreeSet<>(List.of("alpha", "forbidden", "omega"));

        List<PodMetrics> metrics = ClusterSnapshotLoader.collectPodsMetrics(namespaces, ns -> {
            if ("forbidden".equals(ns)) {
                throw new KubernetesClientException("pods.metrics.k8s.io is forbidden");
            }
            return List.of(metrics(ns, "p1"));
        });

        assertThat(metrics).extracting(pm -> pm.getMetadata().getNamespace()).containsExactly("alpha", "omega");
    }

    @Test
    void metricsUnavailableEverywhere() {
        List<PodMetrics> metrics = ClusterSnapshotLoader.collectPodsMetrics(Set.of("default"), ns -> {
            throw new KubernetesClientException("the server could not find the requested resource");
        });

        assertThat(metrics).isEmpty();
    }

    private static PodMetrics metrics(String namespace, String name) {
        return new PodMetricsBuilder()
                .withNewMetadata().withNamespace(namespace).withName(name).endMetadata()
                .build();
    }
}
