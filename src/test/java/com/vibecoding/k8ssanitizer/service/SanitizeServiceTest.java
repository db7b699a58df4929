package com.vibecoding.k8ssanitizer.service;

import com.vibecoding.k8ssanitizer.cache.ClusterCache;
import com.vibecoding.k8ssanitizer.cache.ClusterSnapshotLoader;
import com.vibecoding.k8ssanitizer.config.SanitizerProperties;
import com.vibecoding.k8ssanitizer.exception.MalformedResourceException;
import com.vibecoding.k8ssanitizer.model.Issue;
import com.vibecoding.k8ssanitizer.model.Outcome;
import com.vibecoding.k8ssanitizer.model.SanitizeRequest;
import com.vibecoding.k8ssanitizer.model.Severity;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodBuilder;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.apps.DeploymentBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SanitizeServiceTest {

    @Mock
    ClusterSnapshotLoader snapshotLoader;

    private SanitizerProperties properties;
    private SanitizeService service;

    @BeforeEach
    void setUp() {
        properties = new SanitizerProperties();
        service = new SanitizeService(snapshotLoader, properties);
    }

    @Test
    void combinesAllKindsIntoOneOutcome() {
        ClusterCache cache = new ClusterCache(
                List.of(deployment("d1", 0), deployment("d2", 1)),
                List.of(pod("p1", "Running", true), pod("p2", "Running", false)),
                List.of(),
                properties);

        Outcome outcome = service.sanitize(cache, SanitizeRequest.defaults());

        assertThat(outcome.fqns()).containsExactlyInAnyOrder("default/d1", "default/d2", "default/p1", "default/p2");
        assertThat(outcome.get("default/d1")).containsExactly(
                Issue.of(Issue.ROOT, Severity.WARN, "Zero scale detected"));
        assertThat(outcome.get("default/d2")).isEmpty();
        assertThat(outcome.get("default/p1")).isEmpty();
        assertThat(outcome.get("default/p2")).containsExactly(
                Issue.of("c1", Severity.ERROR, "Container is not ready"));
    }

    @Test
    void sanitizeClusterLoadsSnapshot() {
        when(snapshotLoader.load()).thenReturn(new ClusterCache(
                List.of(deployment("d1", 0)), List.of(), List.of(), properties));

        Outcome outcome = service.sanitizeCluster(SanitizeRequest.defaults());

        verify(snapshotLoader).load();
        assertThat(outcome.maxSeverity("default/d1")).isEqualTo(Severity.WARN);
    }

    @Test
    void failureIsRethrownAfterOtherKindsFinish() {
        Deployment broken = new DeploymentBuilder(deployment("d1", 1))
                .editSpec().withTemplate(null).endSpec()
                .build();
        ClusterCache cache = new ClusterCache(List.of(broken), List.of(pod("p1", "Running", true)), List.of(), properties);

        assertThatThrownBy(() -> service.sanitize(cache, SanitizeRequest.defaults()))
                .isInstanceOf(MalformedResourceException.class)
                .hasMessageContaining("default/d1");
    }

    @Test
    void emptyCluster() {
        Outcome outcome = service.sanitize(ClusterCache.empty(properties), SanitizeRequest.withOverAllocs());

        assertThat(outcome.isEmpty()).isTrue();
    }

    private static Deployment deployment(String name, int replicas) {
        return new DeploymentBuilder()
                .withNewMetadata().withNamespace("default").withName(name).endMetadata()
                .withNewSpec()
                    .withReplicas(replicas)
                    .withNewSelector().addToMatchLabels("app", name).endSelector()
                    .withNewTemplate()
                        .withNewSpec()
                            .addNewContainer()
                                .withName("c1")
                                .withNewResources()
                                    .addToLimits("cpu", new io.fabric8.kubernetes.api.model.Quantity("100m"))
                                .endResources()
                            .endContainer()
                        .endSpec()
                    .endTemplate()
                .endSpec()
                .withNewStatus().withAvailableReplicas(replicas).endStatus()
                .build();
    }

    private static Pod pod(String name, String phase, boolean ready) {
        return new PodBuilder()
                .withNewMetadata().withNamespace("default").withName(name).endMetadata()
                .withNewSpec()
                    .addNewContainer()
                        .withName("c1")
                        .withNewResources()
                            .addToLimits("cpu", new io.fabric8.kubernetes.api.model.Quantity("100m"))
                        .endResources()
                    .endContainer()
                .endSpec()
                .withNewStatus()
                    .withPhase(phase)
                    .addNewContainerStatus().withName("c1").withReady(ready).withRestartCount(0).endContainerStatus()
                .endStatus()
                .build();
    }
}
