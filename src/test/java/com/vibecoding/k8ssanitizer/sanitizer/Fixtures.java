package com.vibecoding.k8ssanitizer.sanitizer;

import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.ContainerBuilder;
import io.fabric8.kubernetes.api.model.ContainerStatus;
import io.fabric8.kubernetes.api.model.ContainerStatusBuilder;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodBuilder;
import io.fabric8.kubernetes.api.model.Quantity;
import io.fabric8.kubernetes.api.model.ResourceRequirements;
import io.fabric8.kubernetes.api.model.ResourceRequirementsBuilder;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.apps.DeploymentBuilder;
import io.fabric8.kubernetes.api.model.metrics.v1beta1.PodMetrics;
import io.fabric8.kubernetes.api.model.metrics.v1beta1.PodMetricsBuilder;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 새니타이저 테스트용 리소스 생성 헬퍼
 */
final class Fixtures {

    static final String NAMESPACE = "default";
    static final String IMAGE = "fred:0.0.1";

    private Fixtures() {
    }

    /**
     * 컨테이너 requests/limits (null이면 선언하지 않음)
     */
    static final class Res {
        final String rcpu;
        final String rmem;
        final String lcpu;
        final String lmem;

        private Res(String rcpu, String rmem, String lcpu, String lmem) {
            this.rcpu = rcpu;
            this.rmem = rmem;
            this.lcpu = lcpu;
            this.lmem = lmem;
        }

        static Res of(String rcpu, String rmem, String lcpu, String lmem) {
            return new Res(rcpu, rmem, lcpu, lmem);
        }

        static Res none() {
            return new Res(null, null, null, null);
        }

        ResourceRequirements toRequirements() {
            ResourceRequirementsBuilder builder = new ResourceRequirementsBuilder();
            if (rcpu != null) {
                builder.addToRequests("cpu", new Quantity(rcpu));
            }
            if (rmem != null) {
                builder.addToRequests("memory", new Quantity(rmem));
            }
            if (lcpu != null) {
                builder.addToLimits("cpu", new Quantity(lcpu));
            }
            if (lmem != null) {
                builder.addToLimits("memory", new Quantity(lmem));
            }
            return builder.build();
        }
    }

    static Container container(String name, Res res) {
        return new ContainerBuilder()
                .withName(name)
                .withImage(IMAGE)
                .withResources(res.toRequirements())
                .build();
    }

    /**
     * init 컨테이너 i1, 컨테이너 c1, 셀렉터 fred=blee
     */
    static Deployment deployment(String name, Integer replicas, int available, int collisions, Res res) {
        return new DeploymentBuilder()
                .withNewMetadata()
                    .withName(name)
                    .withNamespace(NAMESPACE)
                .endMetadata()
                .withNewSpec()
                    .withReplicas(replicas)
                    .withNewSelector()
                        .addToMatchLabels("fred", "blee")
                    .endSelector()
                    .withNewTemplate()
                        .withNewMetadata()
                            .addToLabels("fred", "blee")
                        .endMetadata()
                        .withNewSpec()
                            .withInitContainers(container("i1", res))
                            .withContainers(container("c1", res))
                        .endSpec()
                    .endTemplate()
                .endSpec()
                .withNewStatus()
                    .withAvailableReplicas(available)
                    .withCollisionCount(collisions)
                .endStatus()
                .build();
    }

    static Pod pod(String name, String phase, Res res, ContainerStatus... statuses) {
        return new PodBuilder()
                .withNewMetadata()
                    .withName(name)
                    .withNamespace(NAMESPACE)
                    .addToLabels("fred", "blee")
                .endMetadata()
                .withNewSpec()
                    .withInitContainers(container("i1", res))
                    .withContainers(container("c1", res))
                .endSpec()
                .withNewStatus()
                    .withPhase(phase)
                    .withContainerStatuses(Arrays.asList(statuses))
                .endStatus()
                .build();
    }

    static ContainerStatus status(String name, boolean ready, int restarts) {
        return new ContainerStatusBuilder()
                .withName(name)
                .withReady(ready)
                .withRestartCount(restarts)
                .build();
    }

    static PodMetrics podMetrics(String podName, String container, String cpu, String mem) {
        return new PodMetricsBuilder()
                .withNewMetadata()
                    .withName(podName)
                    .withNamespace(NAMESPACE)
                .endMetadata()
                .addNewContainer()
                    .withName(container)
                    .addToUsage("cpu", new Quantity(cpu))
                    .addToUsage("memory", new Quantity(mem))
                .endContainer()
                .build();
    }

    static List<Pod> runningPods(Res res, String... names) {
        return Arrays.stream(names)
                .map(name -> pod(name, "Running", res, status("c1", true, 0)))
                .collect(Collectors.toList());
    }
}
