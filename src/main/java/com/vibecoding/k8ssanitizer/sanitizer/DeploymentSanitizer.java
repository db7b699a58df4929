package com.vibecoding.k8ssanitizer.sanitizer;

import com.vibecoding.k8ssanitizer.cache.DeploymentLister;
import com.vibecoding.k8ssanitizer.collector.IssueCollector;
import com.vibecoding.k8ssanitizer.exception.MalformedResourceException;
import com.vibecoding.k8ssanitizer.model.Allocations;
import com.vibecoding.k8ssanitizer.model.ConsumptionMetrics;
import com.vibecoding.k8ssanitizer.model.ContainerMetrics;
import com.vibecoding.k8ssanitizer.model.Issue;
import com.vibecoding.k8ssanitizer.model.Outcome;
import com.vibecoding.k8ssanitizer.model.Qos;
import com.vibecoding.k8ssanitizer.model.SanitizeRequest;
import com.vibecoding.k8ssanitizer.model.Severity;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.PodSpec;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.apps.DeploymentSpec;
import io.fabric8.kubernetes.api.model.apps.DeploymentStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Deployment 새니타이저
 */
public class DeploymentSanitizer implements Sanitizer {

    private static final Logger log = LoggerFactory.getLogger(DeploymentSanitizer.class);

    static final String ZERO_SCALE = "Zero scale detected";
    static final String NO_AVAILABLE_REPLICAS = "Used? No available replicas found";
    static final String COLLISIONS = "ReplicaSet collisions detected (%d)";

    private final IssueCollector collector;
    private final DeploymentLister lister;
    private final UtilizationAnalyzer analyzer = new UtilizationAnalyzer();
    private final ContainerChecker containerChecker = new ContainerChecker();

    // 할당 분석이 필요할 때 한 번만 조회
    private Map<String, Map<String, ContainerMetrics>> podsMetrics;

    public DeploymentSanitizer(IssueCollector collector, DeploymentLister lister) {
        this.collector = collector;
        this.lister = lister;
    }

    @Override
    public String getResourceKind() {
        return "Deployment";
    }

    @Override
    public void sanitize(SanitizeRequest request) {
        Map<String, Deployment> deployments = new TreeMap<>(lister.listDeployments());
        log.info("Sanitizing {} deployments (overAllocs: {})", deployments.size(), request.isOverAllocs());
        podsMetrics = null;

        for (Map.Entry<String, Deployment> entry : deployments.entrySet()) {
            String fqn = entry.getKey();
            List<Issue> issues = new ArrayList<>();
            try {
                sanitize(fqn, entry.getValue(), request.isOverAllocs(), issues);
            } catch (IllegalArgumentException e) {
                throw new MalformedResourceException(fqn, "Malformed deployment", e);
            }
            collector.commit(fqn, issues);
            log.debug("Deployment {} sanitized with {} issues", fqn, issues.size());
        }
    }

    @Override
    public Outcome outcome() {
        return collector.outcome();
    }

    private void sanitize(String fqn, Deployment dp, boolean overAllocs, List<Issue> issues) {
        DeploymentSpec spec = dp.getSpec();
        if (spec == null || spec.getTemplate() == null || spec.getTemplate().getSpec() == null) {
            throw new MalformedResourceException(fqn, "Deployment has no pod template");
        }
        DeploymentStatus status = dp.getStatus();

        int replicas = spec.getReplicas() != null ? spec.getReplicas() : 1;
        int available = status != null && status.getAvailableReplicas() != null ? status.getAvailableReplicas() : 0;
        int collisions = status != null && status.getCollisionCount() != null ? status.getCollisionCount() : 0;

        checkDeployment(replicas, available, collisions, issues);
        checkContainers(spec.getTemplate().getSpec(), issues);

        if (overAllocs) {
            checkUtilization(fqn, dp, available, issues);
        }
    }

    private void checkDeployment(int replicas, int available, int collisions, List<Issue> issues) {
        if (replicas == 0) {
            issues.add(Issue.of(Issue.ROOT, Severity.WARN, ZERO_SCALE));
        }
        if (replicas != 0 && available == 0) {
            issues.add(Issue.of(Issue.ROOT, Severity.WARN, NO_AVAILABLE_REPLICAS));
        }
        if (collisions > 0) {
            issues.add(Issue.format(Issue.ROOT, Severity.ERROR, COLLISIONS, collisions));
        }
    }

    /**
     * init 컨테이너 먼저, 그 다음 일반 컨테이너
     */
    private void checkContainers(PodSpec spec, List<Issue> issues) {
        for (Container co : containers(spec.getInitContainers())) {
            containerChecker.checkResources(co, issues);
        }
        for (Container co : containers(spec.getContainers())) {
            containerChecker.checkResources(co, issues);
        }
    }

    private void checkUtilization(String fqn, Deployment dp, int available, List<Issue> issues) {
        // Best-effort는 비교할 요청량이 없으므로 비율 계산 자체를 건너뜀
        Qos qos = templateQos(dp.getSpec().getTemplate().getSpec());
        if (qos == Qos.BEST_EFFORT) {
            log.debug("Deployment {} is best-effort, skipping utilization", fqn);
            return;
        }

        Allocations cpuAllocations = lister.cpuResourceLimits();
        Allocations memAllocations = lister.memResourceLimits();

        ConsumptionMetrics mx = deploymentUsage(dp, available);
        log.debug("Deployment {} usage: {}", fqn, mx);

        analyzer.checkCpu(mx, cpuAllocations).ifPresent(issues::add);
        analyzer.checkMem(mx, memAllocations).ifPresent(issues::add);
    }

    /**
     * 요청량 = 템플릿 컨테이너 요청 합 x 가용 레플리카,
     * 사용량 = 셀렉터로 선택된 Pod들의 컨테이너 사용량 합 (메트릭 없는 Pod은 0)
     */
    ConsumptionMetrics deploymentUsage(Deployment dp, int available) {
        BigDecimal requestCpu = BigDecimal.ZERO;
        BigDecimal requestMem = BigDecimal.ZERO;
        for (Container co : containers(dp.getSpec().getTemplate().getSpec().getContainers())) {
            requestCpu = requestCpu.add(ContainerChecker.requestedCpu(co));
            requestMem = requestMem.add(ContainerChecker.requestedMem(co));
        }
        BigDecimal replicas = BigDecimal.valueOf(available);

        BigDecimal currentCpu = BigDecimal.ZERO;
        BigDecimal currentMem = BigDecimal.ZERO;
        Map<String, Map<String, ContainerMetrics>> pmx = podsMetrics();
        String namespace = dp.getMetadata().getNamespace();
        for (String podFqn : lister.listPodsBySelector(namespace, dp.getSpec().getSelector()).keySet()) {
            ContainerMetrics total = PodsMetrics.total(pmx.get(podFqn));
            currentCpu = currentCpu.add(total.getCurrentCpu());
            currentMem = currentMem.add(total.getCurrentMem());
        }

        return ConsumptionMetrics.builder()
                .requestCpu(requestCpu.multiply(replicas))
                .requestMem(requestMem.multiply(replicas))
                .currentCpu(currentCpu)
                .currentMem(currentMem)
                .build();
    }

    /**
     * 템플릿 컨테이너들의 QoS를 합친 값, 컨테이너가 없으면 Best-effort
     */
    static Qos templateQos(PodSpec spec) {
        Qos qos = null;
        for (Container co : containers(spec.getContainers())) {
            Qos containerQos = ContainerChecker.qos(co);
            qos = qos == null ? containerQos : qos.merge(containerQos);
        }
        return qos != null ? qos : Qos.BEST_EFFORT;
    }

    private Map<String, Map<String, ContainerMetrics>> podsMetrics() {
        if (podsMetrics == null) {
            podsMetrics = PodsMetrics.index(lister.listPodsMetrics());
        }
        return podsMetrics;
    }

    private static List<Container> containers(List<Container> containers) {
        return containers != null ? containers : Collections.emptyList();
    }
}
