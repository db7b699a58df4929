package com.vibecoding.k8ssanitizer.sanitizer;

import com.vibecoding.k8ssanitizer.cache.PodLister;
import com.vibecoding.k8ssanitizer.collector.IssueCollector;
import com.vibecoding.k8ssanitizer.exception.MalformedResourceException;
import com.vibecoding.k8ssanitizer.model.ContainerMetrics;
import com.vibecoding.k8ssanitizer.model.Issue;
import com.vibecoding.k8ssanitizer.model.Outcome;
import com.vibecoding.k8ssanitizer.model.SanitizeRequest;
import com.vibecoding.k8ssanitizer.model.Severity;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.ContainerStatus;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodSpec;
import io.fabric8.kubernetes.api.model.PodStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Pod 새니타이저
 */
public class PodSanitizer implements Sanitizer {

    private static final Logger log = LoggerFactory.getLogger(PodSanitizer.class);

    static final String RESTARTED = "Pod was restarted (%d) times";
    static final String NOT_READY = "Container is not ready";

    private final IssueCollector collector;
    private final PodLister lister;
    private final ContainerChecker containerChecker = new ContainerChecker();

    public PodSanitizer(IssueCollector collector, PodLister lister) {
        this.collector = collector;
        this.lister = lister;
    }

    @Override
    public String getResourceKind() {
        return "Pod";
    }

    @Override
    public void sanitize(SanitizeRequest request) {
        Map<String, Pod> pods = new TreeMap<>(lister.listPods());
        log.info("Sanitizing {} pods (overAllocs: {})", pods.size(), request.isOverAllocs());

        Map<String, Map<String, ContainerMetrics>> podsMetrics = request.isOverAllocs()
                ? PodsMetrics.index(lister.listPodsMetrics())
                : Collections.emptyMap();

        for (Map.Entry<String, Pod> entry : pods.entrySet()) {
            String fqn = entry.getKey();
            List<Issue> issues = new ArrayList<>();
            try {
                sanitize(entry.getValue(), podsMetrics.get(fqn), request.isOverAllocs(), issues);
            } catch (IllegalArgumentException e) {
                throw new MalformedResourceException(fqn, "Malformed pod", e);
            }
            collector.commit(fqn, issues);
            log.debug("Pod {} sanitized with {} issues", fqn, issues.size());
        }
    }

    @Override
    public Outcome outcome() {
        return collector.outcome();
    }

    private void sanitize(Pod pod, Map<String, ContainerMetrics> metrics, boolean overAllocs, List<Issue> issues) {
        PodSpec spec = pod.getSpec();
        if (spec == null) {
            throw new IllegalArgumentException("Pod has no spec");
        }
        PodStatus status = pod.getStatus();
        String phase = status != null ? status.getPhase() : null;
        if ("Succeeded".equals(phase) || "Failed".equals(phase)) {
            return;
        }

        for (Container co : containers(spec.getInitContainers())) {
            containerChecker.checkResources(co, issues);
        }
        for (Container co : containers(spec.getContainers())) {
            containerChecker.checkResources(co, issues);
        }

        if (status != null) {
            checkRestarts(status.getInitContainerStatuses(), issues);
            checkRestarts(status.getContainerStatuses(), issues);
            if ("Running".equals(phase)) {
                checkReadiness(status.getContainerStatuses(), issues);
            }
        }

        if (overAllocs && metrics != null) {
            for (Container co : containers(spec.getContainers())) {
                ContainerMetrics mx = metrics.get(co.getName());
                if (mx != null) {
                    containerChecker.checkUtilization(co, mx, lister, issues);
                }
            }
        }
    }

    private void checkRestarts(List<ContainerStatus> statuses, List<Issue> issues) {
        int limit = lister.restartsLimit();
        for (ContainerStatus cs : statuses(statuses)) {
            int restarts = cs.getRestartCount() != null ? cs.getRestartCount() : 0;
            if (restarts > limit) {
                issues.add(Issue.format(cs.getName(), Severity.WARN, RESTARTED, restarts));
            }
        }
    }

    private void checkReadiness(List<ContainerStatus> statuses, List<Issue> issues) {
        for (ContainerStatus cs : statuses(statuses)) {
            if (!Boolean.TRUE.equals(cs.getReady())) {
                issues.add(Issue.of(cs.getName(), Severity.ERROR, NOT_READY));
            }
        }
    }

    private static List<Container> containers(List<Container> containers) {
        return containers != null ? containers : Collections.emptyList();
    }

    private static List<ContainerStatus> statuses(List<ContainerStatus> statuses) {
        return statuses != null ? statuses : Collections.emptyList();
    }
}
