package com.vibecoding.k8ssanitizer.sanitizer;

import com.vibecoding.k8ssanitizer.model.Allocations;
import com.vibecoding.k8ssanitizer.model.ConsumptionMetrics;
import com.vibecoding.k8ssanitizer.model.Issue;
import com.vibecoding.k8ssanitizer.model.Severity;
import com.vibecoding.k8ssanitizer.util.Quantities;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.function.Function;

/**
 * 요청량 대비 현재 사용량 비율로 과소/과다 할당을 판정
 *
 * <p>기준값은 항상 요청량(request)이다. 한 차원에서 과소 할당을 먼저 검사하고,
 * 해당하지 않을 때만 과다 할당을 검사하므로 둘이 동시에 보고되지 않는다.
 */
public class UtilizationAnalyzer {

    static final String UNDER_ALLOCATED = "At current load, %s under allocated. Current:%s vs Requested:%s (%.2f%%)";
    static final String OVER_ALLOCATED = "At current load, %s over allocated. Current:%s vs Requested:%s (%.2f%%)";

    enum Dimension {
        CPU("CPU", Quantities::asMillicores),
        MEMORY("Memory", Quantities::asMebibytes);

        private final String label;
        private final Function<BigDecimal, String> formatter;

        Dimension(String label, Function<BigDecimal, String> formatter) {
            this.label = label;
            this.formatter = formatter;
        }
    }

    public Optional<Issue> checkCpu(ConsumptionMetrics mx, Allocations allocations) {
        return check(Dimension.CPU, mx.getCurrentCpu(), mx.getRequestCpu(),
                mx.cpuUsageRatio(), mx.cpuRequestRatio(), allocations);
    }

    public Optional<Issue> checkMem(ConsumptionMetrics mx, Allocations allocations) {
        return check(Dimension.MEMORY, mx.getCurrentMem(), mx.getRequestMem(),
                mx.memUsageRatio(), mx.memRequestRatio(), allocations);
    }

    private Optional<Issue> check(Dimension dimension,
                                  BigDecimal current,
                                  BigDecimal requested,
                                  double usageRatio,
                                  double requestRatio,
                                  Allocations allocations) {
        // 요청량이 없으면 비교 대상이 없음 (No resources defined 에서 이미 보고됨)
        if (requested.signum() == 0) {
            return Optional.empty();
        }
        // 메트릭이 하나도 없으면 판정하지 않음
        if (current.signum() == 0) {
            return Optional.empty();
        }

        if (usageRatio >= 100 + allocations.getUnderPerc()) {
            return Optional.of(Issue.format(Issue.ROOT, Severity.WARN, UNDER_ALLOCATED,
                    dimension.label,
                    dimension.formatter.apply(current),
                    dimension.formatter.apply(requested),
                    usageRatio));
        }

        if (requestRatio >= 100 + allocations.getOverPerc()) {
            return Optional.of(Issue.format(Issue.ROOT, Severity.WARN, OVER_ALLOCATED,
                    dimension.label,
                    dimension.formatter.apply(current),
                    dimension.formatter.apply(requested),
                    requestRatio));
        }

        return Optional.empty();
    }
}
