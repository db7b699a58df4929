package com.vibecoding.k8ssanitizer.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 워크로드 단위 요청량 대비 사용량 집계
 */
@Value
@Builder
public class ConsumptionMetrics {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    @Builder.Default
    BigDecimal currentCpu = BigDecimal.ZERO;
    @Builder.Default
    BigDecimal currentMem = BigDecimal.ZERO;
    @Builder.Default
    BigDecimal requestCpu = BigDecimal.ZERO;
    @Builder.Default
    BigDecimal requestMem = BigDecimal.ZERO;

    /**
     * 현재 CPU / 요청 CPU (%)
     */
    public double cpuUsageRatio() {
        return ratio(currentCpu, requestCpu);
    }

    /**
     * 요청 CPU / 현재 CPU (%)
     */
    public double cpuRequestRatio() {
        return ratio(requestCpu, currentCpu);
    }

    public double memUsageRatio() {
        return ratio(currentMem, requestMem);
    }

    public double memRequestRatio() {
        return ratio(requestMem, currentMem);
    }

    private static double ratio(BigDecimal numerator, BigDecimal denominator) {
        if (denominator.signum() == 0) {
            return 0;
        }
        return numerator.multiply(HUNDRED)
                .divide(denominator, 4, RoundingMode.HALF_UP)
                .doubleValue();
    }
}
