package com.vibecoding.k8ssanitizer.model;

import lombok.Value;

import java.math.BigDecimal;

/**
 * 컨테이너 현재 사용량 (CPU는 core, Memory는 byte)
 */
@Value
public class ContainerMetrics {

    public static final ContainerMetrics ZERO = new ContainerMetrics(BigDecimal.ZERO, BigDecimal.ZERO);

    BigDecimal currentCpu;
    BigDecimal currentMem;
}
