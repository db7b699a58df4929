package com.vibecoding.k8ssanitizer.util;

import io.fabric8.kubernetes.api.model.Quantity;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;

/**
 * Kubernetes quantity 변환/표기 유틸
 */
public final class Quantities {

    public static final String CPU = "cpu";
    public static final String MEMORY = "memory";

    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);
    private static final BigDecimal MILLION = BigDecimal.valueOf(1_000_000);
    private static final BigDecimal BILLION = BigDecimal.valueOf(1_000_000_000);
    private static final BigDecimal KIBI = BigDecimal.valueOf(1024L);
    private static final BigDecimal MEBI = BigDecimal.valueOf(1024L * 1024L);

    private Quantities() {
    }

    /**
     * quantity를 기본 단위 값으로 변환 (CPU: core, Memory: byte)
     *
     * @throws IllegalArgumentException quantity 형식이 잘못된 경우
     */
    public static BigDecimal toDecimal(Quantity quantity) {
        if (quantity == null) {
            return BigDecimal.ZERO;
        }
        try {
            return quantity.getNumericalAmount();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Invalid quantity: " + quantity, e);
        }
    }

    public static BigDecimal cpu(Map<String, Quantity> resources) {
        return resources == null ? BigDecimal.ZERO : toDecimal(resources.get(CPU));
    }

    public static BigDecimal memory(Map<String, Quantity> resources) {
        return resources == null ? BigDecimal.ZERO : toDecimal(resources.get(MEMORY));
    }

    /**
     * 20m 형식. 1m 미만이면 u, n 단위로 내려간다 (예: 250u)
     */
    public static String asMillicores(BigDecimal cores) {
        BigDecimal milli = cores.multiply(THOUSAND);
        if (cores.signum() == 0 || milli.abs().compareTo(BigDecimal.ONE) >= 0) {
            return whole(milli) + "m";
        }
        BigDecimal micro = cores.multiply(MILLION);
        if (micro.abs().compareTo(BigDecimal.ONE) >= 0) {
            return whole(micro) + "u";
        }
        return whole(cores.multiply(BILLION)) + "n";
    }

    /**
     * 20Mi 형식. 1Mi 미만이면 Ki, byte 단위로 내려간다 (예: 400Ki)
     */
    public static String asMebibytes(BigDecimal bytes) {
        if (bytes.signum() == 0 || bytes.abs().compareTo(MEBI) >= 0) {
            return whole(bytes.divide(MEBI, 0, RoundingMode.HALF_UP)) + "Mi";
        }
        if (bytes.abs().compareTo(KIBI) >= 0) {
            return whole(bytes.divide(KIBI, 0, RoundingMode.HALF_UP)) + "Ki";
        }
        return whole(bytes);
    }

    private static String whole(BigDecimal value) {
        return value.setScale(0, RoundingMode.HALF_UP).toPlainString();
    }
}
