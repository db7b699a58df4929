package com.vibecoding.k8ssanitizer.util;

import io.fabric8.kubernetes.api.model.Quantity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QuantitiesTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "20m, 20m",
            "1, 1000m",
            "0.5, 500m",
            "1500m, 1500m",
            "0, 0m",
            "250000n, 250u",
            "0.0005, 500u",
            "5n, 5n"
    })
    void millicores(String quantity, String expected) {
        assertThat(Quantities.asMillicores(new Quantity(quantity).getNumericalAmount())).isEqualTo(expected);
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "20Mi, 20Mi",
            "1Gi, 1024Mi",
            "1048576, 1Mi",
            "0, 0Mi",
            "400Ki, 400Ki",
            "0.5Mi, 512Ki",
            "512, 512"
    })
    void mebibytes(String quantity, String expected) {
        assertThat(Quantities.asMebibytes(new Quantity(quantity).getNumericalAmount())).isEqualTo(expected);
    }

    @Test
    void resourceLookups() {
        Map<String, Quantity> resources = Map.of("cpu", new Quantity("250m"), "memory", new Quantity("64Mi"));

        assertThat(Quantities.cpu(resources)).isEqualByComparingTo(new BigDecimal("0.25"));
        assertThat(Quantities.memory(resources)).isEqualByComparingTo(BigDecimal.valueOf(64L * 1024 * 1024));
        assertThat(Quantities.cpu(null)).isZero();
        assertThat(Quantities.memory(Map.of())).isZero();
        assertThat(Quantities.toDecimal(null)).isZero();
    }

    @Test
    void malformedQuantity() {
        assertThatThrownBy(() -> Quantities.toDecimal(new Quantity("ten", "m")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
