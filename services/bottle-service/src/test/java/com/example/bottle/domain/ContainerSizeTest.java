package com.example.bottle.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ContainerSizeTest {

    @Test
    @DisplayName("Metric sizes are shown as plain millilitres")
    void metricSizeWithUnits() {
        ContainerSize size = ContainerSize.millilitres(355);

        assertThat(size.getSizeInMl()).isEqualTo(355);
        assertThat(size.sizeWithUnits()).isEqualTo("355 ml");
    }

    @Test
    @DisplayName("Fluid ounces convert to millilitres by truncation")
    void fluidOuncesTruncateOnConversion() {
        // 12 * 29.5735 = 354.882
        ContainerSize size = ContainerSize.fluidOunces(12);

        assertThat(size.getSizeInMl()).isEqualTo(354);
        assertThat(size.sizeWithUnits()).isEqualTo("354 ml (Converted from 12 fl oz)");
        assertThat(size.isMetric()).isFalse();
        assertThat(size.getSize()).isEqualTo(12);
    }

    @Test
    @DisplayName("setSize with conversion turns a fluid ounce size metric")
    void setSizeConvertsWhenRequested() {
        ContainerSize size = ContainerSize.fluidOunces(12);

        size.setSize(16, true);

        // 16 * 29.5735 = 473.176
        assertThat(size.isMetric()).isTrue();
        assertThat(size.getSize()).isEqualTo(473);
        assertThat(size.sizeWithUnits()).isEqualTo("473 ml");
    }

    @Test
    @DisplayName("setSize with conversion leaves a metric size untouched apart from the new value")
    void setSizeOnMetricIgnoresConversion() {
        ContainerSize size = ContainerSize.millilitres(330);

        size.setSize(500, true);

        assertThat(size.isMetric()).isTrue();
        assertThat(size.getSize()).isEqualTo(500);
    }

    @Test
    @DisplayName("setSize without conversion keeps the unit")
    void setSizeWithoutConversionKeepsUnit() {
        ContainerSize size = ContainerSize.fluidOunces(12);

        size.setSize(22);

        assertThat(size.isMetric()).isFalse();
        assertThat(size.getSize()).isEqualTo(22);
    }

    @Test
    @DisplayName("copy is independent of the original")
    void copyIsIndependent() {
        ContainerSize original = ContainerSize.fluidOunces(12);
        ContainerSize copy = original.copy();

        copy.setSize(16, true);

        assertThat(copy).isNotEqualTo(original);
        assertThat(original.getSize()).isEqualTo(12);
        assertThat(original.isMetric()).isFalse();
    }

    @Test
    @DisplayName("Equality follows the current unit and size")
    void equalityFollowsCurrentState() {
        ContainerSize size = ContainerSize.fluidOunces(12);
        ContainerSize copy = size.copy();

        assertThat(copy).isEqualTo(size).hasSameHashCodeAs(size);

        copy.setSize(12, true);

        assertThat(copy).isNotEqualTo(size).isEqualTo(ContainerSize.millilitres(354));
    }
}
