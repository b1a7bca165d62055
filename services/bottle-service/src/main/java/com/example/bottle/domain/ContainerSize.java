package com.example.bottle.domain;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Volume of a single container, held either in millilitres (metric) or in US fluid ounces.
 * Fluid ounces are converted to millilitres on demand; the conversion truncates.
 *
 * <p>Mutable, and equality follows the current unit and size, so an instance must not be
 * changed while it sits in a hash-based collection. Holders that hand sizes out give away
 * {@link #copy()}s.
 */
@Getter
@EqualsAndHashCode
@ToString
@AllArgsConstructor
public class ContainerSize {

    public static final double ML_PER_FLUID_OUNCE = 29.5735;

    private boolean metric;
    private int size;

    public static ContainerSize millilitres(int size) {
        return new ContainerSize(true, size);
    }

    public static ContainerSize fluidOunces(int size) {
        return new ContainerSize(false, size);
    }

    public int getSizeInMl() {
        return metric ? size : toMillilitres(size);
    }

    public String sizeWithUnits() {
        if (metric) {
            return size + " ml";
        }
        return toMillilitres(size) + " ml (Converted from " + size + " fl oz)";
    }

    public void setMetric(boolean metric) {
        this.metric = metric;
    }

    public void setSize(int newSize) {
        setSize(newSize, false);
    }

    /**
     * Replaces the size. When {@code convertToMetric} is set and the size is held in fluid
     * ounces, the new value is converted to millilitres and the size becomes metric.
     */
    public void setSize(int newSize, boolean convertToMetric) {
        size = newSize;
        if (convertToMetric && !metric) {
            size = toMillilitres(size);
            metric = true;
        }
    }

    public ContainerSize copy() {
        return new ContainerSize(metric, size);
    }

    private static int toMillilitres(int fluidOunces) {
        return (int) (fluidOunces * ML_PER_FLUID_OUNCE);
    }
}
