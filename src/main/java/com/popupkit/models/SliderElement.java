package com.popupkit.models;

import java.util.Objects;

public class SliderElement extends Element {
    private final double min;
    private final double max;
    private final Double defaultValue;

    public SliderElement(String label, double min, double max, Double defaultValue) {
        super(label);
        this.min = min;
        this.max = max;
        this.defaultValue = defaultValue;
    }

    @Override
    public ElementKind getKind() {
        return ElementKind.SLIDER;
    }

    public double getMin() { return min; }

    public double getMax() { return max; }

    /**
     * The author-specified default, or null when none was given.
     */
    public Double getDefaultValue() { return defaultValue; }

    /**
     * Initial position: the declared default, or the midpoint of the range.
     */
    public double effectiveDefault() {
        return defaultValue != null ? defaultValue : (min + max) / 2.0;
    }

    /**
     * Render a slider number the way results and the DSL show it: integral values without a fraction.
     */
    public static String formatNumber(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    @Override
    public Element copy() {
        return copyBaseInto(new SliderElement(getLabel(), min, max, defaultValue));
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) return false;
        SliderElement that = (SliderElement) o;
        return Double.compare(min, that.min) == 0
            && Double.compare(max, that.max) == 0
            && Objects.equals(defaultValue, that.defaultValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(baseHash(), min, max, defaultValue);
    }
}
