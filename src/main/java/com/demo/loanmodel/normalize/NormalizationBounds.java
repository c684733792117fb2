package com.demo.loanmodel.normalize;

public record NormalizationBounds(double min, double max) {

    /** Maps into [0, 1]; a constant column ({@code max == min}) maps to 0. */
    public double scale(double value) {
        double range = max - min;
        return range == 0.0 ? 0.0 : (value - min) / range;
    }
}
