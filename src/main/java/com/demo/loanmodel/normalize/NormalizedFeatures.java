package com.demo.loanmodel.normalize;

import java.util.Map;

/**
 * @param scaled one row per record, columns in {@link FeatureColumn} order
 * @param bounds keyed by {@link FeatureColumn#clientKey()}, same order
 */
public record NormalizedFeatures(double[][] scaled, Map<String, NormalizationBounds> bounds) {

    public int rowCount() {
        return scaled.length;
    }
}
