package com.demo.loanmodel.normalize;

import com.demo.loanmodel.dataset.LoanTable;
import com.demo.loanmodel.exception.EmptyDatasetException;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class MinMaxNormalizer {

    public NormalizedFeatures normalize(LoanTable table) {
        int rows = table.rowCount();
        if (rows == 0) throw new EmptyDatasetException();

        FeatureColumn[] features = FeatureColumn.values();
        double[][] scaled = new double[rows][features.length];
        Map<String, NormalizationBounds> bounds = new LinkedHashMap<>();

        for (int f = 0; f < features.length; f++) {
            FeatureColumn feature = features[f];
            double[] values = table.numeric(feature.column());

            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (int i = 0; i < rows; i++) {
                values[i] = feature.toModelUnits(values[i]);
                min = Math.min(min, values[i]);
                max = Math.max(max, values[i]);
            }

            NormalizationBounds b = new NormalizationBounds(min, max);
            bounds.put(feature.clientKey(), b);
            for (int i = 0; i < rows; i++) {
                scaled[i][f] = b.scale(values[i]);
            }
        }
        return new NormalizedFeatures(scaled, Collections.unmodifiableMap(bounds));
    }
}
