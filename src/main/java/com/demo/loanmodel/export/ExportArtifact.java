package com.demo.loanmodel.export;

import com.demo.loanmodel.normalize.NormalizationBounds;
import com.demo.loanmodel.normalize.NormalizedFeatures;
import com.demo.loanmodel.ranges.InputRange;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Contents of {@code model_data.json}. Field names and nesting are read by the client app
 * as-is; changing them requires a matching client release.
 */
@JsonPropertyOrder({"training_data_initial", "input_ranges", "normalization_ranges", "initial_accuracy"})
public record ExportArtifact(
        @JsonProperty("training_data_initial") List<TrainingRow> trainingDataInitial,
        @JsonProperty("input_ranges") Map<String, InputRange> inputRanges,
        @JsonProperty("normalization_ranges") Map<String, NormalizationBounds> normalizationRanges,
        @JsonProperty("initial_accuracy") double initialAccuracy
) {

    /** Rows keep the source order of {@code normalized} and {@code labels}. */
    public static ExportArtifact assemble(NormalizedFeatures normalized, int[] labels,
                                          Map<String, InputRange> inputRanges, double accuracy) {
        if (normalized.rowCount() != labels.length) {
            throw new IllegalArgumentException("Feature rows and labels differ in length");
        }
        List<TrainingRow> rows = new ArrayList<>(labels.length);
        for (int i = 0; i < labels.length; i++) {
            rows.add(new TrainingRow(normalized.scaled()[i], labels[i]));
        }
        return new ExportArtifact(List.copyOf(rows), inputRanges, normalized.bounds(), accuracy);
    }
}
