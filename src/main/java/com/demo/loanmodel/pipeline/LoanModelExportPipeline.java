package com.demo.loanmodel.pipeline;

import com.demo.loanmodel.dataset.DatasetLoader;
import com.demo.loanmodel.dataset.LoanTable;
import com.demo.loanmodel.evaluate.KnnEvaluator;
import com.demo.loanmodel.export.ExportArtifact;
import com.demo.loanmodel.features.DerivedDataset;
import com.demo.loanmodel.features.FeatureDeriver;
import com.demo.loanmodel.normalize.MinMaxNormalizer;
import com.demo.loanmodel.normalize.NormalizedFeatures;
import com.demo.loanmodel.ranges.InputRange;
import com.demo.loanmodel.ranges.RangeExtractor;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Map;

/**
 * CSV in, artifact out: load, derive, ranges, normalize, evaluate, assemble.
 * Holds no state between calls; writing the artifact is left to the caller.
 */
@Service
@RequiredArgsConstructor
public class LoanModelExportPipeline {

    private final DatasetLoader datasetLoader;
    private final FeatureDeriver featureDeriver;
    private final RangeExtractor rangeExtractor;
    private final MinMaxNormalizer normalizer;
    private final KnnEvaluator evaluator;

    public PipelineResult run(Path input) {
        // 1) Load
        LoanTable raw = datasetLoader.load(input);

        // 2) Derived columns + label
        DerivedDataset derived = featureDeriver.derive(raw);
        int[] labels = derived.labels();

        // 3) UI input ranges over raw and derived columns
        Map<String, InputRange> inputRanges = rangeExtractor.extract(derived.table());

        // 4) Scale the six model features
        NormalizedFeatures normalized = normalizer.normalize(derived.table());

        // 5) Held-out accuracy
        double accuracy = evaluator.evaluate(normalized.scaled(), labels);

        // 6) Artifact
        ExportArtifact artifact = ExportArtifact.assemble(normalized, labels, inputRanges, accuracy);
        return new PipelineResult(artifact, derived.distribution());
    }
}
