package com.demo.loanmodel.pipeline;

import com.demo.loanmodel.export.ExportArtifact;
import com.demo.loanmodel.features.LabelDistribution;

public record PipelineResult(ExportArtifact artifact, LabelDistribution distribution) {

    public int recordCount() {
        return artifact.trainingDataInitial().size();
    }
}
