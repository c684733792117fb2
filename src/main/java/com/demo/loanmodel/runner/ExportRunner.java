package com.demo.loanmodel.runner;

import com.demo.loanmodel.config.ExportProperties;
import com.demo.loanmodel.export.ArtifactWriter;
import com.demo.loanmodel.pipeline.LoanModelExportPipeline;
import com.demo.loanmodel.pipeline.PipelineResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

@Slf4j
@Component
@RequiredArgsConstructor
public class ExportRunner implements CommandLineRunner {

    private final ExportProperties properties;
    private final LoanModelExportPipeline pipeline;
    private final ArtifactWriter artifactWriter;

    @Override
    public void run(String... args) {
        Path input = Path.of(properties.getInput());
        Path output = Path.of(properties.getOutput());

        PipelineResult result = pipeline.run(input);
        Path written = artifactWriter.write(result.artifact(), output);

        log.info("Summary: records={}, approved={}, rejected={}, accuracy={}%",
                result.recordCount(),
                result.distribution().approved(),
                result.distribution().rejected(),
                result.artifact().initialAccuracy());
        log.info("Next step: place '{}' in the client app's /public directory", written.getFileName());
    }
}
