package com.demo.loanmodel;

import com.demo.loanmodel.config.ExportProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "app.export.input=src/test/resources/datasets/loan_sample.csv",
        "app.export.output=target/test-artifacts/model_data.json"
})
class LoanModelExportApplicationTests {

    @Autowired
    private ExportProperties properties;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void runnerExportsSampleDatasetOnStartup() throws IOException {
        Path output = Path.of(properties.getOutput());
        assertThat(output).exists();

        JsonNode root = objectMapper.readTree(output.toFile());
        assertThat(root.get("training_data_initial")).hasSize(12);
        assertThat(root.get("training_data_initial").get(0)).hasSize(7);
        assertThat(root.at("/normalization_ranges/cibil/min").asDouble()).isEqualTo(319.0);
        assertThat(root.at("/normalization_ranges/income/max").asDouble()).isEqualTo(98.0);
        assertThat(root.at("/input_ranges/loan_term/step").asInt()).isEqualTo(1);
        assertThat(root.get("initial_accuracy").asDouble()).isBetween(0.0, 100.0);
    }

    @Test
    void defaultsComeFromApplicationYaml() {
        assertThat(properties.getNeighbors()).isEqualTo(5);
        assertThat(properties.getTestRatio()).isEqualTo(0.3);
        assertThat(properties.getSeed()).isEqualTo(42L);
    }
}
