package com.demo.loanmodel.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "app.export")
public class ExportProperties {

    /** Source CSV. */
    @NotBlank
    private String input = "./loan_approval_dataset.csv";

    /** Artifact read by the client app (copy it into its public directory). */
    @NotBlank
    private String output = "model_data.json";

    /** Share of rows held out for the accuracy check. */
    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax(value = "1.0", inclusive = false)
    private double testRatio = 0.3;

    @Min(1)
    private int neighbors = 5;

    private long seed = 42L;
}
