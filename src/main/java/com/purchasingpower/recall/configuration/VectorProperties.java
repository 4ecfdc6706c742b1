package com.purchasingpower.recall.configuration;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class VectorProperties {

    /**
     * "ollama" for embedding-backed similarity, "lexical" for token overlap.
     */
    @NotBlank
    private String provider = "lexical";

    @Min(1)
    private long timeoutMs = 5_000L;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double mistakeThreshold = 0.55;

    @Min(1)
    private int mistakeTopK = 3;
}
