package com.purchasingpower.recall.configuration;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class GraphProperties {

    @NotBlank
    private String snapshotPath = "data/graph/snapshot.json";

    @NotBlank
    private String pendingMarkerPath = "data/graph/reflection.pending.json";

    /**
     * PageRank damping factor.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double damping = 0.85;

    @Min(1)
    private int maxIterations = 100;

    private double tolerance = 1.0e-6;
}
