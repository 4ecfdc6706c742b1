package com.purchasingpower.recall.configuration;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class MaintenanceProperties {

    private boolean enabled = true;

    @Min(1000)
    private long intervalMs = 3_600_000L;

    @Min(0)
    private long initialDelayMs = 60_000L;

    /**
     * Vector similarity above which two same-type nodes are duplicates.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double similarityThreshold = 0.92;

    @Min(1)
    private int similarityTopK = 5;
}
