package com.purchasingpower.recall.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class ReflectionProperties {

    /**
     * Run a reflection cycle when a session ends.
     */
    private boolean onSessionEnd = true;

    @Min(1)
    private int interactionLimit = 25;

    @Min(1)
    private int synthesisTimeoutSeconds = 120;

    @NotBlank
    private String journalDir = "data/journal";
}
