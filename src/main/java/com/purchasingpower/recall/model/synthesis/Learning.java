package com.purchasingpower.recall.model.synthesis;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A claim the session taught or confirmed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Learning {

    @NotBlank
    private String claim;

    /**
     * Positive confirms, negative contradicts, zero reinforces.
     */
    @NotNull
    @DecimalMin("-1.0")
    @DecimalMax("1.0")
    private Double confidenceDelta;

    private String evidence;
}
