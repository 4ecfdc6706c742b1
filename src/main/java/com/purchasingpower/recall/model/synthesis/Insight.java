package com.purchasingpower.recall.model.synthesis;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A claim inferred from several existing nodes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Insight {

    @NotNull
    @Builder.Default
    private List<@NotBlank String> supportingNodeIds = new ArrayList<>();

    @NotBlank
    private String claim;
}
