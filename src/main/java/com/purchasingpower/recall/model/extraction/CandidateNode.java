package com.purchasingpower.recall.model.extraction;

import com.purchasingpower.recall.core.NodeType;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CandidateNode {

    @NotNull
    private NodeType type;

    @NotBlank
    private String label;

    /**
     * Initial confidence for a newly created node. Ignored when the label
     * resolves to an existing node.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double confidenceHint;
}
