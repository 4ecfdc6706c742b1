package com.purchasingpower.recall.model.extraction;

import com.purchasingpower.recall.core.RelationType;
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
public class CandidateEdge {

    @NotBlank
    private String sourceLabel;

    @NotBlank
    private String targetLabel;

    @NotNull
    private RelationType relation;
}
