package com.purchasingpower.recall.model.synthesis;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A claim the user corrected during the session.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Correction {

    @NotBlank
    private String wrongClaim;

    @NotBlank
    private String correctClaim;

    private String relatedNodeId;

    /**
     * The question that was answered wrongly, if known.
     */
    private String question;
}
