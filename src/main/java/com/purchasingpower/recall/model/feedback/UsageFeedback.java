package com.purchasingpower.recall.model.feedback;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of boosting the nodes used in a response.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UsageFeedback {

    @Builder.Default
    private List<String> boosted = new ArrayList<>();

    /**
     * Unknown or deprecated ids.
     */
    @Builder.Default
    private List<String> skipped = new ArrayList<>();
}
