package com.purchasingpower.recall.model.retrieval;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A past mistake similar to the current question.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MistakeWarning {

    private String question;
    private String wrongAnswer;
    private String correctAnswer;

    private String mistakeNodeId;
    private double similarity;
}
