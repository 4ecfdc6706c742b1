package com.purchasingpower.recall.model.mistake;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A corrected mistake as handed to the mistake index.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MistakeRecord {

    /**
     * Question that was answered wrongly. Falls back to the wrong answer when unknown.
     */
    private String question;

    private String wrongAnswer;

    private String correctAnswer;

    private String sessionId;

    /**
     * Node that carried the wrong claim, if known.
     */
    private String relatedNodeId;

    public String effectiveQuestion() {
        return question != null && !question.isBlank() ? question : wrongAnswer;
    }
}
