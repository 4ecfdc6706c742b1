package com.purchasingpower.recall.reflection.impl;

import com.purchasingpower.recall.exception.CollaboratorMalformedException;
import com.purchasingpower.recall.model.synthesis.SessionSynthesis;
import com.purchasingpower.recall.support.TestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Session Synthesis Parser Tests")
class SessionSynthesisParserTest {

    private SessionSynthesisParser parser;

    @BeforeEach
    void setUp() {
        parser = new SessionSynthesisParser(TestSupport.validator());
    }

    @Test
    @DisplayName("Should parse a complete synthesis")
    void parsesValidPayload() {
        // Given
        String raw = """
            {
              "qualityScore": 0.8,
              "learnings": [{"claim": "User prefers Kotlin", "confidenceDelta": 0.2, "evidence": "said so"}],
              "corrections": [{"wrongClaim": "Sydney", "correctClaim": "Canberra", "relatedNodeId": null,
                               "question": "What is the capital of Australia?"}],
              "insights": [{"supportingNodeIds": ["a", "b"], "claim": "User builds JVM services"}],
              "sessionSummary": "Talked about languages",
              "patterns": [{"pattern": "Asks follow-ups", "implication": "be thorough"}],
              "knowledgeGaps": [{"topic": "Gradle", "reason": "never came up"}]
            }
            """;

        // When
        SessionSynthesis synthesis = parser.parse(raw);

        // Then
        assertThat(synthesis.getQualityScore()).isEqualTo(0.8);
        assertThat(synthesis.getLearnings()).singleElement()
            .satisfies(l -> assertThat(l.getConfidenceDelta()).isEqualTo(0.2));
        assertThat(synthesis.getCorrections().get(0).getCorrectClaim()).isEqualTo("Canberra");
        assertThat(synthesis.getInsights().get(0).getSupportingNodeIds()).containsExactly("a", "b");
        assertThat(synthesis.getKnowledgeGaps()).hasSize(1);
    }

    @Test
    @DisplayName("Missing lists default to empty and code fences are tolerated")
    void toleratesFenceAndMissingLists() {
        SessionSynthesis synthesis = parser.parse("```json\n{\"qualityScore\": 0.4}\n```");

        assertThat(synthesis.getLearnings()).isEmpty();
        assertThat(synthesis.getCorrections()).isEmpty();
        assertThat(synthesis.getInsights()).isEmpty();
    }

    @Test
    @DisplayName("Should reject unknown fields")
    void rejectsUnknownFields() {
        assertThatThrownBy(() -> parser.parse("{\"qualityScore\": 0.4, \"mood\": \"happy\"}"))
            .isInstanceOf(CollaboratorMalformedException.class);
    }

    @Test
    @DisplayName("Should reject out-of-range and missing required values")
    void rejectsInvalidValues() {
        assertThatThrownBy(() -> parser.parse(
            "{\"qualityScore\": 1.5, \"learnings\": [{\"claim\": \"\", \"confidenceDelta\": 0.1}]}"))
            .isInstanceOf(CollaboratorMalformedException.class)
            .satisfies(e -> assertThat(((CollaboratorMalformedException) e).getViolations())
                .anyMatch(v -> v.startsWith("qualityScore"))
                .anyMatch(v -> v.startsWith("learnings[0].claim")));

        assertThatThrownBy(() -> parser.parse("{\"learnings\": []}"))
            .isInstanceOf(CollaboratorMalformedException.class);
        assertThatThrownBy(() -> parser.parse("{\"qualityScore\": 0.5, \"learnings\": null}"))
            .isInstanceOf(CollaboratorMalformedException.class);
    }

    @Test
    @DisplayName("Should reject prose, trailing content and empty answers")
    void rejectsNonJson() {
        assertThatThrownBy(() -> parser.parse("Sure! Here is the reflection."))
            .isInstanceOf(CollaboratorMalformedException.class);
        assertThatThrownBy(() -> parser.parse("{\"qualityScore\": 0.5} trailing"))
            .isInstanceOf(CollaboratorMalformedException.class);
        assertThatThrownBy(() -> parser.parse("  "))
            .isInstanceOf(CollaboratorMalformedException.class);
    }

    @Test
    @DisplayName("Unfenced text passes through untouched")
    void stripCodeFence() {
        assertThat(SessionSynthesisParser.stripCodeFence("  {\"a\": 1} ")).isEqualTo("{\"a\": 1}");
        assertThat(SessionSynthesisParser.stripCodeFence("```\n{}\n```")).isEqualTo("{}");
    }
}
