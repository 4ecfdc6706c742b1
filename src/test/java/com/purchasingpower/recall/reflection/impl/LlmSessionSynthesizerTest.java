package com.purchasingpower.recall.reflection.impl;

import com.purchasingpower.recall.exception.CollaboratorMalformedException;
import com.purchasingpower.recall.model.interaction.Interaction;
import com.purchasingpower.recall.model.synthesis.SessionSynthesis;
import com.purchasingpower.recall.support.StubLlmProvider;
import com.purchasingpower.recall.support.TestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("LLM Session Synthesizer Tests")
class LlmSessionSynthesizerTest {

    private final StubLlmProvider llm = new StubLlmProvider("{\"qualityScore\": 0.7, \"sessionSummary\": \"ok\"}");
    private final LlmSessionSynthesizer synthesizer = new LlmSessionSynthesizer(llm, TestSupport.directGuard(),
        new SessionSynthesisParser(TestSupport.validator()), TestSupport.properties());

    @Test
    @DisplayName("Should prompt with the conversation and parse the answer")
    void synthesizes() {
        // Given
        List<Interaction> interactions = List.of(
            Interaction.builder().sessionId("s1").userMessage("What is the capital of Australia?")
                .assistantMessage("Sydney").build(),
            Interaction.builder().sessionId("s1").userMessage("No, it is Canberra").build());

        // When
        SessionSynthesis synthesis = synthesizer.synthesize("s1", interactions);

        // Then
        assertThat(synthesis.getQualityScore()).isEqualTo(0.7);
        assertThat(llm.prompts()).singleElement().satisfies(prompt -> assertThat(prompt)
            .contains("USER: What is the capital of Australia?\nASSISTANT: Sydney\n")
            .endsWith("USER: No, it is Canberra\n"));
    }

    @Test
    @DisplayName("Long messages are truncated in the prompt")
    void truncatesLongMessages() {
        String prompt = LlmSessionSynthesizer.buildPrompt(List.of(
            Interaction.builder().sessionId("s1").userMessage("x".repeat(2_000)).build()));

        assertThat(prompt).contains("x".repeat(500) + "...").doesNotContain("x".repeat(501));
    }

    @Test
    @DisplayName("Malformed answers surface as malformed")
    void malformedAnswer() {
        llm.respondWith("I could not reflect on this session.");

        assertThatThrownBy(() -> synthesizer.synthesize("s1",
            List.of(Interaction.builder().sessionId("s1").userMessage("hi").build())))
            .isInstanceOf(CollaboratorMalformedException.class);
    }
}
