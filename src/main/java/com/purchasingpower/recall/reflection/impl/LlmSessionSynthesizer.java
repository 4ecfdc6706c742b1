package com.purchasingpower.recall.reflection.impl;

import com.purchasingpower.recall.client.CollaboratorGuard;
import com.purchasingpower.recall.client.LLMProvider;
import com.purchasingpower.recall.configuration.AppProperties;
import com.purchasingpower.recall.model.interaction.Interaction;
import com.purchasingpower.recall.model.synthesis.SessionSynthesis;
import com.purchasingpower.recall.reflection.SessionSynthesizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Session synthesis by prompting the chat LLM for a JSON reflection.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class LlmSessionSynthesizer implements SessionSynthesizer {

    private static final int MAX_MESSAGE_CHARS = 500;

    private static final String INSTRUCTIONS = """
        Reflect on the conversation below and answer with a single JSON object:
        {
          "qualityScore": number between 0 and 1,
          "learnings": [{"claim": string, "confidenceDelta": number between -1 and 1, "evidence": string}],
          "corrections": [{"wrongClaim": string, "correctClaim": string, "relatedNodeId": string or null, "question": string or null}],
          "insights": [{"supportingNodeIds": [string], "claim": string}],
          "sessionSummary": string,
          "patterns": [{"pattern": string, "implication": string}],
          "knowledgeGaps": [{"topic": string, "reason": string}]
        }
        Use a positive confidenceDelta for confirmed claims and a negative one for contradicted claims.
        List a correction only when the user corrected something the assistant said.
        Use empty lists when there is nothing to report. Do not add other fields.

        CONVERSATION:
        """;

    private final LLMProvider llmProvider;
    private final CollaboratorGuard guard;
    private final SessionSynthesisParser parser;
    private final Duration timeout;

    public LlmSessionSynthesizer(LLMProvider llmProvider,
                                 CollaboratorGuard guard,
                                 SessionSynthesisParser parser,
                                 AppProperties properties) {
        this.llmProvider = llmProvider;
        this.guard = guard;
        this.parser = parser;
        this.timeout = Duration.ofSeconds(properties.getReflection().getSynthesisTimeoutSeconds());
    }

    @Override
    public SessionSynthesis synthesize(String sessionId, List<Interaction> interactions) {
        String prompt = buildPrompt(interactions);
        log.info("🧠 Synthesizing session {} from {} interactions via {}",
            sessionId, interactions.size(), llmProvider.getProviderName());

        String raw = guard.call("llm", timeout, () -> llmProvider.chat(prompt, "reflection", sessionId));
        return parser.parse(raw);
    }

    static String buildPrompt(List<Interaction> interactions) {
        StringBuilder prompt = new StringBuilder(INSTRUCTIONS);
        for (Interaction interaction : interactions) {
            prompt.append("USER: ").append(truncate(interaction.getUserMessage())).append('\n');
            if (interaction.getAssistantMessage() != null) {
                prompt.append("ASSISTANT: ").append(truncate(interaction.getAssistantMessage())).append('\n');
            }
        }
        return prompt.toString();
    }

    private static String truncate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > MAX_MESSAGE_CHARS ? text.substring(0, MAX_MESSAGE_CHARS) + "..." : text;
    }
}
