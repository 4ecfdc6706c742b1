package com.purchasingpower.recall.reflection.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.purchasingpower.recall.exception.CollaboratorMalformedException;
import com.purchasingpower.recall.model.synthesis.SessionSynthesis;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Strict parser for LLM session syntheses.
 *
 * <p>Unknown properties, nulls for required values, trailing content and any
 * bean-validation violation reject the whole payload. A surrounding Markdown
 * code fence is tolerated.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class SessionSynthesisParser {

    private final ObjectMapper strictMapper = JsonMapper.builder()
        .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
        .build();

    private final Validator validator;

    public SessionSynthesisParser(Validator validator) {
        this.validator = validator;
    }

    public SessionSynthesis parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new CollaboratorMalformedException("Empty session synthesis", List.of("response is empty"));
        }

        SessionSynthesis synthesis;
        try {
            synthesis = strictMapper.readValue(stripCodeFence(raw), SessionSynthesis.class);
        } catch (JsonProcessingException e) {
            log.warn("⚠️ Session synthesis is not valid JSON for the contract: {}", e.getOriginalMessage());
            throw new CollaboratorMalformedException("Unparseable session synthesis", e);
        }

        if (synthesis == null) {
            throw new CollaboratorMalformedException("Empty session synthesis", List.of("response is null"));
        }

        List<String> violations = validator.validate(synthesis).stream()
            .map(v -> v.getPropertyPath() + ": " + v.getMessage())
            .sorted()
            .collect(Collectors.toList());
        if (!violations.isEmpty()) {
            log.warn("⚠️ Session synthesis failed validation: {}", violations);
            throw new CollaboratorMalformedException("Invalid session synthesis", violations);
        }
        return synthesis;
    }

    static String stripCodeFence(String raw) {
        String text = raw.trim();
        if (!text.startsWith("```")) {
            return text;
        }
        int firstNewline = text.indexOf('\n');
        int closing = text.lastIndexOf("```");
        if (firstNewline < 0 || closing <= firstNewline) {
            return text;
        }
        return text.substring(firstNewline + 1, closing).trim();
    }
}
