package com.purchasingpower.recall.reflection;

import com.purchasingpower.recall.model.interaction.Interaction;
import com.purchasingpower.recall.model.synthesis.SessionSynthesis;

import java.util.List;

/**
 * Turns a session's interactions into a validated synthesis.
 *
 * @since 1.0.0
 */
public interface SessionSynthesizer {

    /**
     * @throws com.purchasingpower.recall.exception.CollaboratorTimeoutException   if the LLM does not answer in time
     * @throws com.purchasingpower.recall.exception.CollaboratorMalformedException if the answer fails validation
     */
    SessionSynthesis synthesize(String sessionId, List<Interaction> interactions);
}
