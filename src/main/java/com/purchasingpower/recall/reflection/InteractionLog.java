package com.purchasingpower.recall.reflection;

import com.purchasingpower.recall.model.interaction.Interaction;

import java.util.List;

/**
 * Log of interaction summaries, per session.
 *
 * @since 1.0.0
 */
public interface InteractionLog {

    /**
     * Append an interaction, assigning an id and timestamp when missing.
     *
     * @return the stored interaction
     */
    Interaction append(Interaction interaction);

    /**
     * The last {@code limit} interactions of a session, oldest first.
     */
    List<Interaction> recent(String sessionId, int limit);

    int count(String sessionId);
}
