package com.purchasingpower.recall.reflection.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.recall.model.interaction.Interaction;
import com.purchasingpower.recall.reflection.InteractionLog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Interaction log held in memory, per session in arrival order.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class InMemoryInteractionLog implements InteractionLog {

    private final Map<String, List<Interaction>> sessions = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryInteractionLog(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Interaction append(Interaction interaction) {
        Preconditions.checkNotNull(interaction, "Interaction is required");
        Preconditions.checkArgument(interaction.getSessionId() != null && !interaction.getSessionId().isBlank(),
            "Session id is required");

        Interaction stored = Interaction.builder()
            .id(interaction.getId() != null ? interaction.getId() : UUID.randomUUID().toString())
            .sessionId(interaction.getSessionId())
            .userMessage(interaction.getUserMessage())
            .assistantMessage(interaction.getAssistantMessage())
            .timestamp(interaction.getTimestamp() != null ? interaction.getTimestamp() : clock.instant())
            .build();

        List<Interaction> session = sessions.computeIfAbsent(stored.getSessionId(), k -> new ArrayList<>());
        synchronized (session) {
            session.add(stored);
        }
        log.debug("Interaction {} logged for session {}", stored.getId(), stored.getSessionId());
        return stored;
    }

    @Override
    public List<Interaction> recent(String sessionId, int limit) {
        List<Interaction> session = sessions.get(sessionId);
        if (session == null) {
            return List.of();
        }
        synchronized (session) {
            int from = Math.max(0, session.size() - limit);
            return List.copyOf(session.subList(from, session.size()));
        }
    }

    @Override
    public int count(String sessionId) {
        List<Interaction> session = sessions.get(sessionId);
        if (session == null) {
            return 0;
        }
        synchronized (session) {
            return session.size();
        }
    }
}
