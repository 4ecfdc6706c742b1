package com.purchasingpower.recall.reflection.impl;

import com.purchasingpower.recall.configuration.AppProperties;
import com.purchasingpower.recall.reflection.ReflectionPipeline;
import com.purchasingpower.recall.reflection.ReflectionResult;
import com.purchasingpower.recall.reflection.SessionEndedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Runs a reflection cycle on the knowledge executor when a session ends.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionEndListener {

    private final ReflectionPipeline reflectionPipeline;
    private final AppProperties properties;

    @Async("knowledgeExecutor")
    @EventListener
    public void onSessionEnded(SessionEndedEvent event) {
        if (!properties.getReflection().isOnSessionEnd()) {
            log.debug("Reflection on session end disabled, ignoring session {}", event.sessionId());
            return;
        }
        ReflectionResult result = reflectionPipeline.reflect(event.sessionId());
        log.info("Session {} reflection finished: {}", event.sessionId(), result.getOutcome());
    }
}
