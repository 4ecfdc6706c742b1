package com.purchasingpower.recall.api;

import com.purchasingpower.recall.model.interaction.Interaction;
import com.purchasingpower.recall.reflection.InteractionLog;
import com.purchasingpower.recall.reflection.ReflectionPipeline;
import com.purchasingpower.recall.reflection.ReflectionResult;
import com.purchasingpower.recall.reflection.SessionEndedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST controller for interactions, sessions and reflection.
 *
 * @since 1.0.0
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class ReflectionController {

    private final InteractionLog interactionLog;
    private final ReflectionPipeline reflectionPipeline;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * Log an interaction summary.
     *
     * POST /api/v1/interactions
     */
    @PostMapping("/interactions")
    public ResponseEntity<Interaction> logInteraction(@RequestBody Interaction interaction) {
        try {
            if (interaction.getSessionId() == null || interaction.getSessionId().isBlank()
                || interaction.getUserMessage() == null || interaction.getUserMessage().isBlank()) {
                return ResponseEntity.badRequest().build();
            }
            return ResponseEntity.ok(interactionLog.append(interaction));

        } catch (Exception e) {
            log.error("Failed to log interaction", e);
            return ResponseEntity.internalServerError().build();
        }
    }

    /**
     * End a session. Reflection runs in the background.
     *
     * POST /api/v1/sessions/{sessionId}/end
     */
    @PostMapping("/sessions/{sessionId}/end")
    public ResponseEntity<Map<String, Object>> endSession(@PathVariable String sessionId) {
        try {
            int interactions = interactionLog.count(sessionId);
            eventPublisher.publishEvent(new SessionEndedEvent(sessionId));
            log.info("Session {} ended after {} interactions", sessionId, interactions);
            return ResponseEntity.accepted().body(Map.of(
                "sessionId", sessionId,
                "interactions", interactions,
                "reflection", "scheduled"
            ));
        } catch (Exception e) {
            log.error("Failed to end session {}", sessionId, e);
            return ResponseEntity.internalServerError().build();
        }
    }

    /**
     * Run a reflection cycle synchronously.
     *
     * POST /api/v1/reflection/{sessionId}
     */
    @PostMapping("/reflection/{sessionId}")
    public ResponseEntity<ReflectionResult> reflect(@PathVariable String sessionId) {
        try {
            return ResponseEntity.ok(reflectionPipeline.reflect(sessionId));
        } catch (Exception e) {
            log.error("Reflection failed for session {}", sessionId, e);
            return ResponseEntity.internalServerError().build();
        }
    }

    /**
     * GET /api/v1/reflection/state
     */
    @GetMapping("/reflection/state")
    public ResponseEntity<Map<String, String>> getState() {
        return ResponseEntity.ok(Map.of("state", reflectionPipeline.state().name()));
    }
}
