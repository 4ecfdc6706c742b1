package com.purchasingpower.recall.knowledge.impl;

import com.purchasingpower.recall.core.KnowledgeNode;
import com.purchasingpower.recall.core.NodeType;
import com.purchasingpower.recall.exception.InvalidOperatorException;
import com.purchasingpower.recall.exception.NodeNotFoundException;
import com.purchasingpower.recall.model.feedback.UsageFeedback;
import com.purchasingpower.recall.support.MutableClock;
import com.purchasingpower.recall.support.TestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("Node Feedback Service Tests")
class NodeFeedbackServiceImplTest {

    private InMemoryGraphStore store;
    private NodeFeedbackServiceImpl feedbackService;

    @BeforeEach
    void setUp() {
        store = new InMemoryGraphStore(new MutableClock(TestSupport.T0));
        feedbackService = new NodeFeedbackServiceImpl(store);
    }

    @Test
    @DisplayName("Confirmation adds 0.2, reinforcement adds 0.03")
    void confirmAndReinforce() {
        String nodeId = store.upsertNode(NodeType.FACT, "Canberra is the capital of Australia", Map.of());

        assertThat(feedbackService.confirm(nodeId).getConfidence()).isCloseTo(0.7, within(1e-9));
        assertThat(feedbackService.reinforce(nodeId).getConfidence()).isCloseTo(0.73, within(1e-9));
    }

    @Test
    @DisplayName("Reinforcement reactivates a deprecated node, confirmation is refused")
    void reinforcementReactivates() {
        // Given
        String nodeId = store.upsertNode(NodeType.FACT, "Sydney is the capital of Australia", Map.of(), 0.06);
        store.deprecate(nodeId, "manual");

        // When / Then
        assertThatThrownBy(() -> feedbackService.confirm(nodeId)).isInstanceOf(InvalidOperatorException.class);
        KnowledgeNode reactivated = feedbackService.reinforce(nodeId);
        assertThat(reactivated.isActive()).isTrue();
        assertThat(reactivated.getConfidence()).isCloseTo(0.09, within(1e-9));
    }

    @Test
    @DisplayName("Unknown ids are reported as missing")
    void unknownNode() {
        assertThatThrownBy(() -> feedbackService.reinforce("nope")).isInstanceOf(NodeNotFoundException.class);
        assertThatThrownBy(() -> feedbackService.confirm("nope")).isInstanceOf(NodeNotFoundException.class);
    }

    @Test
    @DisplayName("Usage boost reinforces active nodes once and skips unknown or deprecated ones")
    void boostUsed() {
        // Given
        String used = store.upsertNode(NodeType.FACT, "Java is statically typed", Map.of());
        String retired = store.upsertNode(NodeType.FACT, "Java applets are current", Map.of());
        store.deprecate(retired, "outdated");

        // When
        UsageFeedback feedback = feedbackService.boostUsed(List.of(used, used, retired, "nope"));

        // Then
        assertThat(feedback.getBoosted()).containsExactly(used);
        assertThat(feedback.getSkipped()).containsExactly(retired, "nope");
        assertThat(store.getNode(used).getConfidence()).isCloseTo(0.53, within(1e-9));
        assertThat(store.getNode(retired).isActive()).isFalse();
        assertThat(store.getNode(retired).getConfidence()).isCloseTo(0.5, within(1e-9));
    }
}
