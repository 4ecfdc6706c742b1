package com.purchasingpower.recall.reflection.impl;

import com.purchasingpower.recall.model.interaction.Interaction;
import com.purchasingpower.recall.support.MutableClock;
import com.purchasingpower.recall.support.TestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryInteractionLogTest {

    private MutableClock clock;
    private InMemoryInteractionLog interactionLog;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(TestSupport.T0);
        interactionLog = new InMemoryInteractionLog(clock);
    }

    @Test
    @DisplayName("Should stamp id and time on append")
    void stampsAppendedInteractions() {
        Interaction stored = interactionLog.append(Interaction.builder()
            .sessionId("s1").userMessage("hi").assistantMessage("hello").build());

        assertThat(stored.getId()).isNotBlank();
        assertThat(stored.getTimestamp()).isEqualTo(TestSupport.T0);
        assertThat(interactionLog.count("s1")).isEqualTo(1);
    }

    @Test
    @DisplayName("Should return the most recent interactions in order")
    void returnsMostRecent() {
        // Given
        for (int i = 0; i < 30; i++) {
            interactionLog.append(Interaction.builder().sessionId("s1").userMessage("q" + i).build());
            clock.advance(Duration.ofSeconds(1));
        }
        interactionLog.append(Interaction.builder().sessionId("s2").userMessage("other").build());

        // When
        List<Interaction> recent = interactionLog.recent("s1", 25);

        // Then
        assertThat(recent).hasSize(25);
        assertThat(recent.get(0).getUserMessage()).isEqualTo("q5");
        assertThat(recent.get(24).getUserMessage()).isEqualTo("q29");
        assertThat(interactionLog.recent("unknown", 25)).isEmpty();
    }

    @Test
    @DisplayName("Should reject interactions without a session")
    void rejectsMissingSession() {
        assertThatThrownBy(() -> interactionLog.append(Interaction.builder().userMessage("orphan").build()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Session id");
    }
}
