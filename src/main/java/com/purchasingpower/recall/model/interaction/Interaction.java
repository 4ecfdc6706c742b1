package com.purchasingpower.recall.model.interaction;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One user/assistant exchange, as summarized by the front end.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Interaction {

    private String id;

    @NotBlank
    private String sessionId;

    @NotBlank
    private String userMessage;

    private String assistantMessage;

    private Instant timestamp;
}
