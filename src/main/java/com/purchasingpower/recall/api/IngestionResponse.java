package com.purchasingpower.recall.api;

import com.purchasingpower.recall.model.extraction.IngestionResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Extraction ingestion response.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestionResponse {

    private boolean success;
    private boolean newKnowledge;
    private IngestionResult result;
    private String error;

    @Builder.Default
    private List<String> violations = new ArrayList<>();

    public static IngestionResponse success(IngestionResult result) {
        return IngestionResponse.builder()
            .success(true)
            .newKnowledge(result.hasNewKnowledge())
            .result(result)
            .build();
    }

    /**
     * A rejected batch contributes nothing; the caller treats it as "no new knowledge".
     */
    public static IngestionResponse rejected(String error, List<String> violations) {
        return IngestionResponse.builder()
            .success(false)
            .newKnowledge(false)
            .error(error)
            .violations(new ArrayList<>(violations))
            .build();
    }

    public static IngestionResponse error(String error) {
        return IngestionResponse.builder()
            .success(false)
            .error(error)
            .build();
    }
}
