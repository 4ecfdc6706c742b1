package com.purchasingpower.recall.knowledge;

import com.purchasingpower.recall.model.extraction.ExtractionBatch;
import com.purchasingpower.recall.model.extraction.IngestionResult;

/**
 * Applies extraction batches to the graph.
 *
 * @since 1.0.0
 */
public interface KnowledgeIngestionService {

    /**
     * Apply one batch as a single unit: either every node and edge lands or none does.
     *
     * @throws com.purchasingpower.recall.exception.CollaboratorMalformedException if the batch is invalid
     */
    IngestionResult ingest(ExtractionBatch batch);
}
