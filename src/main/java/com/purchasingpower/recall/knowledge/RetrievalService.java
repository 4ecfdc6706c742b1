package com.purchasingpower.recall.knowledge;

import com.purchasingpower.recall.model.retrieval.RetrievalResult;

/**
 * Read path: ranked knowledge and mistake warnings for a query.
 *
 * @since 1.0.0
 */
public interface RetrievalService {

    RetrievalResult retrieve(String query, int limit);
}
