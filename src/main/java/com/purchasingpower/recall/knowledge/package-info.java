/**
 * Knowledge graph engine: the graph store, confidence algebra, importance
 * ranking, mistake index and the ingestion and retrieval services built on them.
 *
 * @since 1.0.0
 */
package com.purchasingpower.recall.knowledge;
