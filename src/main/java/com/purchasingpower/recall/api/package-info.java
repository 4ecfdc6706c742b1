/**
 * REST API under {@code /api/v1}: ingestion, retrieval, graph inspection,
 * interaction logging and manual maintenance and reflection triggers.
 *
 * @since 1.0.0
 */
package com.purchasingpower.recall.api;
