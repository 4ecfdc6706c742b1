/**
 * Core graph model: node and edge types, confidence operators and snapshots.
 *
 * <p>Types in this package carry no behaviour beyond copying and simple
 * predicates. Graph mutation lives in {@code knowledge.GraphStore}.
 *
 * @since 1.0.0
 */
package com.purchasingpower.recall.core;
