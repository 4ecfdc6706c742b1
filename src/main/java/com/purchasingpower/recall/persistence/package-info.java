/**
 * Durable state: the graph snapshot, the reflection pending marker and the
 * session journal. All files are written to a temporary sibling first and
 * moved into place atomically.
 *
 * @since 1.0.0
 */
package com.purchasingpower.recall.persistence;
