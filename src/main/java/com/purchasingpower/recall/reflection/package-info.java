/**
 * Reflection pipeline: session synthesis, transactional application to the
 * graph and crash recovery.
 *
 * @since 1.0.0
 */
package com.purchasingpower.recall.reflection;
