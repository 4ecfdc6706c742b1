/**
 * Graph maintenance passes and their checkpoints.
 *
 * @since 1.0.0
 */
package com.purchasingpower.recall.maintenance;
