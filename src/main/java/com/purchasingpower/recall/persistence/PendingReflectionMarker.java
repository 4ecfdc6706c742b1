package com.purchasingpower.recall.persistence;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Written before a reflection cycle starts mutating the graph and removed once
 * its snapshot is saved. Finding one at startup means a cycle was interrupted.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PendingReflectionMarker {

    private String cycleId;
    private String sessionId;
    private Instant startedAt;
}
