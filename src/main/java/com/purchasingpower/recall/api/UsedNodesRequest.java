package com.purchasingpower.recall.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Ids of the nodes a response drew on.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UsedNodesRequest {

    @Builder.Default
    private List<String> nodeIds = new ArrayList<>();
}
