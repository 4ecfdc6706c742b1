package com.purchasingpower.recall.model.retrieval;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetrievalResult {

    private String query;

    @Builder.Default
    private List<RankedNode> nodes = new ArrayList<>();

    @Builder.Default
    private List<MistakeWarning> warnings = new ArrayList<>();
}
