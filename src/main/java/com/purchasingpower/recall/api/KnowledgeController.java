package com.purchasingpower.recall.api;

import com.purchasingpower.recall.core.GraphStats;
import com.purchasingpower.recall.core.KnowledgeNode;
import com.purchasingpower.recall.core.Neighbor;
import com.purchasingpower.recall.exception.CollaboratorMalformedException;
import com.purchasingpower.recall.exception.InvalidOperatorException;
import com.purchasingpower.recall.exception.NodeNotFoundException;
import com.purchasingpower.recall.knowledge.GraphStore;
import com.purchasingpower.recall.knowledge.KnowledgeIngestionService;
import com.purchasingpower.recall.knowledge.NodeFeedbackService;
import com.purchasingpower.recall.knowledge.RelationshipDirection;
import com.purchasingpower.recall.knowledge.RetrievalService;
import com.purchasingpower.recall.maintenance.MaintenanceReport;
import com.purchasingpower.recall.maintenance.MaintenanceScheduler;
import com.purchasingpower.recall.model.extraction.ExtractionBatch;
import com.purchasingpower.recall.model.extraction.IngestionResult;
import com.purchasingpower.recall.model.feedback.UsageFeedback;
import com.purchasingpower.recall.model.retrieval.RetrievalResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for the knowledge graph.
 *
 * @since 1.0.0
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class KnowledgeController {

    private final KnowledgeIngestionService ingestionService;
    private final RetrievalService retrievalService;
    private final GraphStore graphStore;
    private final MaintenanceScheduler maintenanceScheduler;
    private final NodeFeedbackService feedbackService;

    /**
     * Apply an extraction batch.
     *
     * POST /api/v1/extractions
     */
    @PostMapping("/extractions")
    public ResponseEntity<IngestionResponse> ingest(@RequestBody ExtractionBatch batch) {
        try {
            IngestionResult result = ingestionService.ingest(batch);
            return ResponseEntity.ok(IngestionResponse.success(result));

        } catch (CollaboratorMalformedException e) {
            log.warn("Extraction batch rejected: {}", e.getMessage());
            return ResponseEntity.badRequest()
                .body(IngestionResponse.rejected("Invalid extraction batch", e.getViolations()));
        } catch (Exception e) {
            log.error("Ingestion failed", e);
            return ResponseEntity.internalServerError()
                .body(IngestionResponse.error("Ingestion failed: " + e.getMessage()));
        }
    }

    /**
     * Ranked knowledge and mistake warnings for a query.
     *
     * POST /api/v1/retrieve
     */
    @PostMapping("/retrieve")
    public ResponseEntity<RetrievalResult> retrieve(@RequestBody RetrieveRequest request) {
        try {
            if (request.getQuery() == null || request.getQuery().isBlank()) {
                return ResponseEntity.badRequest().build();
            }
            int limit = request.getLimit() > 0 ? request.getLimit() : 10;
            return ResponseEntity.ok(retrievalService.retrieve(request.getQuery(), limit));

        } catch (Exception e) {
            log.error("Retrieval failed", e);
            return ResponseEntity.internalServerError().build();
        }
    }

    /**
     * GET /api/v1/graph/stats
     */
    @GetMapping("/graph/stats")
    public ResponseEntity<GraphStats> getStats() {
        try {
            return ResponseEntity.ok(graphStore.stats());
        } catch (Exception e) {
            log.error("Failed to get graph stats", e);
            return ResponseEntity.internalServerError().build();
        }
    }

    /**
     * A node with its incident edges, deprecated nodes included.
     *
     * GET /api/v1/graph/nodes/{nodeId}
     */
    @GetMapping("/graph/nodes/{nodeId}")
    public ResponseEntity<NodeDetails> getNode(@PathVariable String nodeId) {
        try {
            KnowledgeNode node = graphStore.getNode(nodeId);
            List<NodeDetails.Link> links = graphStore.neighbors(nodeId, RelationshipDirection.BOTH, null).stream()
                .map(neighbor -> toLink(nodeId, neighbor))
                .toList();
            return ResponseEntity.ok(NodeDetails.builder().node(node).links(links).build());

        } catch (NodeNotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (Exception e) {
            log.error("Failed to get node {}", nodeId, e);
            return ResponseEntity.internalServerError().build();
        }
    }

    /**
     * Deprecate a node. It stays in the graph with its edges.
     *
     * DELETE /api/v1/graph/nodes/{nodeId}
     */
    @DeleteMapping("/graph/nodes/{nodeId}")
    public ResponseEntity<KnowledgeNode> deprecateNode(@PathVariable String nodeId,
                                                       @RequestParam(defaultValue = "deprecated via API") String reason) {
        try {
            return ResponseEntity.ok(graphStore.deprecate(nodeId, reason));
        } catch (NodeNotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (Exception e) {
            log.error("Failed to deprecate node {}", nodeId, e);
            return ResponseEntity.internalServerError().build();
        }
    }

    /**
     * Reinforce a node, reactivating it if it was deprecated.
     *
     * POST /api/v1/graph/nodes/{nodeId}/reinforce
     */
    @PostMapping("/graph/nodes/{nodeId}/reinforce")
    public ResponseEntity<KnowledgeNode> reinforceNode(@PathVariable String nodeId) {
        try {
            return ResponseEntity.ok(feedbackService.reinforce(nodeId));
        } catch (NodeNotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (InvalidOperatorException e) {
            log.warn("Reinforcement rejected: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.CONFLICT).build();
        } catch (Exception e) {
            log.error("Failed to reinforce node {}", nodeId, e);
            return ResponseEntity.internalServerError().build();
        }
    }

    /**
     * The user confirmed a node.
     *
     * POST /api/v1/graph/nodes/{nodeId}/confirm
     */
    @PostMapping("/graph/nodes/{nodeId}/confirm")
    public ResponseEntity<KnowledgeNode> confirmNode(@PathVariable String nodeId) {
        try {
            return ResponseEntity.ok(feedbackService.confirm(nodeId));
        } catch (NodeNotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (InvalidOperatorException e) {
            log.warn("Confirmation rejected: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.CONFLICT).build();
        } catch (Exception e) {
            log.error("Failed to confirm node {}", nodeId, e);
            return ResponseEntity.internalServerError().build();
        }
    }

    /**
     * Nodes a response drew on.
     *
     * POST /api/v1/feedback/used
     */
    @PostMapping("/feedback/used")
    public ResponseEntity<UsageFeedback> nodesUsed(@RequestBody UsedNodesRequest request) {
        try {
            if (request.getNodeIds() == null || request.getNodeIds().isEmpty()) {
                return ResponseEntity.badRequest().build();
            }
            return ResponseEntity.ok(feedbackService.boostUsed(request.getNodeIds()));
        } catch (Exception e) {
            log.error("Usage feedback failed", e);
            return ResponseEntity.internalServerError().build();
        }
    }

    /**
     * Run a maintenance pass now and persist the result.
     *
     * POST /api/v1/maintenance
     */
    @PostMapping("/maintenance")
    public ResponseEntity<MaintenanceReport> runMaintenance() {
        try {
            return ResponseEntity.ok(maintenanceScheduler.runAndPersist());
        } catch (Exception e) {
            log.error("Maintenance pass failed", e);
            return ResponseEntity.internalServerError().build();
        }
    }

    private static NodeDetails.Link toLink(String nodeId, Neighbor neighbor) {
        boolean outgoing = neighbor.edge().getSource().equals(nodeId);
        return NodeDetails.Link.builder()
            .direction(outgoing ? "outgoing" : "incoming")
            .relation(neighbor.edge().getRelation())
            .weight(neighbor.edge().getWeight())
            .nodeId(neighbor.node().getId())
            .label(neighbor.node().getLabel())
            .status(neighbor.node().getStatus())
            .build();
    }
}
