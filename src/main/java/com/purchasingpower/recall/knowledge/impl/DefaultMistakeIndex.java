package com.purchasingpower.recall.knowledge.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.recall.client.CollaboratorGuard;
import com.purchasingpower.recall.client.VectorMatch;
import com.purchasingpower.recall.client.VectorSimilarityClient;
import com.purchasingpower.recall.configuration.AppProperties;
import com.purchasingpower.recall.configuration.VectorProperties;
import com.purchasingpower.recall.core.KnowledgeNode;
import com.purchasingpower.recall.core.NodeType;
import com.purchasingpower.recall.core.RelationType;
import com.purchasingpower.recall.exception.CollaboratorTimeoutException;
import com.purchasingpower.recall.knowledge.GraphStore;
import com.purchasingpower.recall.knowledge.MistakeIndex;
import com.purchasingpower.recall.model.mistake.MistakeRecord;
import com.purchasingpower.recall.model.retrieval.MistakeWarning;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Mistake index over the graph plus the {@code mistakes} vector collection.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class DefaultMistakeIndex implements MistakeIndex {

    public static final String ATTR_QUESTION = "question";
    public static final String ATTR_WRONG_ANSWER = "wrongAnswer";
    public static final String ATTR_CORRECT_ANSWER = "correctAnswer";
    public static final String ATTR_SESSION_ID = "sessionId";

    private static final String COLLABORATOR = "vector-store";
    private static final int MAX_LABEL_CLAIM_LENGTH = 80;

    private final GraphStore graphStore;
    private final VectorSimilarityClient vectorClient;
    private final CollaboratorGuard guard;
    private final VectorProperties vectorProperties;

    private final Set<String> unindexed = ConcurrentHashMap.newKeySet();

    public DefaultMistakeIndex(GraphStore graphStore,
                               VectorSimilarityClient vectorClient,
                               CollaboratorGuard guard,
                               AppProperties properties) {
        this.graphStore = graphStore;
        this.vectorClient = vectorClient;
        this.guard = guard;
        this.vectorProperties = properties.getVector();
    }

    @Override
    public String resolveTarget(String relatedNodeId, String wrongClaim) {
        if (relatedNodeId != null && graphStore.findNode(relatedNodeId).isPresent()) {
            return relatedNodeId;
        }
        return graphStore.findActiveByLabel(wrongClaim)
            .map(KnowledgeNode::getId)
            .orElseGet(() -> graphStore.upsertNode(NodeType.FACT, wrongClaim, Map.of("origin", "mistake")));
    }

    @Override
    public String record(MistakeRecord record) {
        Preconditions.checkArgument(record.getWrongAnswer() != null && !record.getWrongAnswer().isBlank(),
            "Wrong answer is required");
        Preconditions.checkArgument(record.getCorrectAnswer() != null && !record.getCorrectAnswer().isBlank(),
            "Correct answer is required");

        String targetId = resolveTarget(record.getRelatedNodeId(), record.getWrongAnswer());

        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put(ATTR_QUESTION, record.effectiveQuestion());
        attributes.put(ATTR_WRONG_ANSWER, record.getWrongAnswer());
        attributes.put(ATTR_CORRECT_ANSWER, record.getCorrectAnswer());
        if (record.getSessionId() != null) {
            attributes.put(ATTR_SESSION_ID, record.getSessionId());
        }

        String mistakeId = graphStore.upsertNode(NodeType.MISTAKE, mistakeLabel(record), attributes);

        if (!mistakeId.equals(targetId)) {
            Map<String, String> edgeAttributes = new LinkedHashMap<>();
            edgeAttributes.put("correction", record.getCorrectAnswer());
            if (record.getSessionId() != null) {
                edgeAttributes.put(ATTR_SESSION_ID, record.getSessionId());
            }
            graphStore.addEdge(mistakeId, targetId, RelationType.CORRECTS, 0.1, edgeAttributes);
        }

        log.info("📝 Mistake recorded: '{}' -> '{}'", record.getWrongAnswer(), record.getCorrectAnswer());
        return mistakeId;
    }

    @Override
    public boolean indexMistake(String mistakeNodeId) {
        Optional<KnowledgeNode> mistake = graphStore.findNode(mistakeNodeId);
        if (mistake.isEmpty() || mistake.get().getType() != NodeType.MISTAKE) {
            log.warn("⚠️ Cannot index mistake {}: no such mistake node", mistakeNodeId);
            return false;
        }
        if (!index(mistake.get())) {
            return false;
        }
        retryUnindexed();
        return true;
    }

    @Override
    public int rebuild() {
        List<KnowledgeNode> mistakes = graphStore.findNodesByType(NodeType.MISTAKE).stream()
            .filter(KnowledgeNode::isActive)
            .collect(Collectors.toList());
        for (int i = 0; i < mistakes.size(); i++) {
            if (!index(mistakes.get(i))) {
                mistakes.subList(i, mistakes.size()).forEach(m -> unindexed.add(m.getId()));
                log.warn("⚠️ Mistake index rebuild stopped after {} of {} mistakes", i, mistakes.size());
                return i;
            }
        }
        log.info("📚 Mistake index rebuilt: {} mistakes", mistakes.size());
        return mistakes.size();
    }

    /**
     * Ids currently awaiting a retry.
     */
    Set<String> pendingRetries() {
        return Set.copyOf(unindexed);
    }

    private boolean index(KnowledgeNode mistake) {
        String question = mistake.getAttributes().getOrDefault(ATTR_QUESTION, mistake.getLabel());
        try {
            guard.run(COLLABORATOR, timeout(),
                () -> vectorClient.index(VectorSimilarityClient.MISTAKES_COLLECTION, mistake.getId(), question));
            unindexed.remove(mistake.getId());
            return true;
        } catch (CollaboratorTimeoutException e) {
            unindexed.add(mistake.getId());
            log.warn("⚠️ Mistake {} not indexed: {}", mistake.getId(), e.getMessage());
            return false;
        }
    }

    private void retryUnindexed() {
        for (String mistakeId : List.copyOf(unindexed)) {
            Optional<KnowledgeNode> mistake = graphStore.findNode(mistakeId).filter(KnowledgeNode::isActive);
            if (mistake.isEmpty()) {
                unindexed.remove(mistakeId);
            } else if (!index(mistake.get())) {
                return;
            }
        }
    }

    @Override
    public List<MistakeWarning> warningsFor(String question) {
        if (question == null || question.isBlank()) {
            return List.of();
        }

        List<VectorMatch> matches;
        try {
            matches = guard.call(COLLABORATOR, timeout(), () -> vectorClient.similar(
                VectorSimilarityClient.MISTAKES_COLLECTION,
                question,
                vectorProperties.getMistakeTopK(),
                vectorProperties.getMistakeThreshold()));
        } catch (CollaboratorTimeoutException e) {
            log.warn("⚠️ Mistake lookup degraded to no warnings: {}", e.getMessage());
            return List.of();
        }

        List<MistakeWarning> warnings = new ArrayList<>();
        for (VectorMatch match : matches) {
            Optional<KnowledgeNode> node = graphStore.findNode(match.itemId());
            if (node.isEmpty() || !node.get().isActive() || node.get().getType() != NodeType.MISTAKE) {
                continue;
            }
            Map<String, String> attributes = node.get().getAttributes();
            warnings.add(MistakeWarning.builder()
                .question(attributes.get(ATTR_QUESTION))
                .wrongAnswer(attributes.get(ATTR_WRONG_ANSWER))
                .correctAnswer(attributes.get(ATTR_CORRECT_ANSWER))
                .mistakeNodeId(match.itemId())
                .similarity(match.score())
                .build());
        }

        if (!warnings.isEmpty()) {
            log.info("⚠️ {} past mistake(s) relevant to the question", warnings.size());
        }
        return warnings;
    }

    @Override
    public String formatWarningBlock(List<MistakeWarning> warnings) {
        if (warnings == null || warnings.isEmpty()) {
            return "";
        }
        StringBuilder block = new StringBuilder("KNOWN MISTAKES (do not repeat):\n");
        for (MistakeWarning warning : warnings) {
            block.append("- Q: ").append(warning.getQuestion())
                .append(" | wrong: ").append(warning.getWrongAnswer())
                .append(" | correct: ").append(warning.getCorrectAnswer())
                .append('\n');
        }
        return block.toString();
    }

    private Duration timeout() {
        return Duration.ofMillis(vectorProperties.getTimeoutMs());
    }

    private static String mistakeLabel(MistakeRecord record) {
        String claim = record.getWrongAnswer().trim();
        if (claim.length() > MAX_LABEL_CLAIM_LENGTH) {
            claim = claim.substring(0, MAX_LABEL_CLAIM_LENGTH);
        }
        return "Mistake: " + claim;
    }
}
