package com.purchasingpower.recall.client;

import com.purchasingpower.recall.configuration.AppProperties;
import com.purchasingpower.recall.configuration.OllamaProperties;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.ollama.OllamaEmbeddingModel;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * LangChain4j-backed similarity: Ollama embeddings kept in one in-memory
 * embedding store per collection.
 *
 * <p>Scores are reported as cosine similarity, and thresholds are cosine
 * thresholds as well.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.vector.provider", havingValue = "ollama")
public class LangChain4jVectorIndex implements VectorSimilarityClient {

    private final EmbeddingModel embeddingModel;
    private final Map<String, InMemoryEmbeddingStore<TextSegment>> stores = new ConcurrentHashMap<>();

    @Autowired
    public LangChain4jVectorIndex(AppProperties properties) {
        OllamaProperties ollama = properties.getOllama();

        log.info("🔷 Initializing LangChain4j vector index");
        log.info("   - Ollama URL: {}", ollama.getBaseUrl());
        log.info("   - Model: {}", ollama.getEmbeddingModel());

        this.embeddingModel = OllamaEmbeddingModel.builder()
                .baseUrl(ollama.getBaseUrl())
                .modelName(ollama.getEmbeddingModel())
                .timeout(Duration.ofSeconds(ollama.getTimeoutSeconds()))
                .maxRetries(ollama.getMaxRetries())
                .logRequests(false)
                .logResponses(false)
                .build();

        log.info("✅ LangChain4j vector index initialized");
    }

    LangChain4jVectorIndex(EmbeddingModel embeddingModel) {
        this.embeddingModel = embeddingModel;
    }

    @Override
    public List<VectorMatch> similar(String collection, String text, int topK, double threshold) {
        InMemoryEmbeddingStore<TextSegment> store = stores.get(collection);
        if (store == null || text == null || text.isBlank()) {
            return List.of();
        }

        Embedding query = embed(text);
        EmbeddingSearchRequest request = EmbeddingSearchRequest.builder()
                .queryEmbedding(query)
                .maxResults(topK)
                .minScore(toRelevance(threshold))
                .build();

        List<EmbeddingMatch<TextSegment>> matches = store.search(request).matches();
        log.debug("🔷 '{}' query matched {} items", collection, matches.size());

        return matches.stream()
                .map(m -> new VectorMatch(m.embeddingId(), toCosine(m.score())))
                .collect(Collectors.toList());
    }

    @Override
    public void index(String collection, String itemId, String text) {
        Embedding embedding = embed(text);
        InMemoryEmbeddingStore<TextSegment> store = stores.computeIfAbsent(collection, k -> new InMemoryEmbeddingStore<>());
        store.removeAll(List.of(itemId));
        store.add(itemId, embedding);
        log.debug("✅ Indexed {} in '{}' ({} dimensions)", itemId, collection, embedding.dimension());
    }

    @Override
    public void remove(String collection, String itemId) {
        InMemoryEmbeddingStore<TextSegment> store = stores.get(collection);
        if (store != null) {
            store.removeAll(List.of(itemId));
        }
    }

    @Override
    public String getProviderName() {
        return "LangChain4j/Ollama";
    }

    // The in-memory store reports relevance as (cosine + 1) / 2
    private static double toRelevance(double cosine) {
        return (cosine + 1.0) / 2.0;
    }

    private static double toCosine(double relevance) {
        return 2.0 * relevance - 1.0;
    }

    private Embedding embed(String text) {
        try {
            Response<Embedding> response = embeddingModel.embed(text);
            return response.content();
        } catch (Exception e) {
            log.error("❌ Failed to generate embedding after retries: {}", e.getMessage());
            throw new RuntimeException("Embedding generation failed", e);
        }
    }
}
