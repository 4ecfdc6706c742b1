package com.purchasingpower.recall.support;

import com.purchasingpower.recall.client.VectorMatch;
import com.purchasingpower.recall.client.VectorSimilarityClient;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Vector collaborator that is always down.
 */
public class FailingVectorClient implements VectorSimilarityClient {

    private final AtomicInteger calls = new AtomicInteger();

    @Override
    public List<VectorMatch> similar(String collection, String text, int topK, double threshold) {
        calls.incrementAndGet();
        throw new IllegalStateException("vector store unavailable");
    }

    @Override
    public void index(String collection, String itemId, String text) {
        calls.incrementAndGet();
        throw new IllegalStateException("vector store unavailable");
    }

    @Override
    public void remove(String collection, String itemId) {
        calls.incrementAndGet();
        throw new IllegalStateException("vector store unavailable");
    }

    @Override
    public String getProviderName() {
        return "Failing";
    }

    public int calls() {
        return calls.get();
    }
}
