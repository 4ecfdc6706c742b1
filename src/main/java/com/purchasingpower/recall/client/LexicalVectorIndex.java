package com.purchasingpower.recall.client;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Deterministic similarity over content tokens, used when no embedding model
 * is configured.
 *
 * <p>Score is the Dice coefficient of the two token sets. Tokens of five or more
 * characters also match when one is a prefix of the other, so "postgres" and
 * "postgresql" count as the same token.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.vector.provider", havingValue = "lexical", matchIfMissing = true)
public class LexicalVectorIndex implements VectorSimilarityClient {

    private static final int PREFIX_MATCH_MIN_LENGTH = 5;

    private static final Set<String> STOPWORDS = Set.of(
        "a", "an", "and", "are", "as", "at", "be", "by", "do", "does", "for", "from", "how",
        "i", "in", "is", "it", "of", "on", "or", "the", "to", "was", "what", "when", "where",
        "which", "who", "why", "with", "you", "your"
    );

    private final Map<String, Map<String, Set<String>>> collections = new ConcurrentHashMap<>();

    @Override
    public List<VectorMatch> similar(String collection, String text, int topK, double threshold) {
        Set<String> query = tokenize(text);
        if (query.isEmpty()) {
            return List.of();
        }

        List<VectorMatch> matches = new ArrayList<>();
        collections.getOrDefault(collection, Map.of()).forEach((itemId, tokens) -> {
            double score = dice(query, tokens);
            if (score > 0.0 && score >= threshold) {
                matches.add(new VectorMatch(itemId, score));
            }
        });

        matches.sort(Comparator.comparingDouble(VectorMatch::score).reversed()
            .thenComparing(VectorMatch::itemId));
        return matches.size() > topK ? List.copyOf(matches.subList(0, topK)) : matches;
    }

    @Override
    public void index(String collection, String itemId, String text) {
        collections.computeIfAbsent(collection, k -> new ConcurrentHashMap<>()).put(itemId, tokenize(text));
        log.debug("Indexed {} in '{}'", itemId, collection);
    }

    @Override
    public void remove(String collection, String itemId) {
        Map<String, Set<String>> items = collections.get(collection);
        if (items != null) {
            items.remove(itemId);
        }
    }

    @Override
    public String getProviderName() {
        return "Lexical";
    }

    static Set<String> tokenize(String text) {
        Set<String> tokens = new LinkedHashSet<>();
        if (text == null) {
            return tokens;
        }
        for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (token.length() > 1 && !STOPWORDS.contains(token)) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    static double dice(Set<String> left, Set<String> right) {
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        Set<String> smaller = left.size() <= right.size() ? left : right;
        Set<String> larger = smaller == left ? right : left;

        int shared = 0;
        for (String token : smaller) {
            if (larger.stream().anyMatch(other -> sameToken(token, other))) {
                shared++;
            }
        }
        return 2.0 * shared / (left.size() + right.size());
    }

    private static boolean sameToken(String a, String b) {
        if (a.equals(b)) {
            return true;
        }
        if (a.length() < PREFIX_MATCH_MIN_LENGTH || b.length() < PREFIX_MATCH_MIN_LENGTH) {
            return false;
        }
        return a.startsWith(b) || b.startsWith(a);
    }
}
