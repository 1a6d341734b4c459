package com.mnemo.storage.inmemory;

import com.mnemo.core.semantic.SemanticIndex;
import com.mnemo.core.semantic.SemanticMatch;
import com.mnemo.core.utils.VectorUtils;
import lombok.NonNull;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Brute force cosine similarity index
 */
public class InMemorySemanticIndex implements SemanticIndex {
    private record Entry(String id, String content, float[] vector, Map<String, String> metadata) {
    }

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    public void index(@NonNull String id, @NonNull String content, @NonNull float[] vector, Map<String, String> metadata) {
        entries.put(id, new Entry(id, content, vector, metadata == null ? Map.of() : Map.copyOf(metadata)));
    }

    public void remove(String id) {
        entries.remove(id);
    }

    @Override
    public List<SemanticMatch> search(@NonNull float[] queryEmbedding, double threshold, int count) {
        return entries.values()
                .stream()
                .map(entry -> SemanticMatch.builder()
                        .id(entry.id())
                        .content(entry.content())
                        .metadata(entry.metadata())
                        .similarity(VectorUtils.cosineSimilarity(entry.vector(), queryEmbedding))
                        .build())
                .filter(match -> match.getSimilarity() >= threshold)
                .sorted(Comparator.comparingDouble(SemanticMatch::getSimilarity).reversed()
                                .thenComparing(SemanticMatch::getId))
                .limit(Math.max(0, count))
                .toList();
    }
}
