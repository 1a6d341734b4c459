package com.mnemo.core.semantic;

import java.util.List;

/**
 * Optional vector similarity index over documents and memories
 */
public interface SemanticIndex {
    /**
     * Nearest neighbours of the query vector
     *
     * @param queryEmbedding Query vector
     * @param threshold      Minimum similarity to return
     * @param count          Maximum matches
     * @return Matches sorted by similarity, highest first
     */
    List<SemanticMatch> search(float[] queryEmbedding, double threshold, int count);
}
