/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.mnemo.context.scoring;

import com.mnemo.context.model.ScoreVector;
import com.mnemo.core.decay.LogisticDecayModel;
import com.mnemo.core.memory.MemoryKind;
import com.mnemo.core.memory.MemoryRecord;
import com.mnemo.core.memory.MemoryScope;
import com.mnemo.core.utils.VectorUtils;
import lombok.NonNull;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Scores a memory against the current request on six dimensions and combines them with a {@link WeightProfile}.
 * Stateless and deterministic for a given request context.
 */
public class CandidateScorer {
    private static final double RECENCY_HALF_LIFE_HOURS = 24.0;
    private static final double GLOBAL_SCOPE_MATCH = 1.0;
    private static final double ACTIVE_SCOPE_MATCH = 0.9;
    private static final double OTHER_SCOPE_MATCH = 0.3;

    private final LexicalTokenizer tokenizer;

    public CandidateScorer() {
        this(new LexicalTokenizer());
    }

    public CandidateScorer(@NonNull LexicalTokenizer tokenizer) {
        this.tokenizer = tokenizer;
    }

    public ScoreVector score(@NonNull MemoryRecord memoryRecord, @NonNull RequestContext context) {
        return score(memoryRecord, context, null);
    }

    /**
     * Score a record.
     *
     * @param memoryRecord          The record
     * @param context               Current request
     * @param precomputedSimilarity Similarity already computed by a semantic index, or null
     * @return Sub-scores and final score
     */
    public ScoreVector score(
            @NonNull MemoryRecord memoryRecord,
            @NonNull RequestContext context,
            Double precomputedSimilarity) {
        final boolean semantic;
        final double relevance;
        if (precomputedSimilarity != null) {
            semantic = true;
            relevance = VectorUtils.clamp(precomputedSimilarity, 0.0, 1.0);
        }
        else if (context.hasQueryEmbedding() && memoryRecord.getEmbedding() != null) {
            semantic = true;
            relevance = VectorUtils.clamp(
                    VectorUtils.cosineSimilarity(context.getQueryEmbedding(), memoryRecord.getEmbedding()), 0.0, 1.0);
        }
        else {
            semantic = false;
            relevance = tokenizer.overlap(context.getQuery(), memoryRecord.getContent());
        }
        final var lastAccess = Objects.requireNonNullElse(
                memoryRecord.getLastAccessedAt(),
                Objects.requireNonNullElse(memoryRecord.getCreatedAt(), context.getNow()));
        final var recency = recency(lastAccess, context.getNow());
        final var scopeMatch = scopeMatch(memoryRecord.getScope(), context.getActiveScopes());
        final var typePriority = typePriority(memoryRecord.getKind());
        final var decayPenalty = VectorUtils.clamp(memoryRecord.getDecayScore(), 0.0, 1.0);
        final var skillWeight = skillWeight(memoryRecord.getTags(), context.getActiveSkillTags());
        final var profile = WeightProfile.select(semantic);
        return ScoreVector.builder()
                .relevance(relevance)
                .recency(recency)
                .scopeMatch(scopeMatch)
                .typePriority(typePriority)
                .decayPenalty(decayPenalty)
                .skillWeight(skillWeight)
                .finalScore(profile.combine(relevance, recency, scopeMatch, typePriority, decayPenalty, skillWeight))
                .profile(profile)
                .build();
    }

    /**
     * Exponential with a one day half-life
     */
    public static double recency(Instant lastAccessedAt, Instant now) {
        final var hours = Math.max(0.0, LogisticDecayModel.ageInHours(lastAccessedAt, now));
        return Math.exp(-Math.log(2) * hours / RECENCY_HALF_LIFE_HOURS);
    }

    public static double scopeMatch(MemoryScope scope, Set<MemoryScope> activeScopes) {
        if (scope == MemoryScope.GLOBAL) {
            return GLOBAL_SCOPE_MATCH;
        }
        return activeScopes.contains(scope) ? ACTIVE_SCOPE_MATCH : OTHER_SCOPE_MATCH;
    }

    public static double typePriority(MemoryKind kind) {
        return switch (kind) {
            case SUMMARY -> 1.0;
            case SEMANTIC -> 0.85;
            case EPISODIC -> 0.65;
        };
    }

    /**
     * Share of the record's tags that belong to active skills
     */
    public static double skillWeight(List<String> tags, Set<String> activeTags) {
        if (tags == null || tags.isEmpty() || activeTags.isEmpty()) {
            return 0.0;
        }
        final var overlap = tags.stream()
                .filter(activeTags::contains)
                .count();
        return (double) overlap / tags.size();
    }
}
