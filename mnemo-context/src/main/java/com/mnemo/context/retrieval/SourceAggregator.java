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

package com.mnemo.context.retrieval;

import com.mnemo.context.model.Citation;
import com.mnemo.context.model.ScoredCandidate;
import com.mnemo.context.scoring.RequestContext;
import com.mnemo.core.config.ContextPolicy;
import com.mnemo.core.utils.MnemoUtils;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Merges candidates from all tiers. Duplicates by source id keep the higher score. The result is sorted by final
 * score (ties by source id), trimmed to top-k and carries citations. A failing source contributes nothing.
 */
@Slf4j
public class SourceAggregator {
    public static final Comparator<ScoredCandidate> BY_SCORE = Comparator
            .comparingDouble(ScoredCandidate::finalScore)
            .reversed()
            .thenComparing(ScoredCandidate::getSourceId);

    private final List<CandidateSource> sources;
    private final TouchDispatcher touchDispatcher;

    public SourceAggregator(@NonNull List<CandidateSource> sources, TouchDispatcher touchDispatcher) {
        this.sources = List.copyOf(sources);
        this.touchDispatcher = touchDispatcher;
    }

    public AggregationResult aggregate(@NonNull RequestContext context, @NonNull ContextPolicy policy) {
        final var best = new LinkedHashMap<String, ScoredCandidate>();
        final var failed = new ArrayList<String>();
        var fetched = 0;
        for (final var source : sources) {
            final List<ScoredCandidate> candidates;
            try {
                candidates = source.fetch(context, policy);
            }
            catch (Exception e) {
                log.warn("Candidate source {} failed, continuing without it: {}",
                         source.name(), MnemoUtils.errorMessage(e));
                failed.add(source.name());
                continue;
            }
            fetched += candidates.size();
            candidates.forEach(candidate -> best.merge(candidate.getSourceId(), candidate,
                                                       (existing, incoming) ->
                                                               incoming.finalScore() > existing.finalScore()
                                                               ? incoming
                                                               : existing));
        }
        final var ranked = best.values()
                .stream()
                .sorted(BY_SCORE)
                .limit(policy.getTopK())
                .map(SourceAggregator::withCitation)
                .toList();
        if (touchDispatcher != null) {
            touchDispatcher.touch(ranked.stream()
                                          .filter(candidate -> candidate.getOrigin().isStored())
                                          .map(ScoredCandidate::getSourceId)
                                          .toList());
        }
        log.debug("Aggregated {} candidates from {} fetched, {} sources failed",
                  ranked.size(), fetched, failed.size());
        return AggregationResult.builder()
                .candidates(ranked)
                .failedSources(List.copyOf(failed))
                .fetchedCount(fetched)
                .build();
    }

    private static ScoredCandidate withCitation(ScoredCandidate candidate) {
        return candidate.withCitation(Citation.builder()
                                              .sourceId(candidate.getSourceId())
                                              .origin(candidate.getOrigin().getLabel())
                                              .relevance(candidate.getScores().getRelevance())
                                              .excerpt(MnemoUtils.excerpt(candidate.getContent(),
                                                                          Citation.MAX_EXCERPT_CHARS))
                                              .build());
    }
}
