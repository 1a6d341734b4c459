package com.mnemo.context.retrieval;

import com.mnemo.context.model.ScoredCandidate;
import com.mnemo.context.scoring.RequestContext;
import com.mnemo.core.config.ContextPolicy;

import java.util.List;

/**
 * A tier that can offer scored context candidates for a request
 */
public interface CandidateSource {
    String name();

    /**
     * Fetch and score at most {@code policy.topK * policy.candidatePoolMultiplier} candidates.
     *
     * @param context Current request
     * @param policy  Policy in effect
     * @return Scored candidates, never null
     */
    List<ScoredCandidate> fetch(RequestContext context, ContextPolicy policy);

    static int poolSize(ContextPolicy policy) {
        return policy.getTopK() * policy.getCandidatePoolMultiplier();
    }
}
