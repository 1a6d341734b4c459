package com.mnemo.core.decay;

import java.time.Instant;

/**
 * Maps the age of a record to a staleness score
 */
@FunctionalInterface
public interface DecayModel {
    /**
     * Compute the decay score for a record last accessed at the given time.
     *
     * @param lastAccessedAt When the record was last touched
     * @param now            Evaluation instant
     * @return Score in [0, 1], higher is staler. Must be non-decreasing in {@code now}.
     */
    double decay(Instant lastAccessedAt, Instant now);
}
