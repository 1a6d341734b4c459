package com.mnemo.context;

import com.mnemo.context.packing.TokenBreakdown;
import com.mnemo.core.jobs.TriggerReason;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Record of the decisions taken while assembling one prompt
 */
@Value
@Builder
public class ContextTrace {
    String traceId;
    String userId;
    String sessionId;
    String policyId;
    List<String> activeSkills;
    int fetchedCandidates;
    List<String> failedSources;
    List<String> packedIds;
    /**
     * Dropped candidate id to drop reason
     */
    Map<String, String> dropped;
    TokenBreakdown tokenBreakdown;
    double budgetPressure;
    int evictedTurns;
    TriggerReason triggerReason;
    long elapsedMillis;
}
