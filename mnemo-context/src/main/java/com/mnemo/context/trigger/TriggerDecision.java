package com.mnemo.context.trigger;

import com.mnemo.core.jobs.TriggerReason;
import lombok.Value;

/**
 * Whether a consolidation job should be enqueued, and why
 */
@Value
public class TriggerDecision {
    boolean shouldEnqueue;
    TriggerReason reason;
    double pressure;
}
