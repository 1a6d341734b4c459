package com.mnemo.context.trigger;

import com.mnemo.core.config.ContextPolicy;
import com.mnemo.core.jobs.TriggerReason;
import com.mnemo.core.privacy.MemoryPermissions;
import lombok.NonNull;

/**
 * Decides when a conversation should be handed to the consolidation worker.
 * Session end wins over token pressure, which wins over a manual request.
 * <p>
 * Summary write permission gates every reason, manual requests included. The privacy gate withdraws it for
 * conversations carrying a forget directive, and such a conversation is never consolidated, even by callers that
 * pass their own permissions with semantic writes still allowed.
 */
public class ConsolidationTrigger {

    public TriggerDecision evaluate(
            double pressure,
            @NonNull ContextPolicy policy,
            @NonNull MemoryPermissions permissions,
            boolean sessionEnd,
            boolean manual) {
        if (!permissions.isCanWriteSummary()) {
            return new TriggerDecision(false, null, pressure);
        }
        if (sessionEnd) {
            return new TriggerDecision(true, TriggerReason.SESSION_END, pressure);
        }
        if (pressure >= policy.getTriggerRatio()) {
            return new TriggerDecision(true, TriggerReason.TOKEN_PRESSURE, pressure);
        }
        if (manual) {
            return new TriggerDecision(true, TriggerReason.MANUAL, pressure);
        }
        return new TriggerDecision(false, null, pressure);
    }
}
