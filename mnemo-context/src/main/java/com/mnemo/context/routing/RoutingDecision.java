package com.mnemo.context.routing;

import com.mnemo.core.memory.MemoryScope;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Value
@Builder
public class RoutingDecision {
    @Builder.Default
    List<SkillFragment> activeSkills = List.of();

    @Builder.Default
    Set<MemoryScope> scopes = Set.of(MemoryScope.CONVERSATION);

    /**
     * Policy id the message hints at, such as "fast" for a quick question. Callers may ignore it.
     */
    String suggestedPolicy;

    /**
     * True when the message is long or refers back to earlier context
     */
    boolean deepRetrieval;

    public Set<String> activeSkillIds() {
        return activeSkills.stream()
                .map(SkillFragment::getId)
                .collect(Collectors.toUnmodifiableSet());
    }
}
