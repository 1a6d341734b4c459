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

package com.mnemo.context.window;

import com.mnemo.core.config.ContextPolicy;
import com.mnemo.core.conversation.ConversationTurn;
import com.mnemo.core.conversation.ConversationWindow;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Keeps the short-term conversation window within its budget
 */
@Slf4j
public class WindowCompactor {

    /**
     * Newest turns that fit in the budget, in chronological order. Stops at the first turn that does not fit.
     */
    public List<ConversationTurn> select(@NonNull List<ConversationTurn> turns, int tokenBudget) {
        final var selected = new ArrayList<ConversationTurn>();
        var used = 0;
        for (int i = turns.size() - 1; i >= 0; i--) {
            final var turn = turns.get(i);
            if (used + turn.getTokenCount() > tokenBudget) {
                break;
            }
            used += turn.getTokenCount();
            selected.add(turn);
        }
        Collections.reverse(selected);
        return List.copyOf(selected);
    }

    /**
     * Window tokens as a share of the window budget
     */
    public double windowPressure(@NonNull ConversationWindow window, @NonNull ContextPolicy policy) {
        return (double) window.totalTokens() / Math.max(1, policy.getBudgets().getWindowTokens());
    }

    /**
     * Evict the oldest turns when pressure has reached the trigger ratio. Eviction stops once the window is within
     * {@code floor(windowTokens * compactionTargetRatio)} or only {@code minRetainedTurns} turns are left.
     * The compaction pass counter goes up by one when anything was evicted.
     *
     * @param window   Current window
     * @param policy   Policy in effect
     * @param pressure Budget pressure of the request
     * @return The compacted window and what was evicted
     */
    public CompactionResult compact(@NonNull ConversationWindow window, @NonNull ContextPolicy policy, double pressure) {
        final var target = (int) Math.floor(policy.getBudgets().getWindowTokens() * policy.getCompactionTargetRatio());
        if (pressure < policy.getTriggerRatio()) {
            return CompactionResult.builder()
                    .window(window)
                    .triggered(false)
                    .targetTokens(target)
                    .build();
        }
        final var remaining = new ArrayDeque<>(window.getTurns());
        final var evicted = new ArrayList<ConversationTurn>();
        var total = window.totalTokens();
        while (total > target && remaining.size() > policy.getMinRetainedTurns()) {
            final var oldest = remaining.removeFirst();
            evicted.add(oldest);
            total -= oldest.getTokenCount();
        }
        if (evicted.isEmpty()) {
            return CompactionResult.builder()
                    .window(window)
                    .triggered(true)
                    .targetTokens(target)
                    .build();
        }
        final var compacted = window
                .withTurns(List.copyOf(remaining))
                .withCompactionPass(window.getCompactionPass() + 1);
        log.info("Compacted window {}: evicted {} turns, {} tokens left (target {}), pass {}",
                 window.getConversationId(), evicted.size(), total, target, compacted.getCompactionPass());
        return CompactionResult.builder()
                .window(compacted)
                .evicted(List.copyOf(evicted))
                .triggered(true)
                .targetTokens(target)
                .build();
    }
}
