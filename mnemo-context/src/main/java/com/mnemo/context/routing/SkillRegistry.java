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

package com.mnemo.context.routing;

import lombok.NonNull;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Static table of skills, compiled once and evaluated in priority order
 */
public class SkillRegistry {
    public static final String GENERAL = "general";

    public static final Comparator<SkillFragment> BY_PRIORITY = Comparator
            .comparingInt(SkillFragment::getPriority)
            .reversed()
            .thenComparing(SkillFragment::getId);

    private static final List<SkillFragment> BUILT_INS = List.of(
            SkillFragment.builder()
                    .id(GENERAL)
                    .name("General Assistant")
                    .priority(0)
                    .tokenBudget(200)
                    .fragment("""
                              You are a helpful, precise, and memory-aware assistant.
                              You have access to conversation history and retrieved memories.
                              Use context efficiently. Be concise unless depth is requested.
                              When referencing retrieved memories, cite them explicitly.""")
                    .build(),
            SkillFragment.builder()
                    .id("code")
                    .name("Code Assistant")
                    .trigger(Pattern.compile(
                            "\\b(code|function|debug|implement|refactor|typescript|javascript|python|java|sql|api"
                                    + "|bug|error|class|type|interface|module)\\b",
                            Pattern.CASE_INSENSITIVE))
                    .priority(10)
                    .tokenBudget(300)
                    .fragment("""
                              You are also an expert software engineer.
                              When writing code: add inline comments and consider edge cases.
                              Format code in proper markdown blocks with language tags.
                              For complex functions, describe the approach before the code.""")
                    .build(),
            SkillFragment.builder()
                    .id("research")
                    .name("Research Mode")
                    .trigger(Pattern.compile(
                            "\\b(research|analyze|compare|explain|why|how does|what is|deep dive|summarize|overview)\\b",
                            Pattern.CASE_INSENSITIVE))
                    .priority(5)
                    .tokenBudget(250)
                    .fragment("""
                              You are also a thorough researcher.
                              Structure complex answers with clear sections. Cite reasoning explicitly.
                              When uncertain, state your confidence level.
                              Provide balanced perspectives for ambiguous questions.""")
                    .build(),
            SkillFragment.builder()
                    .id("memory_aware")
                    .name("Memory-Aware Mode")
                    .trigger(Pattern.compile(
                            "\\b(remember|recall|earlier|before|last time|we discussed|you said|previously|in our"
                                    + "|you mentioned)\\b",
                            Pattern.CASE_INSENSITIVE))
                    .priority(15)
                    .tokenBudget(150)
                    .fragment("""
                              The user is referencing prior context.
                              Check the retrieved memories carefully and reference relevant prior context explicitly.
                              If you don't find the referenced memory, say so clearly.""")
                    .build(),
            SkillFragment.builder()
                    .id("project_scope")
                    .name("Project Scope")
                    .trigger(Pattern.compile(
                            "\\b(project|workspace|this project|our project|in this context|for this|project memory)\\b",
                            Pattern.CASE_INSENSITIVE))
                    .priority(8)
                    .tokenBudget(200)
                    .fragment("""
                              You are working within a specific project context.
                              Prioritize project-scoped memories and knowledge.
                              Consider the project's goals, conventions, and constraints from memory.""")
                    .build());

    private final List<SkillFragment> skills;

    public SkillRegistry(@NonNull List<SkillFragment> skills) {
        this.skills = skills.stream()
                .sorted(BY_PRIORITY)
                .toList();
    }

    public static SkillRegistry builtIn() {
        return new SkillRegistry(BUILT_INS);
    }

    /**
     * Built-in skills plus the given extra ones
     */
    public static SkillRegistry withExtraSkills(@NonNull List<SkillFragment> extra) {
        final var all = new ArrayList<>(BUILT_INS);
        all.addAll(extra);
        return new SkillRegistry(all);
    }

    /**
     * Skills triggered by the message or forced on by hints, highest priority first. The general skill is always
     * included when registered.
     */
    public List<SkillFragment> activate(String message, @NonNull Set<String> hints) {
        final var active = new ArrayList<SkillFragment>();
        for (final var skill : skills) {
            if (skill.isEnabled() && (hints.contains(skill.getId()) || skill.triggeredBy(message))) {
                active.add(skill);
            }
        }
        if (active.stream().noneMatch(skill -> skill.getId().equals(GENERAL))) {
            find(GENERAL).ifPresent(active::add);
        }
        active.sort(BY_PRIORITY);
        return List.copyOf(active);
    }

    public Optional<SkillFragment> find(String id) {
        return skills.stream()
                .filter(skill -> skill.getId().equals(id))
                .findFirst();
    }

    public List<SkillFragment> all() {
        return skills;
    }
}
